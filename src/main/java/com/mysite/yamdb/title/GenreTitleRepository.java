package com.mysite.yamdb.title;

import com.mysite.yamdb.genre.GenreEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface GenreTitleRepository extends JpaRepository<GenreTitleEntity, Long> {

    @Modifying
    @Query("delete from GenreTitleEntity gt where gt.genre = :genre")
    int deleteByGenre(@Param("genre") GenreEntity genre);
}
