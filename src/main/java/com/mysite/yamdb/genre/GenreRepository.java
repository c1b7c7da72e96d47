package com.mysite.yamdb.genre;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface GenreRepository extends JpaRepository<GenreEntity, Long> {

    Optional<GenreEntity> findBySlug(String slug);

    List<GenreEntity> findBySlugIn(Collection<String> slugs);

    boolean existsBySlug(String slug);

    Page<GenreEntity> findAllByOrderByIdAsc(Pageable pageable);

    Page<GenreEntity> findByNameContainingIgnoreCaseOrderByIdAsc(String name, Pageable pageable);
}
