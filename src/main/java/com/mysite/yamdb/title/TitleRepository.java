package com.mysite.yamdb.title;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TitleRepository extends JpaRepository<TitleEntity, Long> {

    /**
     * 필터를 적용한 작품 목록 + 평균 평점.
     * <p>
     * 각 행은 [TitleEntity, Double(평균, 리뷰가 없으면 null)].
     * 평점은 같은 SQL 안의 집계 서브쿼리로 계산한다.
     * 모든 필터는 null 이면 적용하지 않는다.
     */
    @Query(value = """
            select t, (select avg(r.score) from ReviewEntity r where r.title = t)
            from TitleEntity t
            join fetch t.category c
            where (:category is null or c.slug = :category)
              and (:genre is null or exists (
                    select gt.id from GenreTitleEntity gt
                    where gt.title = t and gt.genre.slug = :genre))
              and (:name is null or lower(t.name) like lower(concat('%', :name, '%')))
              and (:year is null or t.year = :year)
            order by t.year desc, t.id desc
            """,
            countQuery = """
            select count(t)
            from TitleEntity t
            join t.category c
            where (:category is null or c.slug = :category)
              and (:genre is null or exists (
                    select gt.id from GenreTitleEntity gt
                    where gt.title = t and gt.genre.slug = :genre))
              and (:name is null or lower(t.name) like lower(concat('%', :name, '%')))
              and (:year is null or t.year = :year)
            """)
    Page<Object[]> findWithRating(@Param("category") String category,
                                  @Param("genre") String genre,
                                  @Param("name") String name,
                                  @Param("year") Integer year,
                                  Pageable pageable);

    @Query("""
            select t, (select avg(r.score) from ReviewEntity r where r.title = t)
            from TitleEntity t
            join fetch t.category
            where t.id = :id
            """)
    List<Object[]> findByIdWithRating(@Param("id") Long id);

    // 메인 화면: 전체 작품, 카테고리 즉시 로딩
    @EntityGraph(attributePaths = "category")
    Page<TitleEntity> findAllByOrderByYearDescIdDesc(Pageable pageable);

    @EntityGraph(attributePaths = "category")
    Page<TitleEntity> findByCategory_IdOrderByYearDescIdDesc(Long categoryId, Pageable pageable);

    @Query(value = """
            select t from TitleEntity t
            join fetch t.category
            where exists (select gt.id from GenreTitleEntity gt where gt.title = t and gt.genre.id = :genreId)
            order by t.year desc, t.id desc
            """,
            countQuery = """
            select count(t) from TitleEntity t
            where exists (select gt.id from GenreTitleEntity gt where gt.title = t and gt.genre.id = :genreId)
            """)
    Page<TitleEntity> findByGenreId(@Param("genreId") Long genreId, Pageable pageable);
}
