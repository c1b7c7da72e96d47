package com.mysite.yamdb.review;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ReviewRepository extends JpaRepository<ReviewEntity, Long> {

    @EntityGraph(attributePaths = "author")
    Page<ReviewEntity> findByTitle_IdOrderByPubDateDescIdDesc(Long titleId, Pageable pageable);

    // 경로의 작품에 속한 리뷰만 찾는다
    @EntityGraph(attributePaths = "author")
    Optional<ReviewEntity> findByIdAndTitle_Id(Long id, Long titleId);

    @EntityGraph(attributePaths = {"author", "title"})
    Optional<ReviewEntity> findWithAuthorAndTitleById(Long id);

    boolean existsByAuthor_IdAndTitle_Id(Long authorId, Long titleId);

    // 프로필 화면: 사용자가 쓴 리뷰
    @EntityGraph(attributePaths = {"author", "title"})
    Page<ReviewEntity> findByAuthor_IdOrderByPubDateDescIdDesc(Long authorId, Pageable pageable);

    // 검색 화면: 본문 부분 일치 (대소문자 무시)
    @EntityGraph(attributePaths = {"author", "title"})
    List<ReviewEntity> findByTextContainingIgnoreCaseOrderByPubDateDescIdDesc(String text);

    @Query("select avg(r.score) from ReviewEntity r where r.title.id = :titleId")
    Double averageScore(@Param("titleId") Long titleId);
}
