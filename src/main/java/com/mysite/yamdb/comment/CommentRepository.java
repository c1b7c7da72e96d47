package com.mysite.yamdb.comment;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CommentRepository extends JpaRepository<CommentEntity, Long> {

    @EntityGraph(attributePaths = "author")
    Page<CommentEntity> findByReview_IdOrderByPubDateDescIdDesc(Long reviewId, Pageable pageable);

    // 경로의 리뷰에 속한 댓글만 찾는다
    @EntityGraph(attributePaths = "author")
    Optional<CommentEntity> findByIdAndReview_Id(Long id, Long reviewId);
}
