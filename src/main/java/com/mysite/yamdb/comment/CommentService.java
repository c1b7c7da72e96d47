package com.mysite.yamdb.comment;

import com.mysite.yamdb.handler.ApiException;
import com.mysite.yamdb.review.ReviewEntity;
import com.mysite.yamdb.review.ReviewRepository;
import com.mysite.yamdb.user.SiteUser;
import com.mysite.yamdb.util.PageSelector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 리뷰에 달린 댓글 조회/작성.
 * <p>
 * API 경로는 작품 → 리뷰 → 댓글 순으로 중첩되므로
 * 리뷰가 경로의 작품에, 댓글이 경로의 리뷰에 속하지 않으면 404 로 처리한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommentService {

    private final CommentRepository commentRepository;
    private final ReviewRepository reviewRepository;

    @Transactional(readOnly = true)
    public Page<CommentEntity> listByReview(Long titleId, Long reviewId, String page, int pageSize) {
        ReviewEntity review = requireReview(titleId, reviewId);
        return listByReview(review, page, pageSize);
    }

    public Page<CommentEntity> listByReview(ReviewEntity review, String page, int pageSize) {
        return PageSelector.select(page, pageSize,
                pageable -> commentRepository.findByReview_IdOrderByPubDateDescIdDesc(review.getId(), pageable));
    }

    public CommentEntity get(Long titleId, Long reviewId, Long commentId) {
        requireReview(titleId, reviewId);
        return get(reviewId, commentId);
    }

    public CommentEntity get(Long reviewId, Long commentId) {
        return commentRepository.findByIdAndReview_Id(commentId, reviewId).orElseThrow(ApiException::notFound);
    }

    @Transactional
    public CommentEntity create(Long titleId, Long reviewId, SiteUser author, CommentRequest request) {
        return create(requireReview(titleId, reviewId), author, request);
    }

    @Transactional
    public CommentEntity create(ReviewEntity review, SiteUser author, CommentRequest request) {
        CommentEntity comment = new CommentEntity();
        comment.setReview(review);
        comment.setAuthor(author);
        comment.setText(request.text());

        CommentEntity saved = commentRepository.save(comment);
        log.info("댓글 작성: id={}, author={}, review={}", saved.getId(), author.getUsername(), review.getId());
        return saved;
    }

    @Transactional
    public CommentEntity update(CommentEntity comment, CommentRequest request) {
        if (request.text() != null) {
            comment.setText(request.text());
        }
        return commentRepository.save(comment);
    }

    @Transactional
    public void delete(CommentEntity comment) {
        commentRepository.delete(comment);
        log.info("댓글 삭제: id={}", comment.getId());
    }

    private ReviewEntity requireReview(Long titleId, Long reviewId) {
        return reviewRepository.findByIdAndTitle_Id(reviewId, titleId).orElseThrow(ApiException::notFound);
    }
}
