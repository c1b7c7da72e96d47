package com.mysite.yamdb.review;

import com.mysite.yamdb.handler.ApiException;
import com.mysite.yamdb.title.TitleEntity;
import com.mysite.yamdb.title.TitleRepository;
import com.mysite.yamdb.user.SiteUser;
import com.mysite.yamdb.util.PageSelector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 리뷰 조회/작성.
 * <p>
 * 한 사용자는 한 작품에 리뷰를 하나만 남길 수 있다.
 * 사전 확인을 통과한 동시 요청은 DB 유일성 제약에서 걸러지며 같은 검증 오류로 응답한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReviewService {

    public static final String DUPLICATE_REVIEW = "You can only leave one review per title.";

    private final ReviewRepository reviewRepository;
    private final TitleRepository titleRepository;

    @Transactional(readOnly = true)
    public Page<ReviewEntity> listByTitle(Long titleId, String page, int pageSize) {
        requireTitle(titleId);
        return PageSelector.select(page, pageSize,
                pageable -> reviewRepository.findByTitle_IdOrderByPubDateDescIdDesc(titleId, pageable));
    }

    public ReviewEntity get(Long titleId, Long reviewId) {
        requireTitle(titleId);
        return reviewRepository.findByIdAndTitle_Id(reviewId, titleId).orElseThrow(ApiException::notFound);
    }

    public ReviewEntity getById(Long reviewId) {
        return reviewRepository.findWithAuthorAndTitleById(reviewId).orElseThrow(ApiException::notFound);
    }

    @Transactional
    public ReviewEntity create(Long titleId, SiteUser author, ReviewRequest request) {
        TitleEntity title = requireTitle(titleId);
        if (reviewRepository.existsByAuthor_IdAndTitle_Id(author.getId(), titleId)) {
            throw ApiException.invalid(DUPLICATE_REVIEW);
        }

        ReviewEntity review = new ReviewEntity();
        review.setTitle(title);
        review.setAuthor(author);
        review.setText(request.text());
        review.setScore(request.score());

        try {
            reviewRepository.saveAndFlush(review);
        } catch (DataIntegrityViolationException e) {
            log.warn("리뷰 중복 (동시 요청): author={}, title={}", author.getUsername(), titleId);
            throw ApiException.invalid(DUPLICATE_REVIEW);
        }
        log.info("리뷰 작성: id={}, author={}, title={}", review.getId(), author.getUsername(), titleId);
        return review;
    }

    /**
     * 부분 수정. 작성자와 작품은 바뀌지 않는다.
     */
    @Transactional
    public ReviewEntity update(ReviewEntity review, ReviewRequest request) {
        if (request.text() != null) {
            review.setText(request.text());
        }
        if (request.score() != null) {
            review.setScore(request.score());
        }
        return reviewRepository.save(review);
    }

    @Transactional
    public void delete(ReviewEntity review) {
        reviewRepository.delete(review);
        log.info("리뷰 삭제: id={}", review.getId());
    }

    public Page<ReviewEntity> listByAuthor(SiteUser author, String page, int pageSize) {
        return PageSelector.select(page, pageSize,
                pageable -> reviewRepository.findByAuthor_IdOrderByPubDateDescIdDesc(author.getId(), pageable));
    }

    /**
     * 본문 검색. 검색어가 비어 있으면 null (결과 영역 자체를 보여주지 않음).
     */
    public List<ReviewEntity> search(String query) {
        if (query == null || query.isEmpty()) {
            return null;
        }
        return reviewRepository.findByTextContainingIgnoreCaseOrderByPubDateDescIdDesc(query);
    }

    private TitleEntity requireTitle(Long titleId) {
        return titleRepository.findById(titleId).orElseThrow(ApiException::notFound);
    }
}
