package com.mysite.yamdb.review;

import com.mysite.yamdb.handler.ApiException;
import com.mysite.yamdb.title.TitleEntity;
import com.mysite.yamdb.title.TitleRepository;
import com.mysite.yamdb.user.SiteUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ReviewServiceTest {

    @Mock
    private ReviewRepository reviewRepository;

    @Mock
    private TitleRepository titleRepository;

    @InjectMocks
    private ReviewService reviewService;

    private TitleEntity title;
    private SiteUser author;

    @BeforeEach
    void init() {
        MockitoAnnotations.openMocks(this);

        title = new TitleEntity("Solaris", 1972, null, null);
        title.setId(1L);
        author = SiteUser.builder().username("writer").email("w@test.com").build();
        author.setId(10L);
    }

    @Test
    @DisplayName("리뷰 작성 성공: 작품과 작성자가 연결된다")
    void createSuccess() {
        when(titleRepository.findById(1L)).thenReturn(Optional.of(title));
        when(reviewRepository.existsByAuthor_IdAndTitle_Id(10L, 1L)).thenReturn(false);

        ReviewEntity review = reviewService.create(1L, author, new ReviewRequest("Great film", 9));

        assertThat(review.getTitle()).isSameAs(title);
        assertThat(review.getAuthor()).isSameAs(author);
        assertThat(review.getScore()).isEqualTo(9);
        verify(reviewRepository).saveAndFlush(review);
    }

    @Test
    @DisplayName("같은 작품에 두 번째 리뷰 → 400 non_field 오류")
    void createDuplicate() {
        when(titleRepository.findById(1L)).thenReturn(Optional.of(title));
        when(reviewRepository.existsByAuthor_IdAndTitle_Id(10L, 1L)).thenReturn(true);

        assertThatThrownBy(() -> reviewService.create(1L, author, new ReviewRequest("Again", 5)))
                .isInstanceOf(ApiException.class)
                .hasMessage(ReviewService.DUPLICATE_REVIEW)
                .satisfies(e -> assertThat(((ApiException) e).getField()).isNull());

        verify(reviewRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("동시 요청이 유일성 제약에 걸려도 같은 오류로 응답")
    void createDuplicateRace() {
        when(titleRepository.findById(1L)).thenReturn(Optional.of(title));
        when(reviewRepository.existsByAuthor_IdAndTitle_Id(10L, 1L)).thenReturn(false);
        when(reviewRepository.saveAndFlush(any())).thenThrow(new DataIntegrityViolationException("unique_review_author"));

        assertThatThrownBy(() -> reviewService.create(1L, author, new ReviewRequest("Race", 5)))
                .isInstanceOf(ApiException.class)
                .hasMessage(ReviewService.DUPLICATE_REVIEW);
    }

    @Test
    @DisplayName("없는 작품에 리뷰 작성 → 404")
    void createUnknownTitle() {
        when(titleRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> reviewService.create(99L, author, new ReviewRequest("x", 5)))
                .isInstanceOf(ApiException.class)
                .satisfies(e -> assertThat(((ApiException) e).getStatus()).isEqualTo(HttpStatus.NOT_FOUND));
    }

    @Test
    @DisplayName("다른 작품의 리뷰 id 로 조회하면 404")
    void getReviewOfOtherTitle() {
        when(titleRepository.findById(1L)).thenReturn(Optional.of(title));
        when(reviewRepository.findByIdAndTitle_Id(5L, 1L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> reviewService.get(1L, 5L))
                .isInstanceOf(ApiException.class)
                .hasMessage(ApiException.NOT_FOUND_MESSAGE);
    }

    @Test
    @DisplayName("부분 수정: 보낸 필드만 바뀐다")
    void partialUpdate() {
        ReviewEntity review = new ReviewEntity();
        review.setText("old text");
        review.setScore(3);
        when(reviewRepository.save(review)).thenReturn(review);

        reviewService.update(review, new ReviewRequest(null, 8));

        assertThat(review.getText()).isEqualTo("old text");
        assertThat(review.getScore()).isEqualTo(8);
    }

    @Test
    @DisplayName("검색어가 비어 있으면 null, 있으면 본문 검색")
    void search() {
        assertThat(reviewService.search(null)).isNull();
        assertThat(reviewService.search("")).isNull();

        reviewService.search("space");
        verify(reviewRepository).findByTextContainingIgnoreCaseOrderByPubDateDescIdDesc("space");
    }
}
