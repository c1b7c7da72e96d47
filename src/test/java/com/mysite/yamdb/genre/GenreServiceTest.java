package com.mysite.yamdb.genre;

import com.mysite.yamdb.handler.ApiException;
import com.mysite.yamdb.title.GenreTitleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class GenreServiceTest {

    @Mock
    private GenreRepository genreRepository;

    @Mock
    private GenreTitleRepository genreTitleRepository;

    @InjectMocks
    private GenreService genreService;

    @BeforeEach
    void init() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    @DisplayName("중복 slug → slug 필드 오류")
    void createDuplicateSlug() {
        when(genreRepository.existsBySlug("drama")).thenReturn(true);

        assertThatThrownBy(() -> genreService.create(new GenreDto("Drama", "drama")))
                .isInstanceOf(ApiException.class)
                .hasMessage("genre with this slug already exists.")
                .satisfies(e -> assertThat(((ApiException) e).getField()).isEqualTo("slug"));
        verify(genreRepository, never()).save(any());
    }

    @Test
    @DisplayName("장르 삭제 시 연결 레코드를 먼저 지운다")
    void deleteUnlinksTitles() {
        GenreEntity genre = new GenreEntity("Drama", "drama");
        when(genreRepository.findBySlug("drama")).thenReturn(Optional.of(genre));
        when(genreTitleRepository.deleteByGenre(genre)).thenReturn(2);

        genreService.delete("drama");

        InOrder order = inOrder(genreTitleRepository, genreRepository);
        order.verify(genreTitleRepository).deleteByGenre(genre);
        order.verify(genreRepository).delete(genre);
    }

    @Test
    @DisplayName("없는 slug 삭제 → 404")
    void deleteUnknown() {
        when(genreRepository.findBySlug("none")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> genreService.delete("none"))
                .isInstanceOf(ApiException.class)
                .hasMessage(ApiException.NOT_FOUND_MESSAGE);
        verifyNoInteractions(genreTitleRepository);
    }
}
