package com.mysite.yamdb.title;

import com.mysite.yamdb.category.CategoryEntity;
import com.mysite.yamdb.category.CategoryRepository;
import com.mysite.yamdb.genre.GenreEntity;
import com.mysite.yamdb.genre.GenreRepository;
import com.mysite.yamdb.handler.ApiException;
import com.mysite.yamdb.util.PageSelector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 작품 조회/관리.
 * <p>
 * 읽기 응답은 카테고리·장르 객체와 평균 평점을 포함하고,
 * 쓰기 요청/응답은 slug 참조만 주고받는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TitleService {

    private final TitleRepository titleRepository;
    private final CategoryRepository categoryRepository;
    private final GenreRepository genreRepository;

    @Transactional(readOnly = true)
    public Page<TitleResponse> list(TitleFilter filter, String page, int pageSize) {
        // 평점은 조회 쿼리 안에서 집계 (각 행 = [작품, 평균])
        Page<Object[]> rows = PageSelector.select(page, pageSize, pageable -> titleRepository.findWithRating(
                filter.category(), filter.genre(), filter.name(), filter.year(), pageable));
        return rows.map(TitleResponse::fromRow);
    }

    @Transactional(readOnly = true)
    public TitleResponse get(Long id) {
        return titleRepository.findByIdWithRating(id).stream()
                .findFirst()
                .map(TitleResponse::fromRow)
                .orElseThrow(ApiException::notFound);
    }

    public TitleEntity getEntity(Long id) {
        return titleRepository.findById(id).orElseThrow(ApiException::notFound);
    }

    @Transactional
    public TitleWriteResponse create(TitleRequest request) {
        TitleEntity title = new TitleEntity(
                request.name(), request.year(), request.description(), resolveCategory(request.category()));
        title.replaceGenres(resolveGenres(request.genre()));

        TitleEntity saved = titleRepository.save(title);
        log.info("작품 생성: id={}, name={}", saved.getId(), saved.getName());
        return TitleWriteResponse.fromEntity(saved);
    }

    /**
     * 부분 수정. null 인 필드는 건드리지 않는다.
     */
    @Transactional
    public TitleWriteResponse update(Long id, TitleRequest request) {
        TitleEntity title = getEntity(id);

        if (request.name() != null) {
            title.setName(request.name());
        }
        if (request.year() != null) {
            title.setYear(request.year());
        }
        if (request.description() != null) {
            title.setDescription(request.description());
        }
        if (request.category() != null) {
            title.setCategory(resolveCategory(request.category()));
        }
        if (request.genre() != null) {
            title.replaceGenres(resolveGenres(request.genre()));
        }

        titleRepository.flush();
        return TitleWriteResponse.fromEntity(title);
    }

    /**
     * 작품 삭제. 리뷰와 댓글, 장르 연결도 함께 삭제된다.
     */
    @Transactional
    public void delete(Long id) {
        TitleEntity title = getEntity(id);
        titleRepository.delete(title);
        log.info("작품 삭제: id={}", id);
    }

    // ===== 화면용 목록 =====

    public Page<TitleEntity> listAll(String page, int pageSize) {
        return PageSelector.select(page, pageSize, titleRepository::findAllByOrderByYearDescIdDesc);
    }

    public Page<TitleEntity> listByCategory(CategoryEntity category, String page, int pageSize) {
        return PageSelector.select(page, pageSize,
                pageable -> titleRepository.findByCategory_IdOrderByYearDescIdDesc(category.getId(), pageable));
    }

    public Page<TitleEntity> listByGenre(GenreEntity genre, String page, int pageSize) {
        return PageSelector.select(page, pageSize,
                pageable -> titleRepository.findByGenreId(genre.getId(), pageable));
    }

    private CategoryEntity resolveCategory(String slug) {
        return categoryRepository.findBySlug(slug)
                .orElseThrow(() -> ApiException.invalid("category", doesNotExist(slug)));
    }

    /**
     * slug 목록을 장르로 바꾼다. 하나라도 없으면 genre 필드 오류.
     * 요청 순서를 유지하고 중복은 한 번만 연결한다.
     */
    private List<GenreEntity> resolveGenres(List<String> slugs) {
        LinkedHashSet<String> unique = new LinkedHashSet<>(slugs);
        Map<String, GenreEntity> found = genreRepository.findBySlugIn(unique).stream()
                .collect(Collectors.toMap(GenreEntity::getSlug, Function.identity()));

        List<GenreEntity> genres = new ArrayList<>();
        for (String slug : unique) {
            GenreEntity genre = found.get(slug);
            if (genre == null) {
                throw ApiException.invalid("genre", doesNotExist(slug));
            }
            genres.add(genre);
        }
        return genres;
    }

    private static String doesNotExist(String slug) {
        return "Object with slug=" + slug + " does not exist.";
    }
}
