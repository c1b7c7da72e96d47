package com.mysite.yamdb.genre;

import com.mysite.yamdb.handler.ApiException;
import com.mysite.yamdb.title.GenreTitleRepository;
import com.mysite.yamdb.util.PageSelector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class GenreService {

    private final GenreRepository genreRepository;
    private final GenreTitleRepository genreTitleRepository;

    @Transactional(readOnly = true)
    public Page<GenreEntity> list(String search, String page, int pageSize) {
        if (search == null || search.isBlank()) {
            return PageSelector.select(page, pageSize, genreRepository::findAllByOrderByIdAsc);
        }
        return PageSelector.select(page, pageSize,
                pageable -> genreRepository.findByNameContainingIgnoreCaseOrderByIdAsc(search.trim(), pageable));
    }

    public GenreEntity getBySlug(String slug) {
        return genreRepository.findBySlug(slug).orElseThrow(ApiException::notFound);
    }

    @Transactional
    public GenreEntity create(GenreDto request) {
        if (genreRepository.existsBySlug(request.slug())) {
            throw ApiException.invalid("slug", "genre with this slug already exists.");
        }
        GenreEntity saved = genreRepository.save(new GenreEntity(request.name(), request.slug()));
        log.info("장르 생성: {}", saved.getSlug());
        return saved;
    }

    /**
     * 장르 삭제. 작품은 남기고 연결 레코드만 지운다.
     */
    @Transactional
    public void delete(String slug) {
        GenreEntity genre = getBySlug(slug);
        int unlinked = genreTitleRepository.deleteByGenre(genre);
        genreRepository.delete(genre);
        log.info("장르 삭제: {} (작품 연결 {}건 해제)", slug, unlinked);
    }
}
