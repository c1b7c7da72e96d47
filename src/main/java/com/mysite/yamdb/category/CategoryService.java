package com.mysite.yamdb.category;

import com.mysite.yamdb.handler.ApiException;
import com.mysite.yamdb.util.PageSelector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class CategoryService {

    private final CategoryRepository categoryRepository;

    @Transactional(readOnly = true)
    public Page<CategoryEntity> list(String search, String page, int pageSize) {
        if (search == null || search.isBlank()) {
            return PageSelector.select(page, pageSize, categoryRepository::findAllByOrderByIdAsc);
        }
        return PageSelector.select(page, pageSize,
                pageable -> categoryRepository.findByNameContainingIgnoreCaseOrderByIdAsc(search.trim(), pageable));
    }

    public CategoryEntity getBySlug(String slug) {
        return categoryRepository.findBySlug(slug).orElseThrow(ApiException::notFound);
    }

    @Transactional
    public CategoryEntity create(CategoryDto request) {
        if (categoryRepository.existsBySlug(request.slug())) {
            throw ApiException.invalid("slug", "category with this slug already exists.");
        }
        CategoryEntity saved = categoryRepository.save(new CategoryEntity(request.name(), request.slug()));
        log.info("카테고리 생성: {}", saved.getSlug());
        return saved;
    }

    /**
     * 카테고리 삭제. 소속 작품 (및 그 리뷰/댓글) 도 함께 삭제된다.
     */
    @Transactional
    public void delete(String slug) {
        CategoryEntity category = getBySlug(slug);
        categoryRepository.delete(category);
        log.info("카테고리 삭제: {} (작품 {}건 함께 삭제)", slug, category.getTitles().size());
    }
}
