package com.mysite.yamdb.category;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CategoryRepository extends JpaRepository<CategoryEntity, Long> {

    Optional<CategoryEntity> findBySlug(String slug);

    boolean existsBySlug(String slug);

    Page<CategoryEntity> findAllByOrderByIdAsc(Pageable pageable);

    // 이름 부분 일치 검색 (대소문자 무시)
    Page<CategoryEntity> findByNameContainingIgnoreCaseOrderByIdAsc(String name, Pageable pageable);
}
