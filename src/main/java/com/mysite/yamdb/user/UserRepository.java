package com.mysite.yamdb.user;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<SiteUser, Long> {

    Optional<SiteUser> findByUsername(String username);

    Optional<SiteUser> findByEmail(String email);

    boolean existsByUsername(String username);

    boolean existsByEmail(String email);

    boolean existsByEmailAndUsernameNot(String email, String username);

    boolean existsByUsernameAndIdNot(String username, Long id);

    boolean existsByEmailAndIdNot(String email, Long id);

    /**
     * 관리자 사용자 목록 검색 (username 부분 일치, 대소문자 무시)
     */
    Page<SiteUser> findByUsernameContainingIgnoreCaseOrderByUsernameAsc(String username, Pageable pageable);

    Page<SiteUser> findAllByOrderByUsernameAsc(Pageable pageable);
}
