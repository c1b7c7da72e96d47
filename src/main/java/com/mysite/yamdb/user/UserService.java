package com.mysite.yamdb.user;

import com.mysite.yamdb.handler.ApiException;
import com.mysite.yamdb.user.Role.Role;
import com.mysite.yamdb.util.PageSelector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 관리자용 사용자 관리 + 본인 정보 조회/수정
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;

    @Transactional(readOnly = true)
    public Page<SiteUser> list(String search, String page, int pageSize) {
        if (search == null || search.isBlank()) {
            return PageSelector.select(page, pageSize, userRepository::findAllByOrderByUsernameAsc);
        }
        return PageSelector.select(page, pageSize,
                pageable -> userRepository.findByUsernameContainingIgnoreCaseOrderByUsernameAsc(search.trim(), pageable));
    }

    public SiteUser getByUsername(String username) {
        return userRepository.findByUsername(username).orElseThrow(ApiException::notFound);
    }

    /**
     * 토큰의 사용자를 DB 에서 다시 읽는다 (다른 요청에서 바뀌었을 수 있음)
     */
    public SiteUser reload(SiteUser user) {
        return userRepository.findById(user.getId()).orElseThrow(ApiException::notFound);
    }

    @Transactional
    public SiteUser create(UserRequest request) {
        if (userRepository.existsByUsername(request.username())) {
            throw ApiException.invalid("username", "A user with that username already exists.");
        }
        if (userRepository.existsByEmail(request.email())) {
            throw ApiException.invalid("email", "A user with that email already exists.");
        }

        SiteUser user = SiteUser.builder()
                .username(request.username())
                .email(request.email())
                .firstName(request.firstName())
                .lastName(request.lastName())
                .bio(request.bio())
                .role(parseRole(request.role()))
                .build();

        SiteUser saved = save(user);
        log.info("관리자가 사용자 생성: {} ({})", saved.getUsername(), saved.getRole());
        return saved;
    }

    /**
     * 부분 수정. roleEditable 이 false 면 (본인 수정) role 은 무시한다.
     */
    @Transactional
    public SiteUser update(SiteUser user, UserRequest request, boolean roleEditable) {
        if (request.username() != null && !request.username().equals(user.getUsername())) {
            if (userRepository.existsByUsernameAndIdNot(request.username(), user.getId())) {
                throw ApiException.invalid("username", "A user with that username already exists.");
            }
            user.setUsername(request.username());
        }
        if (request.email() != null && !request.email().equals(user.getEmail())) {
            if (userRepository.existsByEmailAndIdNot(request.email(), user.getId())) {
                throw ApiException.invalid("email", "A user with that email already exists.");
            }
            user.setEmail(request.email());
        }
        if (request.firstName() != null) {
            user.setFirstName(request.firstName());
        }
        if (request.lastName() != null) {
            user.setLastName(request.lastName());
        }
        if (request.bio() != null) {
            user.setBio(request.bio());
        }
        if (roleEditable && request.role() != null) {
            Role role = parseRole(request.role());
            if (role != user.getRole()) {
                log.info("사용자 권한 변경: {} {} -> {}", user.getUsername(), user.getRole(), role);
            }
            user.setRole(role);
        }
        return save(user);
    }

    @Transactional
    public void delete(String username) {
        SiteUser user = getByUsername(username);
        userRepository.delete(user);
        log.info("사용자 삭제: {}", username);
    }

    private SiteUser save(SiteUser user) {
        try {
            return userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            throw ApiException.invalid("A user with that username or email already exists.");
        }
    }

    private static Role parseRole(String value) {
        if (value == null) {
            return Role.USER;
        }
        try {
            return Role.from(value);
        } catch (IllegalArgumentException e) {
            throw ApiException.invalid("role", e.getMessage());
        }
    }
}
