package com.mysite.yamdb.user;

import com.mysite.yamdb.config.YamdbProperties;
import com.mysite.yamdb.permission.PermissionChecker;
import com.mysite.yamdb.permission.PermissionPolicies;
import com.mysite.yamdb.util.OnCreate;
import com.mysite.yamdb.util.PageResponse;
import com.mysite.yamdb.util.RequestValidator;
import jakarta.validation.groups.Default;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/users")
public class UserController {

    private final UserService userService;
    private final PermissionChecker permissionChecker;
    private final RequestValidator requestValidator;
    private final YamdbProperties properties;

    @GetMapping
    public ResponseEntity<PageResponse<UserResponse>> list(@RequestParam(required = false) String search,
                                                           @RequestParam(required = false) String page,
                                                           Authentication auth) {
        permissionChecker.check(PermissionPolicies.ADMIN_ONLY, auth, HttpMethod.GET);
        return ResponseEntity.ok(PageResponse.of(
                userService.list(search, page, properties.getPagination().getPageSize()),
                UserResponse::fromEntity));
    }

    @PostMapping
    public ResponseEntity<UserResponse> create(@RequestBody(required = false) UserRequest request,
                                               Authentication auth) {
        permissionChecker.check(PermissionPolicies.ADMIN_ONLY, auth, HttpMethod.POST);
        requestValidator.validate(request, Default.class, OnCreate.class);
        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.fromEntity(userService.create(request)));
    }

    // 본인 정보. role 은 바꿀 수 없다
    @GetMapping("/me")
    public ResponseEntity<UserResponse> me(Authentication auth) {
        SiteUser user = permissionChecker.check(PermissionPolicies.AUTHENTICATED, auth, HttpMethod.GET);
        return ResponseEntity.ok(UserResponse.fromEntity(userService.reload(user)));
    }

    @PatchMapping("/me")
    public ResponseEntity<UserResponse> updateMe(@RequestBody(required = false) UserRequest request,
                                                 Authentication auth) {
        SiteUser user = permissionChecker.check(PermissionPolicies.AUTHENTICATED, auth, HttpMethod.PATCH);
        requestValidator.validate(request);
        return ResponseEntity.ok(UserResponse.fromEntity(userService.update(userService.reload(user), request, false)));
    }

    @GetMapping("/{username}")
    public ResponseEntity<UserResponse> get(@PathVariable String username, Authentication auth) {
        permissionChecker.check(PermissionPolicies.ADMIN_ONLY, auth, HttpMethod.GET);
        return ResponseEntity.ok(UserResponse.fromEntity(userService.getByUsername(username)));
    }

    @PatchMapping("/{username}")
    public ResponseEntity<UserResponse> update(@PathVariable String username,
                                               @RequestBody(required = false) UserRequest request,
                                               Authentication auth) {
        permissionChecker.check(PermissionPolicies.ADMIN_ONLY, auth, HttpMethod.PATCH);
        requestValidator.validate(request);
        SiteUser user = userService.getByUsername(username);
        return ResponseEntity.ok(UserResponse.fromEntity(userService.update(user, request, true)));
    }

    @DeleteMapping("/{username}")
    public ResponseEntity<Void> delete(@PathVariable String username, Authentication auth) {
        permissionChecker.check(PermissionPolicies.ADMIN_ONLY, auth, HttpMethod.DELETE);
        userService.delete(username);
        return ResponseEntity.noContent().build();
    }
}
