package com.mysite.yamdb.title;

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

import java.util.function.Function;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/titles")
public class TitleController {

    private final TitleService titleService;
    private final PermissionChecker permissionChecker;
    private final RequestValidator requestValidator;
    private final YamdbProperties properties;

    @GetMapping
    public ResponseEntity<PageResponse<TitleResponse>> list(
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String genre,
            @RequestParam(required = false) String name,
            @RequestParam(required = false) String year,
            @RequestParam(required = false) String page,
            Authentication auth
    ) {
        permissionChecker.check(PermissionPolicies.ADMIN_OR_READ_ONLY, auth, HttpMethod.GET);
        TitleFilter filter = TitleFilter.of(category, genre, name, year);
        return ResponseEntity.ok(PageResponse.of(
                titleService.list(filter, page, properties.getPagination().getPageSize()),
                Function.identity()));
    }

    @GetMapping("/{titleId}")
    public ResponseEntity<TitleResponse> get(@PathVariable Long titleId, Authentication auth) {
        permissionChecker.check(PermissionPolicies.ADMIN_OR_READ_ONLY, auth, HttpMethod.GET);
        return ResponseEntity.ok(titleService.get(titleId));
    }

    @PostMapping
    public ResponseEntity<TitleWriteResponse> create(@RequestBody(required = false) TitleRequest request,
                                                     Authentication auth) {
        permissionChecker.check(PermissionPolicies.ADMIN_OR_READ_ONLY, auth, HttpMethod.POST);
        requestValidator.validate(request, Default.class, OnCreate.class);
        return ResponseEntity.status(HttpStatus.CREATED).body(titleService.create(request));
    }

    @PatchMapping("/{titleId}")
    public ResponseEntity<TitleWriteResponse> update(@PathVariable Long titleId,
                                                     @RequestBody(required = false) TitleRequest request,
                                                     Authentication auth) {
        permissionChecker.check(PermissionPolicies.ADMIN_OR_READ_ONLY, auth, HttpMethod.PATCH);
        requestValidator.validate(request);
        return ResponseEntity.ok(titleService.update(titleId, request));
    }

    @DeleteMapping("/{titleId}")
    public ResponseEntity<Void> delete(@PathVariable Long titleId, Authentication auth) {
        permissionChecker.check(PermissionPolicies.ADMIN_OR_READ_ONLY, auth, HttpMethod.DELETE);
        titleService.delete(titleId);
        return ResponseEntity.noContent().build();
    }
}
