package com.mysite.yamdb.genre;

import com.mysite.yamdb.config.YamdbProperties;
import com.mysite.yamdb.permission.PermissionChecker;
import com.mysite.yamdb.permission.PermissionPolicies;
import com.mysite.yamdb.util.PageResponse;
import com.mysite.yamdb.util.RequestValidator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/genres")
public class GenreController {

    private final GenreService genreService;
    private final PermissionChecker permissionChecker;
    private final RequestValidator requestValidator;
    private final YamdbProperties properties;

    @GetMapping
    public ResponseEntity<PageResponse<GenreDto>> list(
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String page,
            Authentication auth
    ) {
        permissionChecker.check(PermissionPolicies.ADMIN_OR_READ_ONLY, auth, HttpMethod.GET);
        return ResponseEntity.ok(PageResponse.of(
                genreService.list(search, page, properties.getPagination().getPageSize()),
                GenreDto::fromEntity));
    }

    @PostMapping
    public ResponseEntity<GenreDto> create(@RequestBody(required = false) GenreDto request, Authentication auth) {
        permissionChecker.check(PermissionPolicies.ADMIN_OR_READ_ONLY, auth, HttpMethod.POST);
        requestValidator.validate(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(GenreDto.fromEntity(genreService.create(request)));
    }

    @DeleteMapping("/{slug}")
    public ResponseEntity<Void> delete(@PathVariable String slug, Authentication auth) {
        permissionChecker.check(PermissionPolicies.ADMIN_OR_READ_ONLY, auth, HttpMethod.DELETE);
        genreService.delete(slug);
        return ResponseEntity.noContent().build();
    }
}
