package com.mysite.yamdb.review;

import com.mysite.yamdb.config.YamdbProperties;
import com.mysite.yamdb.permission.PermissionChecker;
import com.mysite.yamdb.permission.PermissionPolicies;
import com.mysite.yamdb.user.SiteUser;
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
@RequestMapping("/api/v1/titles/{titleId}/reviews")
public class ReviewController {

    private final ReviewService reviewService;
    private final PermissionChecker permissionChecker;
    private final RequestValidator requestValidator;
    private final YamdbProperties properties;

    @GetMapping
    public ResponseEntity<PageResponse<ReviewResponse>> list(@PathVariable Long titleId,
                                                             @RequestParam(required = false) String page,
                                                             Authentication auth) {
        permissionChecker.check(PermissionPolicies.AUTHOR_OR_PRIVILEGED_OR_READ_ONLY, auth, HttpMethod.GET);
        return ResponseEntity.ok(PageResponse.of(
                reviewService.listByTitle(titleId, page, properties.getPagination().getPageSize()),
                ReviewResponse::fromEntity));
    }

    @PostMapping
    public ResponseEntity<ReviewResponse> create(@PathVariable Long titleId,
                                                 @RequestBody(required = false) ReviewRequest request,
                                                 Authentication auth) {
        SiteUser user = permissionChecker.check(
                PermissionPolicies.AUTHOR_OR_PRIVILEGED_OR_READ_ONLY, auth, HttpMethod.POST);
        requestValidator.validate(request, Default.class, OnCreate.class);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ReviewResponse.fromEntity(reviewService.create(titleId, user, request)));
    }

    @GetMapping("/{reviewId}")
    public ResponseEntity<ReviewResponse> get(@PathVariable Long titleId, @PathVariable Long reviewId,
                                              Authentication auth) {
        ReviewEntity review = reviewService.get(titleId, reviewId);
        permissionChecker.checkObject(
                PermissionPolicies.AUTHOR_OR_PRIVILEGED_OR_READ_ONLY, auth, HttpMethod.GET, review);
        return ResponseEntity.ok(ReviewResponse.fromEntity(review));
    }

    @PatchMapping("/{reviewId}")
    public ResponseEntity<ReviewResponse> update(@PathVariable Long titleId, @PathVariable Long reviewId,
                                                 @RequestBody(required = false) ReviewRequest request,
                                                 Authentication auth) {
        permissionChecker.check(PermissionPolicies.AUTHOR_OR_PRIVILEGED_OR_READ_ONLY, auth, HttpMethod.PATCH);
        ReviewEntity review = reviewService.get(titleId, reviewId);
        permissionChecker.checkObject(
                PermissionPolicies.AUTHOR_OR_PRIVILEGED_OR_READ_ONLY, auth, HttpMethod.PATCH, review);
        requestValidator.validate(request);
        return ResponseEntity.ok(ReviewResponse.fromEntity(reviewService.update(review, request)));
    }

    @DeleteMapping("/{reviewId}")
    public ResponseEntity<Void> delete(@PathVariable Long titleId, @PathVariable Long reviewId,
                                       Authentication auth) {
        permissionChecker.check(PermissionPolicies.AUTHOR_OR_PRIVILEGED_OR_READ_ONLY, auth, HttpMethod.DELETE);
        ReviewEntity review = reviewService.get(titleId, reviewId);
        permissionChecker.checkObject(
                PermissionPolicies.AUTHOR_OR_PRIVILEGED_OR_READ_ONLY, auth, HttpMethod.DELETE, review);
        reviewService.delete(review);
        return ResponseEntity.noContent().build();
    }
}
