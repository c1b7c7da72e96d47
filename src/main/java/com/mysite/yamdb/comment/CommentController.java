package com.mysite.yamdb.comment;

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
@RequestMapping("/api/v1/titles/{titleId}/reviews/{reviewId}/comments")
public class CommentController {

    private final CommentService commentService;
    private final PermissionChecker permissionChecker;
    private final RequestValidator requestValidator;
    private final YamdbProperties properties;

    @GetMapping
    public ResponseEntity<PageResponse<CommentResponse>> list(@PathVariable Long titleId,
                                                              @PathVariable Long reviewId,
                                                              @RequestParam(required = false) String page,
                                                              Authentication auth) {
        permissionChecker.check(PermissionPolicies.AUTHOR_OR_PRIVILEGED_OR_READ_ONLY, auth, HttpMethod.GET);
        return ResponseEntity.ok(PageResponse.of(
                commentService.listByReview(titleId, reviewId, page, properties.getPagination().getPageSize()),
                CommentResponse::fromEntity));
    }

    @PostMapping
    public ResponseEntity<CommentResponse> create(@PathVariable Long titleId,
                                                  @PathVariable Long reviewId,
                                                  @RequestBody(required = false) CommentRequest request,
                                                  Authentication auth) {
        SiteUser user = permissionChecker.check(
                PermissionPolicies.AUTHOR_OR_PRIVILEGED_OR_READ_ONLY, auth, HttpMethod.POST);
        requestValidator.validate(request, Default.class, OnCreate.class);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CommentResponse.fromEntity(commentService.create(titleId, reviewId, user, request)));
    }

    @GetMapping("/{commentId}")
    public ResponseEntity<CommentResponse> get(@PathVariable Long titleId, @PathVariable Long reviewId,
                                               @PathVariable Long commentId, Authentication auth) {
        CommentEntity comment = commentService.get(titleId, reviewId, commentId);
        permissionChecker.checkObject(
                PermissionPolicies.AUTHOR_OR_PRIVILEGED_OR_READ_ONLY, auth, HttpMethod.GET, comment);
        return ResponseEntity.ok(CommentResponse.fromEntity(comment));
    }

    @PatchMapping("/{commentId}")
    public ResponseEntity<CommentResponse> update(@PathVariable Long titleId, @PathVariable Long reviewId,
                                                  @PathVariable Long commentId,
                                                  @RequestBody(required = false) CommentRequest request,
                                                  Authentication auth) {
        permissionChecker.check(PermissionPolicies.AUTHOR_OR_PRIVILEGED_OR_READ_ONLY, auth, HttpMethod.PATCH);
        CommentEntity comment = commentService.get(titleId, reviewId, commentId);
        permissionChecker.checkObject(
                PermissionPolicies.AUTHOR_OR_PRIVILEGED_OR_READ_ONLY, auth, HttpMethod.PATCH, comment);
        requestValidator.validate(request);
        return ResponseEntity.ok(CommentResponse.fromEntity(commentService.update(comment, request)));
    }

    @DeleteMapping("/{commentId}")
    public ResponseEntity<Void> delete(@PathVariable Long titleId, @PathVariable Long reviewId,
                                       @PathVariable Long commentId, Authentication auth) {
        permissionChecker.check(PermissionPolicies.AUTHOR_OR_PRIVILEGED_OR_READ_ONLY, auth, HttpMethod.DELETE);
        CommentEntity comment = commentService.get(titleId, reviewId, commentId);
        permissionChecker.checkObject(
                PermissionPolicies.AUTHOR_OR_PRIVILEGED_OR_READ_ONLY, auth, HttpMethod.DELETE, comment);
        commentService.delete(comment);
        return ResponseEntity.noContent().build();
    }
}
