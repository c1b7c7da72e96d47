package com.mysite.yamdb.web;

import com.mysite.yamdb.comment.CommentEntity;
import com.mysite.yamdb.comment.CommentRequest;
import com.mysite.yamdb.comment.CommentService;
import com.mysite.yamdb.review.ReviewEntity;
import com.mysite.yamdb.review.ReviewService;
import com.mysite.yamdb.web.form.CommentForm;
import jakarta.validation.Valid;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Controller;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

@Controller
@RequestMapping("/reviews/{reviewId}/comment")
public class CommentWebController {

    private final FlowHandler flowHandler;

    private final CreateFlow<ReviewEntity, CommentForm> createFlow;
    private final DeleteFlow<CommentEntity> deleteFlow;

    public CommentWebController(CommentService commentService, ReviewService reviewService, FlowHandler flowHandler) {
        this.flowHandler = flowHandler;
        this.createFlow = new CreateFlow<>(
                reviewService::getById,
                reviewId -> "/reviews/" + reviewId,
                "/",
                (review, author, form) -> commentService.create(review, author, new CommentRequest(form.getText())));
        this.deleteFlow = new DeleteFlow<>(
                commentService::get,
                reviewId -> "/reviews/" + reviewId,
                commentService::delete);
    }

    @PostMapping
    public String create(@PathVariable Long reviewId, @Valid @ModelAttribute("form") CommentForm form,
                         BindingResult bindingResult, Authentication auth) {
        return flowHandler.create(createFlow, reviewId, form, bindingResult, auth);
    }

    @PostMapping("/{commentId}/delete")
    public String delete(@PathVariable Long reviewId, @PathVariable Long commentId, Authentication auth) {
        return flowHandler.delete(deleteFlow, reviewId, commentId, auth);
    }
}
