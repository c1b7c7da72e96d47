package com.mysite.yamdb.web;

import com.mysite.yamdb.review.ReviewEntity;
import com.mysite.yamdb.review.ReviewRequest;
import com.mysite.yamdb.review.ReviewService;
import com.mysite.yamdb.title.TitleEntity;
import com.mysite.yamdb.title.TitleService;
import com.mysite.yamdb.user.SiteUser;
import com.mysite.yamdb.web.form.ReviewForm;
import jakarta.validation.Valid;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

@Controller
@RequestMapping("/titles/{titleId}/review")
public class ReviewWebController {

    private final ReviewService reviewService;
    private final FlowHandler flowHandler;

    private final CreateFlow<TitleEntity, ReviewForm> createFlow;
    private final DeleteFlow<ReviewEntity> deleteFlow;

    public ReviewWebController(ReviewService reviewService, TitleService titleService, FlowHandler flowHandler) {
        this.reviewService = reviewService;
        this.flowHandler = flowHandler;
        this.createFlow = new CreateFlow<>(
                titleService::getEntity,
                titleId -> "/titles/" + titleId,
                "/",
                (title, author, form) -> reviewService.create(
                        title.getId(), author, new ReviewRequest(form.getText(), form.getScore())));
        this.deleteFlow = new DeleteFlow<>(
                reviewService::get,
                titleId -> "/titles/" + titleId,
                reviewService::delete);
    }

    @PostMapping("/create")
    public String create(@PathVariable Long titleId, @Valid @ModelAttribute("form") ReviewForm form,
                         BindingResult bindingResult, Authentication auth) {
        return flowHandler.create(createFlow, titleId, form, bindingResult, auth);
    }

    @GetMapping("/{reviewId}/update")
    public String updateForm(@PathVariable Long titleId, @PathVariable Long reviewId, Authentication auth,
                             Model model) {
        ReviewEntity review = modifiableReview(titleId, reviewId, auth);
        model.addAttribute("review", review);
        model.addAttribute("form", new ReviewForm(review.getText(), review.getScore()));
        return "reviews/review_update";
    }

    @PostMapping("/{reviewId}/update")
    public String update(@PathVariable Long titleId, @PathVariable Long reviewId,
                         @Valid @ModelAttribute("form") ReviewForm form, BindingResult bindingResult,
                         Authentication auth, Model model) {
        ReviewEntity review = modifiableReview(titleId, reviewId, auth);
        if (bindingResult.hasErrors()) {
            model.addAttribute("review", review);
            return "reviews/review_update";
        }
        reviewService.update(review, new ReviewRequest(form.getText(), form.getScore()));
        return "redirect:/titles/" + review.getTitle().getId();
    }

    @PostMapping("/{reviewId}/delete")
    public String delete(@PathVariable Long titleId, @PathVariable Long reviewId, Authentication auth) {
        return flowHandler.delete(deleteFlow, titleId, reviewId, auth);
    }

    private ReviewEntity modifiableReview(Long titleId, Long reviewId, Authentication auth) {
        SiteUser user = flowHandler.requireUser(auth);
        ReviewEntity review = reviewService.get(titleId, reviewId);
        flowHandler.requireModifiable(user, review);
        return review;
    }
}
