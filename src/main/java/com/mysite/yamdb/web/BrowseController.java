package com.mysite.yamdb.web;

import com.mysite.yamdb.category.CategoryEntity;
import com.mysite.yamdb.category.CategoryService;
import com.mysite.yamdb.comment.CommentEntity;
import com.mysite.yamdb.comment.CommentService;
import com.mysite.yamdb.config.YamdbProperties;
import com.mysite.yamdb.genre.GenreEntity;
import com.mysite.yamdb.genre.GenreService;
import com.mysite.yamdb.review.ReviewEntity;
import com.mysite.yamdb.review.ReviewService;
import com.mysite.yamdb.title.TitleEntity;
import com.mysite.yamdb.title.TitleService;
import com.mysite.yamdb.user.SiteUser;
import com.mysite.yamdb.user.UserService;
import com.mysite.yamdb.web.form.CommentForm;
import com.mysite.yamdb.web.form.ReviewForm;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;

/**
 * 조회 화면 (메인, 작품/리뷰 상세, 카테고리/장르/프로필 목록, 검색)
 */
@Controller
public class BrowseController {

    private final TitleService titleService;
    private final ReviewService reviewService;
    private final RelatedListingHandler listingHandler;
    private final int pageSize;

    private final RelatedListing<TitleEntity, ReviewEntity> titleDetail;
    private final RelatedListing<ReviewEntity, CommentEntity> reviewDetail;
    private final RelatedListing<CategoryEntity, TitleEntity> categoryListing;
    private final RelatedListing<GenreEntity, TitleEntity> genreListing;
    private final RelatedListing<SiteUser, ReviewEntity> profile;

    public BrowseController(TitleService titleService, ReviewService reviewService, CommentService commentService,
                            CategoryService categoryService, GenreService genreService, UserService userService,
                            RelatedListingHandler listingHandler, YamdbProperties properties) {
        this.titleService = titleService;
        this.reviewService = reviewService;
        this.listingHandler = listingHandler;
        this.pageSize = properties.getPagination().getPageSize();
        int reviewPageSize = properties.getPagination().getTitleReviewsPageSize();

        this.titleDetail = new RelatedListing<>("reviews/title_detail", "title", "reviews",
                id -> titleService.getEntity(Long.valueOf(id)),
                (title, page) -> reviewService.listByTitle(title.getId(), page, reviewPageSize));
        this.reviewDetail = new RelatedListing<>("reviews/review_detail", "review", "comments",
                id -> reviewService.getById(Long.valueOf(id)),
                (review, page) -> commentService.listByReview(review, page, pageSize));
        this.categoryListing = new RelatedListing<>("reviews/category_list", "category", "titles",
                categoryService::getBySlug,
                (category, page) -> titleService.listByCategory(category, page, pageSize));
        this.genreListing = new RelatedListing<>("reviews/genre_list", "genre", "titles",
                genreService::getBySlug,
                (genre, page) -> titleService.listByGenre(genre, page, pageSize));
        this.profile = new RelatedListing<>("reviews/profile", "author", "reviews",
                userService::getByUsername,
                (author, page) -> reviewService.listByAuthor(author, page, pageSize));
    }

    @GetMapping("/")
    public String index(@RequestParam(required = false) String page, Model model) {
        Page<TitleEntity> titles = titleService.listAll(page, pageSize);
        model.addAttribute("titles", titles.getContent());
        model.addAttribute(RelatedListingHandler.PAGE_ATTRIBUTE, titles);
        model.addAttribute(RelatedListingHandler.PAGINATED_ATTRIBUTE, titles.getTotalPages() > 1);
        return "reviews/index";
    }

    @GetMapping("/titles/{titleId}")
    public String titleDetail(@PathVariable Long titleId, @RequestParam(required = false) String page,
                              Model model) {
        model.addAttribute("form", new ReviewForm());
        model.addAttribute("actionUrl", "/titles/" + titleId + "/review/create");
        return listingHandler.render(titleDetail, String.valueOf(titleId), page, model);
    }

    @GetMapping("/reviews/{reviewId}")
    public String reviewDetail(@PathVariable Long reviewId, @RequestParam(required = false) String page,
                               Model model) {
        model.addAttribute("form", new CommentForm());
        model.addAttribute("actionUrl", "/reviews/" + reviewId + "/comment");
        return listingHandler.render(reviewDetail, String.valueOf(reviewId), page, model);
    }

    @GetMapping("/category/{slug}")
    public String category(@PathVariable String slug, @RequestParam(required = false) String page, Model model) {
        return listingHandler.render(categoryListing, slug, page, model);
    }

    @GetMapping("/genre/{slug}")
    public String genre(@PathVariable String slug, @RequestParam(required = false) String page, Model model) {
        return listingHandler.render(genreListing, slug, page, model);
    }

    @GetMapping("/profile/{username}")
    public String profile(@PathVariable String username, @RequestParam(required = false) String page,
                          Model model) {
        return listingHandler.render(profile, username, page, model);
    }

    // 검색어가 없으면 결과 영역을 보여주지 않는다
    @GetMapping("/search")
    public String search(@RequestParam(required = false) String q, Model model) {
        model.addAttribute("q", q);
        model.addAttribute("reviews", reviewService.search(q));
        return "reviews/search";
    }
}
