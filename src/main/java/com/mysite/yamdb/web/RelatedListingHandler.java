package com.mysite.yamdb.web;

import org.springframework.data.domain.Page;
import org.springframework.stereotype.Component;
import org.springframework.ui.Model;

@Component
public class RelatedListingHandler {

    public static final String PAGE_ATTRIBUTE = "page";
    public static final String PAGINATED_ATTRIBUTE = "isPaginated";

    /**
     * 상위 객체와 목록 페이지를 모델에 담고 템플릿 이름을 돌려준다.
     * 목록이 비어 있으면 페이지 정보는 넣지 않는다.
     */
    public <P, C> String render(RelatedListing<P, C> listing, String key, String page, Model model) {
        P parent = listing.parentLookup().apply(key);
        Page<C> children = listing.children().fetch(parent, page);

        model.addAttribute(listing.parentAttribute(), parent);
        model.addAttribute(listing.childrenAttribute(), children.getContent());
        if (children.hasContent()) {
            model.addAttribute(PAGE_ATTRIBUTE, children);
            model.addAttribute(PAGINATED_ATTRIBUTE, children.getTotalPages() > 1);
        } else {
            model.addAttribute(PAGINATED_ATTRIBUTE, false);
        }
        return listing.viewName();
    }
}
