package com.mysite.yamdb.permission;

import com.mysite.yamdb.user.SiteUser;

/**
 * 작성자가 있는 리소스 (리뷰, 댓글). 객체 단위 권한 판단에 사용한다.
 */
public interface Authored {

    SiteUser getAuthor();
}
