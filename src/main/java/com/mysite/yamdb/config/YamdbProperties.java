package com.mysite.yamdb.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * application.yml 의 yamdb.* 설정
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "yamdb")
public class YamdbProperties {

    private final Pagination pagination = new Pagination();
    private final Auth auth = new Auth();
    private final Mail mail = new Mail();

    // 비밀번호 재설정 링크의 절대 주소 기준
    private String siteUrl = "http://localhost:8080";

    @Getter
    @Setter
    public static class Pagination {
        private int pageSize = 10;
        private int titleReviewsPageSize = 5;
    }

    @Getter
    @Setter
    public static class Auth {
        private int confirmationCodeLength = 12;
        // true 면 토큰 발급 후 확인 코드를 비운다
        private boolean singleUseConfirmationCode = false;
    }

    @Getter
    @Setter
    public static class Mail {
        private String from = "noreply@yamdb.local";
    }
}
