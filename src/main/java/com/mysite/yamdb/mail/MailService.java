package com.mysite.yamdb.mail;

import com.mysite.yamdb.config.YamdbProperties;
import com.mysite.yamdb.user.SiteUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

/**
 * 확인 코드 및 비밀번호 재설정 메일 서비스
 * <p>
 * 요청 처리 중 바로 JavaMailSender 에 넘긴다 (별도 큐 없음).
 * 본문은 일반 텍스트.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MailService {

    public static final String CONFIRMATION_SUBJECT = "Confirmation code";
    public static final String PASSWORD_RESET_SUBJECT = "Password reset";

    private final JavaMailSender javaMailSender;
    private final YamdbProperties properties;

    public void sendConfirmationCode(SiteUser user) {
        String body = user.getUsername() + ", your confirmation code is " + user.getConfirmationCode();
        send(MailType.CONFIRMATION_CODE, user.getEmail(), CONFIRMATION_SUBJECT, body);
    }

    public void sendPasswordReset(SiteUser user, String token) {
        String link = properties.getSiteUrl() + "/auth/reset/" + token;
        String body = user.getUsername() + ", follow the link below to choose a new password.\n\n"
                + link + "\n\nIf you did not request a password reset, ignore this message.";
        send(MailType.PASSWORD_RESET, user.getEmail(), PASSWORD_RESET_SUBJECT, body);
    }

    private void send(MailType type, String to, String subject, String body) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(properties.getMail().getFrom());
        message.setTo(to);
        message.setSubject(subject);
        message.setText(body);

        javaMailSender.send(message);
        log.info("메일 발송: type={}, to={}", type, to);
    }
}
