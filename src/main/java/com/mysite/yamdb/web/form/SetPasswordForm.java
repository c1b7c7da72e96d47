package com.mysite.yamdb.web.form;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

/**
 * 새 비밀번호 두 번 입력 (재설정, 변경 공통)
 */
@Getter
@Setter
public class SetPasswordForm {

    // 비밀번호 변경 화면에서만 사용
    private String oldPassword;

    @NotBlank(message = "This field is required.")
    private String newPassword1;

    @NotBlank(message = "This field is required.")
    private String newPassword2;
}
