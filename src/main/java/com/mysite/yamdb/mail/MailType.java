package com.mysite.yamdb.mail;

public enum MailType {
    CONFIRMATION_CODE,
    PASSWORD_RESET
}
