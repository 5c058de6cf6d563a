package com.aschik.accountservice.entity;

/** Workflow a passcode authorizes. Codes never verify across purposes. */
public enum PasscodePurpose {
    EMAIL_VERIFICATION,
    PASSWORD_RESET
}
