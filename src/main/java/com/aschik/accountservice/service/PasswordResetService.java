package com.aschik.accountservice.service;

public interface PasswordResetService {

    /** Same outcome whether or not an account exists for the address. */
    void requestReset(String email);

    void completeReset(String email, String code, String newPassword);
}
