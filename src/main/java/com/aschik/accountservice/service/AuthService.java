package com.aschik.accountservice.service;

import com.aschik.accountservice.dto.LoginRequest;
import com.aschik.accountservice.dto.LoginResponse;
import com.aschik.accountservice.dto.UserSummary;

public interface AuthService {

    LoginResponse login(LoginRequest request);

    /** Issues a new access token and revokes the presented one. */
    LoginResponse refresh(String token);

    void logout(String token);

    UserSummary profile(String email);
}
