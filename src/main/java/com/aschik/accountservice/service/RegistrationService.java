package com.aschik.accountservice.service;

import com.aschik.accountservice.dto.RegistrationResponse;
import com.aschik.accountservice.dto.SignupRequest;

public interface RegistrationService {

    RegistrationResponse registerUser(SignupRequest request);
}
