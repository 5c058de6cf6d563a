package com.aschik.accountservice.service;

import com.aschik.accountservice.dto.AdminLoginRequest;
import com.aschik.accountservice.dto.AdminProfile;
import com.aschik.accountservice.dto.LoginResponse;
import com.aschik.accountservice.dto.SystemStatus;

public interface AdminService {

    LoginResponse login(AdminLoginRequest request);

    AdminProfile profile();

    SystemStatus systemStatus();
}
