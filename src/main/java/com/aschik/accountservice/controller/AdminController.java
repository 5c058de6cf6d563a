package com.aschik.accountservice.controller;

import com.aschik.accountservice.SecurityConfig.RateLimit;
import com.aschik.accountservice.dto.AdminLoginRequest;
import com.aschik.accountservice.dto.AdminProfile;
import com.aschik.accountservice.dto.LoginResponse;
import com.aschik.accountservice.dto.SystemStatus;
import com.aschik.accountservice.service.AdminService;
import com.aschik.accountservice.utils.ResponseMessage;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class AdminController {

    private final AdminService adminService;

    @PostMapping("/login")
    @RateLimit(RateLimit.Policy.LOGIN)
    @ResponseMessage("Admin login successful")
    public LoginResponse login(@Valid @RequestBody AdminLoginRequest request) {
        return adminService.login(request);
    }

    @GetMapping("/profile")
    public AdminProfile profile() {
        return adminService.profile();
    }

    @GetMapping("/system/status")
    public SystemStatus systemStatus() {
        return adminService.systemStatus();
    }
}
