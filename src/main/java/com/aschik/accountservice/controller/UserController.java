package com.aschik.accountservice.controller;

import com.aschik.accountservice.dto.ApiResponse;
import com.aschik.accountservice.dto.PasscodeHistoryEntry;
import com.aschik.accountservice.dto.UserSummary;
import com.aschik.accountservice.service.UserManagementService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/** Account administration; every route requires the ADMIN role. */
@RestController
@RequestMapping("/users")
@RequiredArgsConstructor
public class UserController {

    private final UserManagementService userManagementService;

    @GetMapping
    public List<UserSummary> list() {
        return userManagementService.listUsers();
    }

    @GetMapping("/{id}")
    public UserSummary get(@PathVariable UUID id) {
        return userManagementService.getUser(id);
    }

    @DeleteMapping("/{id}")
    public ApiResponse<Void> delete(@PathVariable UUID id) {
        userManagementService.deleteUser(id);
        return ApiResponse.ok("User deleted successfully", null);
    }

    @GetMapping("/{id}/passcodes")
    public List<PasscodeHistoryEntry> passcodes(@PathVariable UUID id) {
        return userManagementService.passcodeHistory(id);
    }
}
