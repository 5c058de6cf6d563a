package com.aschik.accountservice.service;

import com.aschik.accountservice.dto.PasscodeHistoryEntry;
import com.aschik.accountservice.dto.UserSummary;

import java.util.List;
import java.util.UUID;

public interface UserManagementService {

    List<UserSummary> listUsers();

    UserSummary getUser(UUID id);

    void deleteUser(UUID id);

    List<PasscodeHistoryEntry> passcodeHistory(UUID id);
}
