package com.aschik.accountservice.serviceImpl;

import com.aschik.accountservice.dto.PasscodeHistoryEntry;
import com.aschik.accountservice.dto.UserSummary;
import com.aschik.accountservice.entity.User;
import com.aschik.accountservice.exception.UserExceptions;
import com.aschik.accountservice.repository.UserRepository;
import com.aschik.accountservice.service.OtpService;
import com.aschik.accountservice.service.UserManagementService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserManagementServiceImpl implements UserManagementService {

    private final UserRepository userRepository;
    private final OtpService otpService;
    private final UserServiceImpl userService;

    @Override
    @Transactional(readOnly = true)
    public List<UserSummary> listUsers() {
        return userRepository.findAllActiveUsers().stream()
                .map(UserSummary::from)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public UserSummary getUser(UUID id) {
        return UserSummary.from(requireUser(id));
    }

    /** Soft delete; the email and username stay reserved. */
    @Override
    @Transactional
    public void deleteUser(UUID id) {
        User user = requireUser(id);
        user.setDeleted(true);
        userRepository.save(user);
        userService.evictUserDetails(user.getEmail());
        log.info("User {} deleted", id);
    }

    @Override
    public List<PasscodeHistoryEntry> passcodeHistory(UUID id) {
        return otpService.history(requireUser(id).getEmail());
    }

    private User requireUser(UUID id) {
        return userRepository.findActiveById(id)
                .orElseThrow(() -> new UserExceptions.UserNotFound("User not found"));
    }
}
