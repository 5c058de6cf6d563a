package com.aschik.accountservice.serviceImpl;

import com.aschik.accountservice.entity.PasscodePurpose;
import com.aschik.accountservice.entity.User;
import com.aschik.accountservice.exception.OtpExceptions;
import com.aschik.accountservice.exception.RequestExceptions;
import com.aschik.accountservice.exception.UserExceptions;
import com.aschik.accountservice.repository.UserRepository;
import com.aschik.accountservice.service.OtpService;
import com.aschik.accountservice.service.PasswordResetService;
import com.aschik.accountservice.utils.EmailAddresses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Forgot-password flow on top of {@link OtpService}.
 * <p>
 * The request step answers identically for known and unknown addresses. The
 * completion step does reveal a missing account (404), since the caller must
 * already hold a code to get there.
 * <p>
 * Not transactional on purpose: the code is consumed in its own transaction
 * and stays consumed if the password update fails afterwards. Such a failure
 * surfaces as a storage error (500).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PasswordResetServiceImpl implements PasswordResetService {

    static final int MIN_PASSWORD_LENGTH = 6;

    private final UserRepository userRepository;
    private final OtpService otpService;
    private final PasswordEncoder passwordEncoder;
    private final UserServiceImpl userService;

    @Override
    public void requestReset(String rawEmail) {
        final String email = EmailAddresses.requireValid(rawEmail);

        Optional<User> account = findActive(email);
        if (account.isEmpty()) {
            log.info("Password reset requested for unknown address");
            return;
        }
        otpService.issue(email, PasscodePurpose.PASSWORD_RESET);
    }

    @Override
    public void completeReset(String rawEmail, String code, String newPassword) {
        if (newPassword == null || newPassword.length() < MIN_PASSWORD_LENGTH) {
            throw new RequestExceptions.ValidationFailed(
                    "Password must be at least " + MIN_PASSWORD_LENGTH + " characters long");
        }
        final String email = EmailAddresses.requireValid(rawEmail);

        findActive(email).orElseThrow(() -> new UserExceptions.UserNotFound("User not found"));

        otpService.verify(email, code, PasscodePurpose.PASSWORD_RESET);

        int updated;
        try {
            updated = userRepository.updatePassword(email, passwordEncoder.encode(newPassword));
        } catch (DataAccessException e) {
            log.error("Password update failed for {} after the code was consumed", email, e);
            throw new OtpExceptions.PasscodeStorageFailure("Password update failed", e);
        }
        if (updated != 1) {
            throw new IllegalStateException("Password update affected " + updated + " rows");
        }
        userService.evictUserDetails(email);
        log.info("Password reset completed for {}", email);
    }

    private Optional<User> findActive(String email) {
        return userRepository.findByEmail(email).filter(u -> !u.isDeleted());
    }
}
