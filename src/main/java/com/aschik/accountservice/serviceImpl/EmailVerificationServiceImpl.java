package com.aschik.accountservice.serviceImpl;

import com.aschik.accountservice.dto.OtpIssueResult;
import com.aschik.accountservice.dto.VerificationStatus;
import com.aschik.accountservice.entity.PasscodePurpose;
import com.aschik.accountservice.entity.User;
import com.aschik.accountservice.exception.ApiException;
import com.aschik.accountservice.exception.UserExceptions;
import com.aschik.accountservice.repository.UserRepository;
import com.aschik.accountservice.service.EmailVerificationService;
import com.aschik.accountservice.service.NotificationDispatcher;
import com.aschik.accountservice.service.OtpService;
import com.aschik.accountservice.utils.EmailAddresses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class EmailVerificationServiceImpl implements EmailVerificationService {

    private final UserRepository userRepository;
    private final OtpService otpService;
    private final NotificationDispatcher dispatcher;
    private final UserServiceImpl userService;

    @Override
    public OtpIssueResult sendVerification(String rawEmail) {
        final String email = EmailAddresses.requireValid(rawEmail);
        requireUnverified(email);
        return otpService.issue(email, PasscodePurpose.EMAIL_VERIFICATION);
    }

    @Override
    public VerificationStatus verifyEmail(String rawEmail, String code) {
        final String email = EmailAddresses.requireValid(rawEmail);
        User user = requireUnverified(email);

        otpService.verify(email, code, PasscodePurpose.EMAIL_VERIFICATION);
        userRepository.markEmailVerified(email);
        userService.evictUserDetails(email);
        log.info("Email verified for {}", email);

        // welcome mail is a courtesy; the verification already happened
        try {
            dispatcher.sendWelcome(email, user.getHandle());
        } catch (ApiException e) {
            log.warn("Welcome email to {} not sent: {}", email, e.getMessage());
        }
        return VerificationStatus.builder()
                .email(email)
                .verified(true)
                .username(user.getHandle())
                .build();
    }

    @Override
    public VerificationStatus status(String rawEmail) {
        final String email = EmailAddresses.requireValid(rawEmail);
        User user = requireAccount(email);
        return VerificationStatus.builder()
                .email(email)
                .verified(user.isEmailVerified())
                .username(user.getHandle())
                .build();
    }

    private User requireUnverified(String email) {
        User user = requireAccount(email);
        if (user.isEmailVerified()) {
            throw new UserExceptions.EmailAlreadyVerified();
        }
        return user;
    }

    private User requireAccount(String email) {
        return userRepository.findByEmail(email)
                .filter(u -> !u.isDeleted())
                .orElseThrow(() -> new UserExceptions.UserNotFound("User not found"));
    }
}
