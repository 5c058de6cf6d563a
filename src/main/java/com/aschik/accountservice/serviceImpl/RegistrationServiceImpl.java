package com.aschik.accountservice.serviceImpl;

import com.aschik.accountservice.dto.RegistrationResponse;
import com.aschik.accountservice.dto.SignupRequest;
import com.aschik.accountservice.dto.UserSummary;
import com.aschik.accountservice.entity.PasscodePurpose;
import com.aschik.accountservice.entity.User;
import com.aschik.accountservice.entity.UserRole;
import com.aschik.accountservice.exception.ApiException;
import com.aschik.accountservice.exception.RequestExceptions;
import com.aschik.accountservice.exception.UserExceptions;
import com.aschik.accountservice.repository.UserRepository;
import com.aschik.accountservice.service.OtpService;
import com.aschik.accountservice.service.RegistrationService;
import com.aschik.accountservice.utils.EmailAddresses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class RegistrationServiceImpl implements RegistrationService {

    private static final Pattern USERNAME = Pattern.compile("^[A-Za-z0-9_]{3,50}$");
    private static final int MIN_PASSWORD_LENGTH = 6;

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final OtpService otpService;

    @Override
    public RegistrationResponse registerUser(SignupRequest request) {
        final String username = request.getUsername() == null ? "" : request.getUsername().trim();
        if (!USERNAME.matcher(username).matches()) {
            throw new RequestExceptions.ValidationFailed(
                    "Username must be at least 3 characters long and contain only letters, digits and underscores");
        }
        final String email = EmailAddresses.requireValid(request.getEmail());
        if (request.getPassword() == null || request.getPassword().length() < MIN_PASSWORD_LENGTH) {
            throw new RequestExceptions.ValidationFailed(
                    "Password must be at least " + MIN_PASSWORD_LENGTH + " characters long");
        }

        if (userRepository.existsByEmail(email)) {
            throw new UserExceptions.UserAlreadyExists("User with this email already exists");
        }
        if (userRepository.existsByHandle(username)) {
            throw new UserExceptions.UserAlreadyExists("User with this username already exists");
        }

        User saved;
        try {
            saved = userRepository.save(User.builder()
                    .handle(username)
                    .email(email)
                    .password(passwordEncoder.encode(request.getPassword()))
                    .role(UserRole.ROLE_USER)
                    .emailVerified(false)
                    .build());
        } catch (DataIntegrityViolationException e) {
            // lost a race against a concurrent signup with the same email or username
            throw new UserExceptions.UserAlreadyExists("User with this email or username already exists");
        }
        log.info("Registered user {} ({})", username, email);

        boolean verificationSent;
        try {
            otpService.issue(email, PasscodePurpose.EMAIL_VERIFICATION);
            verificationSent = true;
        } catch (ApiException e) {
            // the account stands; the user can ask for a new code via /otp/send-verification
            log.warn("Verification email for {} not sent: {}", email, e.getMessage());
            verificationSent = false;
        }

        return RegistrationResponse.builder()
                .user(UserSummary.from(saved))
                .verificationSent(verificationSent)
                .build();
    }
}
