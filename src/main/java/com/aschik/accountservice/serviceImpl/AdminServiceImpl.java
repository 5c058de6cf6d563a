package com.aschik.accountservice.serviceImpl;

import com.aschik.accountservice.SecurityConfig.JwtTokenProviderConfig;
import com.aschik.accountservice.config.AdminProperties;
import com.aschik.accountservice.dto.AdminLoginRequest;
import com.aschik.accountservice.dto.AdminProfile;
import com.aschik.accountservice.dto.LoginResponse;
import com.aschik.accountservice.dto.SystemStatus;
import com.aschik.accountservice.entity.UserRole;
import com.aschik.accountservice.exception.UserExceptions;
import com.aschik.accountservice.repository.UserRepository;
import com.aschik.accountservice.service.AdminService;
import com.aschik.accountservice.service.NotificationDispatcher;
import com.aschik.accountservice.utils.PasswordHashes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;

/**
 * Static administrator backed by configuration. {@code app.admin.password} may be
 * plain text or a BCrypt hash.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminServiceImpl implements AdminService {

    private final AdminProperties adminProperties;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProviderConfig jwtTokenProvider;
    private final UserRepository userRepository;
    private final NotificationDispatcher dispatcher;
    private final MinioImageStorage remoteStorage;
    private final Clock clock;

    @Override
    public LoginResponse login(AdminLoginRequest request) {
        if (!adminProperties.isConfigured()) {
            throw new UserExceptions.AdminNotConfigured();
        }
        String email = request.getEmail() == null ? "" : request.getEmail().trim();
        String password = request.getPassword() == null ? "" : request.getPassword();

        boolean emailMatches = email.equalsIgnoreCase(adminProperties.email().trim());
        boolean passwordMatches = passwordMatches(password);
        if (!emailMatches || !passwordMatches) {
            log.warn("Rejected admin login attempt");
            throw new UserExceptions.InvalidCredentials();
        }

        log.info("Admin login success");
        return LoginResponse.builder()
                .accessToken(jwtTokenProvider.generateAdminToken(adminProperties.email(), "ADMIN"))
                .tokenType(AuthServiceImpl.TOKEN_TYPE)
                .expiresIn(jwtTokenProvider.getTokenValiditySeconds())
                .issuedAt(Instant.now(clock))
                .email(adminProperties.email())
                .build();
    }

    @Override
    public AdminProfile profile() {
        if (!adminProperties.isConfigured()) {
            throw new UserExceptions.AdminNotConfigured();
        }
        return AdminProfile.builder()
                .email(adminProperties.email())
                .name(adminProperties.name())
                .role(UserRole.ROLE_ADMIN.name())
                .build();
    }

    @Override
    public SystemStatus systemStatus() {
        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        return SystemStatus.builder()
                .serverTime(Instant.now(clock))
                .uptimeSeconds(ManagementFactory.getRuntimeMXBean().getUptime() / 1000)
                .javaVersion(System.getProperty("java.version"))
                .heapUsedBytes(heap.getUsed())
                .heapMaxBytes(heap.getMax())
                .availableProcessors(Runtime.getRuntime().availableProcessors())
                .activeUsers(userRepository.countByDeletedFalse())
                .mailReachable(dispatcher.testConnection())
                .remoteStorageEnabled(remoteStorage.isEnabled())
                .build();
    }

    private boolean passwordMatches(String candidate) {
        String configured = adminProperties.password();
        if (PasswordHashes.isBcrypt(configured)) {
            return passwordEncoder.matches(candidate, configured);
        }
        return MessageDigest.isEqual(
                candidate.getBytes(StandardCharsets.UTF_8),
                configured.getBytes(StandardCharsets.UTF_8));
    }
}
