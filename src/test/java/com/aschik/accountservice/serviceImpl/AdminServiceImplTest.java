package com.aschik.accountservice.serviceImpl;

import com.aschik.accountservice.SecurityConfig.JwtTokenProviderConfig;
import com.aschik.accountservice.config.AdminProperties;
import com.aschik.accountservice.dto.AdminLoginRequest;
import com.aschik.accountservice.dto.LoginResponse;
import com.aschik.accountservice.dto.SystemStatus;
import com.aschik.accountservice.exception.UserExceptions;
import com.aschik.accountservice.repository.UserRepository;
import com.aschik.accountservice.service.NotificationDispatcher;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AdminServiceImplTest {

    private final PasswordEncoder encoder = new BCryptPasswordEncoder(4);
    private final JwtTokenProviderConfig jwt = new JwtTokenProviderConfig(AuthServiceImplTest.SECRET, 3_600_000L);
    private final UserRepository userRepository = Mockito.mock(UserRepository.class);
    private final NotificationDispatcher dispatcher = Mockito.mock(NotificationDispatcher.class);
    private final MinioImageStorage remote = Mockito.mock(MinioImageStorage.class);

    @Test
    void login_should_issue_an_admin_token() {
        AdminServiceImpl service = service(new AdminProperties("admin@example.com", "s3cret!", "Administrator"));

        LoginResponse response = service.login(new AdminLoginRequest("ADMIN@example.com ", "s3cret!"));

        assertThat(jwt.extractType(response.getAccessToken())).contains(JwtTokenProviderConfig.TokenType.ADMIN);
        assertThat(jwt.extractEmail(response.getAccessToken())).isEqualTo("admin@example.com");
    }

    @Test
    void login_should_accept_a_bcrypt_configured_password() {
        AdminServiceImpl service = service(new AdminProperties("admin@example.com", encoder.encode("s3cret!"), "Admin"));

        assertThat(service.login(new AdminLoginRequest("admin@example.com", "s3cret!")).getAccessToken()).isNotBlank();
        assertThrows(UserExceptions.InvalidCredentials.class,
                () -> service.login(new AdminLoginRequest("admin@example.com", "wrong")));
    }

    @Test
    void login_should_reject_wrong_credentials() {
        AdminServiceImpl service = service(new AdminProperties("admin@example.com", "s3cret!", "Administrator"));

        assertThrows(UserExceptions.InvalidCredentials.class,
                () -> service.login(new AdminLoginRequest("admin@example.com", "s3cret")));
        assertThrows(UserExceptions.InvalidCredentials.class,
                () -> service.login(new AdminLoginRequest("other@example.com", "s3cret!")));
    }

    @Test
    void login_should_fail_when_no_admin_is_configured() {
        AdminServiceImpl service = service(new AdminProperties(null, null, "Administrator"));

        assertThrows(UserExceptions.AdminNotConfigured.class,
                () -> service.login(new AdminLoginRequest("admin@example.com", "x")));
    }

    @Test
    void systemStatus_should_report_users_mail_and_storage() {
        Mockito.when(userRepository.countByDeletedFalse()).thenReturn(42L);
        Mockito.when(dispatcher.testConnection()).thenReturn(false);
        Mockito.when(remote.isEnabled()).thenReturn(true);
        AdminServiceImpl service = service(new AdminProperties("admin@example.com", "s3cret!", "Administrator"));

        SystemStatus status = service.systemStatus();

        assertThat(status.getActiveUsers()).isEqualTo(42L);
        assertThat(status.isMailReachable()).isFalse();
        assertThat(status.isRemoteStorageEnabled()).isTrue();
        assertThat(status.getAvailableProcessors()).isPositive();
        assertThat(status.getJavaVersion()).isNotBlank();
    }

    private AdminServiceImpl service(AdminProperties properties) {
        return new AdminServiceImpl(properties, encoder, jwt, userRepository, dispatcher, remote, Clock.systemUTC());
    }
}
