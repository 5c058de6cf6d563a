package com.aschik.accountservice.bootstrap;

import com.aschik.accountservice.entity.User;
import com.aschik.accountservice.entity.UserRole;
import com.aschik.accountservice.repository.UserRepository;
import com.aschik.accountservice.utils.EmailAddresses;
import com.aschik.accountservice.utils.PasswordHashes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Seeds a verified demo account for local runs. Off unless {@code app.init.enabled=true}.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.init", name = "enabled", havingValue = "true")
public class UserInitializer implements CommandLineRunner {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    @Value("${app.init.user.username:demo_user}")
    private String demoUsername;

    @Value("${app.init.user.email:user@example.com}")
    private String demoEmail;

    @Value("${app.init.user.password}")
    private String demoPassword;

    @Override
    @Transactional
    public void run(String... args) {
        createUserIfNotExists(demoUsername, demoEmail, demoPassword);
    }

    User createUserIfNotExists(String username, String rawEmail, String password) {
        String email = EmailAddresses.normalize(rawEmail);
        return userRepository.findByEmail(email).orElseGet(() -> {
            if (userRepository.existsByHandle(username)) {
                log.warn("Demo user not seeded: username '{}' is taken", username);
                return null;
            }
            User saved = userRepository.save(User.builder()
                    .handle(username)
                    .email(email)
                    .password(ensureEncoded(password))
                    .role(UserRole.ROLE_USER)
                    .emailVerified(true)
                    .build());
            log.info("Demo user '{}' added", email);
            return saved;
        });
    }

    private String ensureEncoded(String rawOrEncoded) {
        if (rawOrEncoded == null) throw new IllegalArgumentException("Password cannot be null");
        if (PasswordHashes.isBcrypt(rawOrEncoded)) return rawOrEncoded;
        return passwordEncoder.encode(rawOrEncoded);
    }
}
