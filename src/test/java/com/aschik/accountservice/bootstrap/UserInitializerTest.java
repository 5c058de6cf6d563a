package com.aschik.accountservice.bootstrap;

import com.aschik.accountservice.entity.User;
import com.aschik.accountservice.entity.UserRole;
import com.aschik.accountservice.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;

class UserInitializerTest {

    private UserRepository userRepository;
    private PasswordEncoder encoder;
    private UserInitializer initializer;

    @BeforeEach
    void setUp() {
        userRepository = Mockito.mock(UserRepository.class);
        encoder = new BCryptPasswordEncoder(4);
        initializer = new UserInitializer(userRepository, encoder);
        Mockito.when(userRepository.save(any(User.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void should_seed_a_verified_user_with_an_encoded_password() {
        Mockito.when(userRepository.findByEmail("demo@example.com")).thenReturn(Optional.empty());

        User seeded = initializer.createUserIfNotExists("demo_user", " Demo@Example.com ", "demo123");

        ArgumentCaptor<User> saved = ArgumentCaptor.forClass(User.class);
        Mockito.verify(userRepository).save(saved.capture());
        assertThat(seeded).isSameAs(saved.getValue());
        assertThat(seeded.getEmail()).isEqualTo("demo@example.com");
        assertThat(seeded.getRole()).isEqualTo(UserRole.ROLE_USER);
        assertThat(seeded.isEmailVerified()).isTrue();
        assertThat(encoder.matches("demo123", seeded.getPassword())).isTrue();
    }

    @Test
    void should_keep_an_already_encoded_password() {
        String hash = encoder.encode("demo123");
        Mockito.when(userRepository.findByEmail("demo@example.com")).thenReturn(Optional.empty());

        User seeded = initializer.createUserIfNotExists("demo_user", "demo@example.com", hash);

        assertThat(seeded.getPassword()).isEqualTo(hash);
    }

    @Test
    void should_be_idempotent() {
        User existing = User.builder().handle("demo_user").email("demo@example.com").role(UserRole.ROLE_USER).build();
        Mockito.when(userRepository.findByEmail("demo@example.com")).thenReturn(Optional.of(existing));

        assertThat(initializer.createUserIfNotExists("demo_user", "demo@example.com", "demo123")).isSameAs(existing);
        Mockito.verify(userRepository, Mockito.never()).save(any(User.class));
    }

    @Test
    void should_skip_when_the_username_is_taken() {
        Mockito.when(userRepository.findByEmail("demo@example.com")).thenReturn(Optional.empty());
        Mockito.when(userRepository.existsByHandle("demo_user")).thenReturn(true);

        assertThat(initializer.createUserIfNotExists("demo_user", "demo@example.com", "demo123")).isNull();
        Mockito.verify(userRepository, Mockito.never()).save(any(User.class));
    }
}
