package com.aschik.accountservice.utils;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;

import static org.assertj.core.api.Assertions.assertThat;

class AuditorAwareImplTest {

    private final AuditorAwareImpl auditor = new AuditorAwareImpl();

    @AfterEach
    void clear() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void should_fall_back_to_system_without_an_authenticated_principal() {
        assertThat(auditor.getCurrentAuditor()).contains(AuditorAwareImpl.SYSTEM);

        SecurityContextHolder.getContext().setAuthentication(new AnonymousAuthenticationToken(
                "key", "anonymousUser", AuthorityUtils.createAuthorityList("ROLE_ANONYMOUS")));
        assertThat(auditor.getCurrentAuditor()).contains(AuditorAwareImpl.SYSTEM);
    }

    @Test
    void should_prefix_users_and_admins() {
        authenticate(User.withUsername("alice@example.com").password("x").roles("USER").build());
        assertThat(auditor.getCurrentAuditor()).contains("USER:alice@example.com");

        authenticate(User.withUsername("admin@example.com").password("x").roles("ADMIN").build());
        assertThat(auditor.getCurrentAuditor()).contains("ADMIN:admin@example.com");
    }

    private static void authenticate(UserDetails user) {
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(user, null, user.getAuthorities()));
    }
}
