package com.aschik.accountservice.utils;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ClientIpResolverTest {

    private static final List<String> PROXIES = List.of("10.0.0.1", "10.0.0.2");

    @Test
    void should_ignore_forwarding_headers_from_untrusted_peers() {
        MockHttpServletRequest req = new MockHttpServletRequest();
        req.setRemoteAddr("203.0.113.9");
        req.addHeader("X-Forwarded-For", "198.51.100.77");
        req.addHeader("X-Real-IP", "198.51.100.78");

        assertThat(ClientIpResolver.resolve(req, PROXIES)).isEqualTo("203.0.113.9");
        assertThat(ClientIpResolver.resolve(req, List.of())).isEqualTo("203.0.113.9");
    }

    @Test
    void should_take_the_nearest_untrusted_hop_behind_a_trusted_proxy() {
        MockHttpServletRequest req = new MockHttpServletRequest();
        req.setRemoteAddr("10.0.0.1");
        // leftmost entry is whatever the client claimed
        req.addHeader("X-Forwarded-For", "1.2.3.4, 203.0.113.7, 10.0.0.2");

        assertThat(ClientIpResolver.resolve(req, PROXIES)).isEqualTo("203.0.113.7");
    }

    @Test
    void should_fall_back_to_real_ip_then_socket_behind_a_trusted_proxy() {
        MockHttpServletRequest req = new MockHttpServletRequest();
        req.setRemoteAddr("10.0.0.1");
        assertThat(ClientIpResolver.resolve(req, PROXIES)).isEqualTo("10.0.0.1");

        req.addHeader("X-Real-IP", "198.51.100.2");
        assertThat(ClientIpResolver.resolve(req, PROXIES)).isEqualTo("198.51.100.2");
    }
}
