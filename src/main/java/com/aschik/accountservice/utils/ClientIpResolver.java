package com.aschik.accountservice.utils;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.util.StringUtils;

import java.util.Collection;

public final class ClientIpResolver {

    private ClientIpResolver() {}

    /**
     * Client address for rate limiting. The socket address wins unless it belongs to a
     * trusted proxy; only then are X-Forwarded-For (right to left, skipping trusted hops)
     * and X-Real-IP consulted.
     */
    public static String resolve(HttpServletRequest request, Collection<String> trustedProxies) {
        String remote = request.getRemoteAddr();
        if (trustedProxies == null || !trustedProxies.contains(remote)) {
            return remote;
        }
        String xfHeader = request.getHeader("X-Forwarded-For");
        if (StringUtils.hasText(xfHeader)) {
            String[] hops = xfHeader.split(",");
            for (int i = hops.length - 1; i >= 0; i--) {
                String hop = hops[i].trim();
                if (!hop.isEmpty() && !trustedProxies.contains(hop)) {
                    return hop;
                }
            }
        }
        String realIp = request.getHeader("X-Real-IP");
        if (StringUtils.hasText(realIp)) {
            return realIp.trim();
        }
        return remote;
    }
}
