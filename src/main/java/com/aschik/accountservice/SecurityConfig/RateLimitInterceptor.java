package com.aschik.accountservice.SecurityConfig;

import com.aschik.accountservice.config.RateLimitProperties;
import com.aschik.accountservice.exception.RequestExceptions;
import com.aschik.accountservice.service.RateLimiter;
import com.aschik.accountservice.utils.ClientIpResolver;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Applies {@link RateLimit} before the handler runs. Rejections are thrown as
 * {@link RequestExceptions.RateLimited} so they render like every other error.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimitInterceptor implements HandlerInterceptor {

    private final RateLimiter rateLimiter;
    private final RateLimitProperties properties;

    @Override
    public boolean preHandle(@NonNull HttpServletRequest request,
                             @NonNull HttpServletResponse response,
                             @NonNull Object handler) {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }
        RateLimit rateLimit = handlerMethod.getMethodAnnotation(RateLimit.class);
        if (rateLimit == null) {
            rateLimit = handlerMethod.getBeanType().getAnnotation(RateLimit.class);
            if (rateLimit == null) {
                return true;
            }
        }

        String clientIp = ClientIpResolver.resolve(request, properties.trustedProxies());
        long retryAfter = rateLimiter.tryAcquire(rateLimit.value(), clientIp);
        if (retryAfter > 0) {
            log.warn("Rate limit {} exceeded for {} on {}", rateLimit.value(), clientIp, request.getRequestURI());
            throw new RequestExceptions.RateLimited(rateLimit.value().message(), retryAfter);
        }
        return true;
    }
}
