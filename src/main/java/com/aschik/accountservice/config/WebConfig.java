package com.aschik.accountservice.config;

import com.aschik.accountservice.SecurityConfig.RateLimitInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;

@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    public static final String LOCAL_IMAGES_PATH = "/uploads/images/";

    private final RateLimitInterceptor rateLimitInterceptor;
    private final StorageProperties storageProperties;

    @Override
    public void addInterceptors(@NonNull InterceptorRegistry registry) {
        registry.addInterceptor(rateLimitInterceptor);
    }

    @Override
    public void addResourceHandlers(@NonNull ResourceHandlerRegistry registry) {
        String location = Path.of(storageProperties.local().dir()).toAbsolutePath().normalize().toUri().toString();
        registry.addResourceHandler(LOCAL_IMAGES_PATH + "**")
                .addResourceLocations(location.endsWith("/") ? location : location + "/");
    }
}
