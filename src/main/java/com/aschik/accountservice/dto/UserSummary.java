package com.aschik.accountservice.dto;

import com.aschik.accountservice.entity.User;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserSummary {
    private String id;
    private String username;
    private String email;
    private String role;
    private boolean emailVerified;
    private LocalDateTime createdAt;

    public static UserSummary from(User user) {
        return UserSummary.builder()
                .id(user.getId() != null ? user.getId().toString() : null)
                .username(user.getHandle())
                .email(user.getEmail())
                .role(user.getRole().name())
                .emailVerified(user.isEmailVerified())
                .createdAt(user.getCreatedAt())
                .build();
    }
}
