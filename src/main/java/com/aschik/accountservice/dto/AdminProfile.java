package com.aschik.accountservice.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AdminProfile {
    private String email;
    private String name;
    private String role;
}
