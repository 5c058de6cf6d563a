package com.aschik.accountservice.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmailRequest {

    // syntax is checked by the service so that reset requests fail before any lookup
    @NotBlank(message = "email is required")
    private String email;
}
