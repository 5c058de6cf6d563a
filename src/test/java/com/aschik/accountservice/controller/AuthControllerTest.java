package com.aschik.accountservice.controller;

import com.aschik.accountservice.dto.LoginRequest;
import com.aschik.accountservice.dto.LoginResponse;
import com.aschik.accountservice.dto.RegistrationResponse;
import com.aschik.accountservice.dto.SignupRequest;
import com.aschik.accountservice.dto.UserSummary;
import com.aschik.accountservice.exception.OtpExceptions;
import com.aschik.accountservice.exception.UserExceptions;
import com.aschik.accountservice.service.AuthService;
import com.aschik.accountservice.service.PasswordResetService;
import com.aschik.accountservice.service.RegistrationService;
import com.aschik.accountservice.testsupport.StandaloneMvc;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AuthControllerTest {

    private AuthService authService;
    private RegistrationService registrationService;
    private PasswordResetService passwordResetService;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        authService = Mockito.mock(AuthService.class);
        registrationService = Mockito.mock(RegistrationService.class);
        passwordResetService = Mockito.mock(PasswordResetService.class);
        mvc = StandaloneMvc.of(new AuthController(authService, registrationService, passwordResetService));
    }

    @Test
    void signup_should_return_201_inside_the_success_envelope() throws Exception {
        Mockito.when(registrationService.registerUser(any(SignupRequest.class))).thenReturn(RegistrationResponse.builder()
                .user(UserSummary.builder().username("alice").email("alice@example.com").role("ROLE_USER").build())
                .verificationSent(true)
                .build());

        mvc.perform(post("/auth/signup").contentType(MediaType.APPLICATION_JSON)
                        .header("X-Request-Id", "rid-42")
                        .content("{\"username\":\"alice\",\"email\":\"alice@example.com\",\"password\":\"secret1\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.code").value("OK"))
                .andExpect(jsonPath("$.message").value(containsString("verification code")))
                .andExpect(jsonPath("$.data.user.username").value("alice"))
                .andExpect(jsonPath("$.data.verificationSent").value(true))
                .andExpect(jsonPath("$.meta.requestId").value("rid-42"));
    }

    @Test
    void signup_should_reject_an_invalid_body_as_a_problem_document() throws Exception {
        mvc.perform(post("/auth/signup").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"a b\",\"email\":\"alice@example.com\",\"password\":\"secret1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(header().string("Content-Type", containsString("application/problem+json")))
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.detail").value(containsString("username")));
        Mockito.verifyNoInteractions(registrationService);
    }

    @Test
    void signup_conflict_should_map_to_409() throws Exception {
        Mockito.when(registrationService.registerUser(any(SignupRequest.class)))
                .thenThrow(new UserExceptions.UserAlreadyExists("Username or email already exists"));

        mvc.perform(post("/auth/signup").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"alice\",\"email\":\"alice@example.com\",\"password\":\"secret1\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("USER_ALREADY_EXISTS"));
    }

    @Test
    void signin_should_return_the_token_payload() throws Exception {
        Mockito.when(authService.login(any(LoginRequest.class))).thenReturn(LoginResponse.builder()
                .accessToken("jwt").tokenType("Bearer").expiresIn(3600L).build());

        mvc.perform(post("/auth/signin").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"alice@example.com\",\"password\":\"secret1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Login successful"))
                .andExpect(jsonPath("$.data.accessToken").value("jwt"))
                .andExpect(jsonPath("$.data.password").doesNotExist());
    }

    @Test
    void signin_with_bad_credentials_should_be_401() throws Exception {
        Mockito.when(authService.login(any(LoginRequest.class))).thenThrow(new UserExceptions.InvalidCredentials());

        mvc.perform(post("/auth/signin").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"alice@example.com\",\"password\":\"wrong\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"))
                .andExpect(jsonPath("$.detail").value("Invalid email or password"));
    }

    @Test
    void forgot_password_should_answer_the_same_for_every_address() throws Exception {
        mvc.perform(post("/auth/forgot-password").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"nobody@example.com\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value(AuthController.RESET_REQUESTED_MESSAGE));
        Mockito.verify(passwordResetService).requestReset("nobody@example.com");
    }

    @Test
    void reset_password_with_a_stale_code_should_be_400() throws Exception {
        Mockito.doThrow(new OtpExceptions.InvalidOrExpiredCode())
                .when(passwordResetService).completeReset(anyString(), anyString(), anyString());

        mvc.perform(post("/auth/reset-password").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"alice@example.com\",\"code\":\"123456\",\"newPassword\":\"newpass\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_OR_EXPIRED_CODE"))
                .andExpect(jsonPath("$.detail").value("Invalid or expired OTP"));
    }

    @Test
    void reset_password_should_confirm_success() throws Exception {
        mvc.perform(post("/auth/reset-password").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"alice@example.com\",\"otp\":\"123456\",\"newPassword\":\"newpass\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Password reset successfully"));
        Mockito.verify(passwordResetService).completeReset("alice@example.com", "123456", "newpass");
    }

    @Test
    void logout_should_require_a_bearer_token() throws Exception {
        mvc.perform(post("/auth/logout"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_TOKEN"));

        mvc.perform(post("/auth/logout").header("Authorization", "Bearer abc.def.ghi"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Logged out successfully"));
        Mockito.verify(authService).logout("abc.def.ghi");
    }
}
