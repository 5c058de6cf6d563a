package com.aschik.accountservice.utils;

import com.aschik.accountservice.config.MailSenderProperties;
import com.aschik.accountservice.entity.PasscodePurpose;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * Renders the outbound HTML mails. Subjects and bodies differ per passcode
 * purpose; the application name comes from the configured sender name.
 */
@Component
@RequiredArgsConstructor
public class EmailTemplate {

    private static final String FOOTER = """
                <hr style="margin: 30px 0;">
                <p style="color: #666; font-size: 12px;">
                    This is an automated message, please do not reply to this email.
                </p>
            </div>
            """;

    private final MailSenderProperties mailProperties;

    public record Rendered(String subject, String html) {}

    public Rendered passcode(PasscodePurpose purpose, String code, int validityMinutes) {
        String appName = HtmlUtils.htmlEscape(mailProperties.fromName());
        return switch (purpose) {
            case EMAIL_VERIFICATION -> new Rendered("Email Verification - OTP Code", """
                    <div style="font-family: Arial, sans-serif; max-width: 600px; margin: 0 auto;">
                        <h2 style="color: #333;">Email Verification</h2>
                        <p>Hello,</p>
                        <p>Thank you for registering with %s!</p>
                        <p>Your email verification code is:</p>
                        %s
                        <p>This code will expire in %d minutes.</p>
                        <p>If you didn't create an account, please ignore this email.</p>
                    """.formatted(appName, codeBlock(code, "#007bff"), validityMinutes) + FOOTER);
            case PASSWORD_RESET -> new Rendered("Password Reset - OTP Code", """
                    <div style="font-family: Arial, sans-serif; max-width: 600px; margin: 0 auto;">
                        <h2 style="color: #dc3545;">Password Reset Request</h2>
                        <p>Hello,</p>
                        <p>We received a request to reset your password for %s.</p>
                        <p>Your password reset verification code is:</p>
                        %s
                        <p>This code will expire in %d minutes.</p>
                        <p><strong>Important:</strong> If you didn't request a password reset, please ignore this email and your password will remain unchanged.</p>
                        <p>Never share this code with anyone.</p>
                    """.formatted(appName, codeBlock(code, "#dc3545"), validityMinutes) + FOOTER);
        };
    }

    public Rendered welcome(String username) {
        String appName = HtmlUtils.htmlEscape(mailProperties.fromName());
        return new Rendered("Welcome to " + mailProperties.fromName() + "!", """
                <div style="font-family: Arial, sans-serif; max-width: 600px; margin: 0 auto;">
                    <h2 style="color: #28a745;">Welcome to %s!</h2>
                    <p>Hello <strong>%s</strong>,</p>
                    <p>Congratulations! Your email has been successfully verified.</p>
                    <p>You can now enjoy all the features of our platform.</p>
                """.formatted(appName, HtmlUtils.htmlEscape(username == null ? "" : username)) + FOOTER);
    }

    private static String codeBlock(String code, String color) {
        return """
                <div style="background: #f8f9fa; padding: 20px; text-align: center; margin: 20px 0; border-radius: 8px;">
                    <h1 style="color: %s; font-size: 32px; margin: 0; letter-spacing: 5px;">%s</h1>
                </div>""".formatted(color, code);
    }
}
