package com.aschik.accountservice.serviceImpl;

import com.aschik.accountservice.config.MailSenderProperties;
import com.aschik.accountservice.entity.PasscodePurpose;
import com.aschik.accountservice.exception.OtpExceptions;
import com.aschik.accountservice.service.NotificationDispatcher;
import com.aschik.accountservice.utils.EmailTemplate;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;

import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;

@Slf4j
@Service
@RequiredArgsConstructor
public class MailNotificationDispatcher implements NotificationDispatcher {

    private final JavaMailSender mailSender;
    private final EmailTemplate emailTemplate;
    private final MailSenderProperties mailProperties;

    @Override
    public void send(String address, PasscodePurpose purpose, String code, int validityMinutes) {
        deliver(address, emailTemplate.passcode(purpose, code, validityMinutes));
    }

    @Override
    public void sendWelcome(String address, String username) {
        deliver(address, emailTemplate.welcome(username));
    }

    @Override
    public boolean testConnection() {
        if (!(mailSender instanceof JavaMailSenderImpl impl)) {
            return true;
        }
        try {
            impl.testConnection();
            return true;
        } catch (MessagingException e) {
            log.warn("Mail transport unreachable: {}", e.getMessage());
            return false;
        }
    }

    private void deliver(String address, EmailTemplate.Rendered mail) {
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, false, StandardCharsets.UTF_8.name());
            helper.setFrom(mailProperties.fromAddress(), mailProperties.fromName());
            helper.setTo(address);
            helper.setSubject(mail.subject());
            helper.setText(mail.html(), true);
            mailSender.send(message);
            log.debug("Mail '{}' handed to transport for {}", mail.subject(), address);
        } catch (MailException | MessagingException | UnsupportedEncodingException e) {
            log.warn("Mail delivery to {} failed: {}", address, e.getMessage());
            throw new OtpExceptions.DeliveryFailed("Failed to send email", e);
        }
    }
}
