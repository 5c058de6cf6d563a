package com.aschik.accountservice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app.mail")
public record MailSenderProperties(
        @DefaultValue("no-reply@aschik.local") String fromAddress,
        @DefaultValue("Aschik Project") String fromName
) {}
