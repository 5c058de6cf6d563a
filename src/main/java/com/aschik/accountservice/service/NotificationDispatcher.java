package com.aschik.accountservice.service;

import com.aschik.accountservice.entity.PasscodePurpose;

/**
 * Outbound notifications. No retries happen at this layer; a failed hand-off
 * raises {@link com.aschik.accountservice.exception.OtpExceptions.DeliveryFailed}.
 */
public interface NotificationDispatcher {

    void send(String address, PasscodePurpose purpose, String code, int validityMinutes);

    void sendWelcome(String address, String username);

    /** Whether the mail transport currently accepts connections. */
    boolean testConnection();
}
