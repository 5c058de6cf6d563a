package com.aschik.accountservice.serviceImpl;

import com.aschik.accountservice.config.OtpProperties;
import com.aschik.accountservice.dto.OtpIssueResult;
import com.aschik.accountservice.dto.PasscodeHistoryEntry;
import com.aschik.accountservice.entity.PasscodePurpose;
import com.aschik.accountservice.exception.OtpExceptions;
import com.aschik.accountservice.service.NotificationDispatcher;
import com.aschik.accountservice.service.OtpService;
import com.aschik.accountservice.service.PasscodeStore;
import com.aschik.accountservice.utils.EmailAddresses;
import com.aschik.accountservice.utils.PasscodeGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Passcode lifecycle per (email, purpose):
 * <pre>
 * none        --issue-->        outstanding
 * outstanding --issue-->        previous invalidated, new outstanding
 * outstanding --time passes-->  expired (terminal)
 * outstanding --correct code--> used (terminal)
 * outstanding --wrong code-->   unchanged
 * </pre>
 * Failures never say whether a code was wrong, expired or already used.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OtpServiceImpl implements OtpService {

    private static final int HISTORY_LIMIT = 20;

    private final PasscodeStore store;
    private final NotificationDispatcher dispatcher;
    private final PasscodeGenerator generator;
    private final OtpProperties otpProperties;
    private final Clock clock;

    @Override
    public OtpIssueResult issue(String rawEmail, PasscodePurpose purpose) {
        final String email = EmailAddresses.requireValid(rawEmail);
        final int validity = otpProperties.expiresInMinutes();

        String code = generator.generate(otpProperties.length());
        Instant expiresAt = clock.instant().plus(Duration.ofMinutes(validity));

        store.replaceOutstanding(email, code, purpose, expiresAt);
        log.info("Issued {} code for {} (valid {} min)", purpose, email, validity);

        // persisted first: a failed hand-off is reported, the stored code stays as is
        dispatcher.send(email, purpose, code, validity);

        return OtpIssueResult.builder()
                .email(email)
                .purpose(purpose)
                .expiresInMinutes(validity)
                .expiresAt(expiresAt)
                .build();
    }

    @Override
    public void verify(String rawEmail, String code, PasscodePurpose purpose) {
        final String email = EmailAddresses.normalize(rawEmail);
        if (!StringUtils.hasText(email) || !StringUtils.hasText(code)) {
            throw new OtpExceptions.InvalidOrExpiredCode();
        }
        if (!store.consume(email, code.trim(), purpose, clock.instant())) {
            log.debug("Rejected {} code for {}", purpose, email);
            throw new OtpExceptions.InvalidOrExpiredCode();
        }
        log.info("Verified {} code for {}", purpose, email);
    }

    @Override
    public List<PasscodeHistoryEntry> history(String rawEmail) {
        final String email = EmailAddresses.requireValid(rawEmail);
        return store.history(email, HISTORY_LIMIT).stream()
                .map(PasscodeHistoryEntry::from)
                .toList();
    }
}
