package com.aschik.accountservice.serviceImpl;

import com.aschik.accountservice.service.PasscodeStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/** Physically removes expired passcodes. Lookups already ignore them. */
@Slf4j
@Component
@RequiredArgsConstructor
public class PasscodeHousekeeping {

    private final PasscodeStore store;
    private final Clock clock;

    @Scheduled(cron = "${app.otp.purge-cron:0 15 * * * *}")
    public void purgeExpired() {
        int removed = store.purgeExpired(clock.instant());
        if (removed > 0) {
            log.info("Purged {} expired passcode(s)", removed);
        }
    }
}
