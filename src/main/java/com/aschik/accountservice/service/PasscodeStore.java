package com.aschik.accountservice.service;

import com.aschik.accountservice.entity.Passcode;
import com.aschik.accountservice.entity.PasscodePurpose;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable store of issued passcodes, keyed by (email, purpose).
 * <p>
 * Lookups never return an expired or used record, whether or not it has been
 * physically removed yet. Storage failures surface as
 * {@link com.aschik.accountservice.exception.OtpExceptions.PasscodeStorageFailure}.
 */
public interface PasscodeStore {

    Passcode insert(String email, String code, PasscodePurpose purpose, Instant expiresAt);

    /** Most recent unused record with {@code expiresAt > now}, if any. */
    Optional<Passcode> findValid(String email, String code, PasscodePurpose purpose, Instant now);

    /**
     * Flips {@code used} to true if it is still false.
     *
     * @return true only for the caller whose update changed the row
     */
    boolean markUsed(Long id, Instant now);

    int deleteAllFor(String email, PasscodePurpose purpose);

    /** Delete prior codes and insert the new one atomically. */
    Passcode replaceOutstanding(String email, String code, PasscodePurpose purpose, Instant expiresAt);

    /** {@link #findValid} followed by {@link #markUsed}; false when nothing was consumed. */
    boolean consume(String email, String code, PasscodePurpose purpose, Instant now);

    int purgeExpired(Instant now);

    List<Passcode> history(String email, int limit);
}
