package com.aschik.accountservice.serviceImpl;

import com.aschik.accountservice.entity.Passcode;
import com.aschik.accountservice.entity.PasscodePurpose;
import com.aschik.accountservice.exception.OtpExceptions;
import com.aschik.accountservice.repository.PasscodeRepository;
import com.aschik.accountservice.service.PasscodeStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Passcode store on the relational database:
 * - Issuance deletes and inserts inside one transaction.
 * - Consumption relies on a conditional UPDATE (used=false guard), so two
 *   requests racing on the same row cannot both succeed.
 * - Expiry is a query-time filter; the hourly purge does the physical delete.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaPasscodeStore implements PasscodeStore {

    private final PasscodeRepository passcodeRepo;
    private final Clock clock;

    @Override
    @Transactional
    public Passcode insert(String email, String code, PasscodePurpose purpose, Instant expiresAt) {
        return guarded("insert", () -> passcodeRepo.saveAndFlush(Passcode.builder()
                .email(email)
                .code(code)
                .purpose(purpose)
                .expiresAt(expiresAt)
                .used(false)
                .createdAt(clock.instant())
                .build()));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Passcode> findValid(String email, String code, PasscodePurpose purpose, Instant now) {
        return guarded("lookup", () -> passcodeRepo
                .findFirstByEmailAndCodeAndPurposeAndUsedFalseAndExpiresAtAfterOrderByCreatedAtDescIdDesc(
                        email, code, purpose, now));
    }

    @Override
    @Transactional
    public boolean markUsed(Long id, Instant now) {
        return guarded("mark-used", () -> passcodeRepo.markUsed(id, now) == 1);
    }

    @Override
    @Transactional
    public int deleteAllFor(String email, PasscodePurpose purpose) {
        return guarded("delete", () -> passcodeRepo.deleteAllFor(email, purpose));
    }

    @Override
    @Transactional
    public Passcode replaceOutstanding(String email, String code, PasscodePurpose purpose, Instant expiresAt) {
        int removed = deleteAllFor(email, purpose);
        if (removed > 0) {
            log.debug("Invalidated {} previous {} code(s) for {}", removed, purpose, email);
        }
        return insert(email, code, purpose, expiresAt);
    }

    @Override
    @Transactional
    public boolean consume(String email, String code, PasscodePurpose purpose, Instant now) {
        return findValid(email, code, purpose, now)
                .map(p -> markUsed(p.getId(), now))
                .orElse(false);
    }

    @Override
    @Transactional
    public int purgeExpired(Instant now) {
        return guarded("purge", () -> passcodeRepo.deleteExpired(now));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Passcode> history(String email, int limit) {
        return guarded("history", () -> passcodeRepo.findByEmailOrderByCreatedAtDescIdDesc(
                email, PageRequest.of(0, Math.max(1, limit))));
    }

    private <T> T guarded(String op, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new OtpExceptions.PasscodeStorageFailure("Passcode storage unavailable (" + op + ")", e);
        }
    }
}
