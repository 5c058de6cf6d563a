package com.aschik.accountservice.repository;

import com.aschik.accountservice.entity.Passcode;
import com.aschik.accountservice.entity.PasscodePurpose;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface PasscodeRepository extends JpaRepository<Passcode, Long> {

    /** Most recent unused, unexpired record for the exact (email, code, purpose). */
    Optional<Passcode> findFirstByEmailAndCodeAndPurposeAndUsedFalseAndExpiresAtAfterOrderByCreatedAtDescIdDesc(
            String email, String code, PasscodePurpose purpose, Instant now);

    /** Audit trail, newest first. */
    List<Passcode> findByEmailOrderByCreatedAtDescIdDesc(String email, Pageable page);

    /**
     * Flips the used flag only while it is still false. Zero rows affected means
     * another caller consumed the record first.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Passcode p set p.used = true, p.usedAt = :now where p.id = :id and p.used = false")
    int markUsed(@Param("id") Long id, @Param("now") Instant now);

    @Modifying(flushAutomatically = true)
    @Query("delete from Passcode p where p.email = :email and p.purpose = :purpose")
    int deleteAllFor(@Param("email") String email, @Param("purpose") PasscodePurpose purpose);

    /** Hard delete of expired rows (cleanup job). */
    @Modifying
    @Query("delete from Passcode p where p.expiresAt < :now")
    int deleteExpired(@Param("now") Instant now);
}
