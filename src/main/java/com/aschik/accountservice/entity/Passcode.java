package com.aschik.accountservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Passcode:
 * - Short-lived numeric code bound to an email and a purpose.
 * - Rows are never updated except for the forward-only used flag.
 * - Expired and used rows stay until the periodic purge removes them.
 */
@Entity
@Table(
        name = "passcodes",
        indexes = {
                @Index(name = "ix_passcode_email_purpose_created", columnList = "email, purpose, created_at"),
                @Index(name = "ix_passcode_lookup", columnList = "email, code, purpose"),
                @Index(name = "ix_passcode_expires", columnList = "expires_at")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = "code")
public class Passcode {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Normalized (trimmed, lower-case) address. */
    @Column(nullable = false, length = 100)
    private String email;

    @Column(nullable = false, length = 10)
    private String code;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private PasscodePurpose purpose;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Builder.Default
    @Column(nullable = false)
    private boolean used = false;

    @Column(name = "used_at")
    private Instant usedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
