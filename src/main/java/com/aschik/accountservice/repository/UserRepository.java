package com.aschik.accountservice.repository;

import com.aschik.accountservice.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface UserRepository extends JpaRepository<User, UUID> {

    @Query("SELECT u FROM User u WHERE u.deleted = false ORDER BY u.createdAt DESC")
    List<User> findAllActiveUsers();

    @Query("SELECT u FROM User u WHERE u.id = :id AND u.deleted = false")
    Optional<User> findActiveById(@Param("id") UUID id);

    boolean existsByEmail(String email);

    boolean existsByHandle(String handle);

    Optional<User> findByEmail(String email);

    long countByDeletedFalse();

    /** Replaces the credential in a single statement. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE User u SET u.password = :hash WHERE u.email = :email")
    int updatePassword(@Param("email") String email, @Param("hash") String hash);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE User u SET u.emailVerified = true WHERE u.email = :email")
    int markEmailVerified(@Param("email") String email);
}
