package com.medclinic.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.medclinic.backend.modules.auth.domain.Account;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AccountRepository extends JpaRepository<Account, UUID> {

    @Query("select a from Account a where lower(a.email) = lower(:email)")
    Optional<Account> findByEmailIgnoreCase(@Param("email") String email);

    boolean existsByEmail(String email);

    Page<Account> findByLockedUntilAfter(OffsetDateTime now, Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Account a
               set a.failedAttempts = :failedAttempts,
                   a.lockedUntil = :lockedUntil,
                   a.version = a.version + 1,
                   a.updatedAt = :now
             where a.id = :id
               and a.version = :expectedVersion
            """)
    int updateLockoutState(@Param("id") UUID id,
                           @Param("expectedVersion") long expectedVersion,
                           @Param("failedAttempts") int failedAttempts,
                           @Param("lockedUntil") OffsetDateTime lockedUntil,
                           @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Account a
               set a.failedAttempts = 0,
                   a.lockedUntil = null,
                   a.lastLogin = :now,
                   a.version = a.version + 1,
                   a.updatedAt = :now
             where a.id = :id
               and a.version = :expectedVersion
            """)
    int recordSuccessfulLogin(@Param("id") UUID id,
                              @Param("expectedVersion") long expectedVersion,
                              @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Account a
               set a.passwordHash = :passwordHash,
                   a.version = a.version + 1,
                   a.updatedAt = :now
             where a.id = :id
            """)
    int updatePasswordHash(@Param("id") UUID id,
                           @Param("passwordHash") String passwordHash,
                           @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Account a
               set a.failedAttempts = 0,
                   a.lockedUntil = null,
                   a.version = a.version + 1,
                   a.updatedAt = :now
             where a.id = :id
            """)
    int resetLockout(@Param("id") UUID id, @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Account a
               set a.active = :active,
                   a.version = a.version + 1,
                   a.updatedAt = :now
             where a.id = :id
            """)
    int updateActive(@Param("id") UUID id,
                     @Param("active") boolean active,
                     @Param("now") OffsetDateTime now);
}
