package com.monumentlens.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.monumentlens.backend.modules.auth.domain.UserAccount;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserAccountRepository extends JpaRepository<UserAccount, UUID> {

    @Query("""
            select ua
              from UserAccount ua
             where ua.usernameNormalized = :normalized
                or ua.emailNormalized = :normalized
            """)
    Optional<UserAccount> findByNormalizedIdentifier(@Param("normalized") String normalized);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select ua from UserAccount ua where ua.id = :id")
    Optional<UserAccount> findByIdForUpdate(@Param("id") UUID id);
}
