package com.monumentlens.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.monumentlens.backend.modules.auth.domain.PasswordResetRequest;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PasswordResetRequestRepository extends JpaRepository<PasswordResetRequest, UUID> {

    @Query("""
            select pr
              from PasswordResetRequest pr
              join fetch pr.user
             where pr.tokenHash = :tokenHash
            """)
    Optional<PasswordResetRequest> findByTokenHashWithUser(@Param("tokenHash") String tokenHash);

    @Modifying
    @Query("""
            update PasswordResetRequest pr
               set pr.used = true,
                   pr.usedAt = :usedAt
             where pr.id = :id
               and pr.used = false
               and pr.expiresAt > :usedAt
            """)
    int markUsed(@Param("id") UUID id, @Param("usedAt") OffsetDateTime usedAt);
}
