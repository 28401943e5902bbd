package com.monumentlens.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.monumentlens.backend.modules.auth.domain.SessionRevocationReason;
import com.monumentlens.backend.modules.auth.domain.UserSession;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    @Query("""
            select us
              from UserSession us
              join fetch us.user
             where us.tokenHash = :tokenHash
            """)
    Optional<UserSession> findByTokenHashWithUser(@Param("tokenHash") String tokenHash);

    @Modifying
    @Query("""
            update UserSession us
               set us.revokedAt = :revokedAt,
                   us.revokedReason = :reason
             where us.tokenHash = :tokenHash
               and us.revokedAt is null
            """)
    int revokeByTokenHash(@Param("tokenHash") String tokenHash,
                          @Param("revokedAt") OffsetDateTime revokedAt,
                          @Param("reason") SessionRevocationReason reason);

    @Modifying
    @Query("""
            update UserSession us
               set us.revokedAt = :revokedAt,
                   us.revokedReason = :reason
             where us.user.id = :userId
               and us.revokedAt is null
            """)
    int revokeAllByUserId(@Param("userId") UUID userId,
                          @Param("revokedAt") OffsetDateTime revokedAt,
                          @Param("reason") SessionRevocationReason reason);

    @Modifying
    @Query("""
            update UserSession us
               set us.expiresAt = :expiresAt
             where us.tokenHash = :tokenHash
               and us.revokedAt is null
               and us.expiresAt < :expiresAt
            """)
    int extendExpiry(@Param("tokenHash") String tokenHash, @Param("expiresAt") OffsetDateTime expiresAt);

    @Query("""
            select us.id
              from UserSession us
             where us.expiresAt <= :now
             order by us.expiresAt
            """)
    List<UUID> findExpiredIds(@Param("now") OffsetDateTime now, Pageable pageable);

    @Query("""
            select count(us)
              from UserSession us
             where us.user.id = :userId
               and us.revokedAt is null
               and us.expiresAt > :now
            """)
    long countActiveByUserId(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);
}
