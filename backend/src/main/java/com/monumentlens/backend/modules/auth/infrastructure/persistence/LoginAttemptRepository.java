package com.monumentlens.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.monumentlens.backend.modules.auth.domain.LoginAttempt;
import com.monumentlens.backend.modules.auth.domain.LoginOutcome;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LoginAttemptRepository extends JpaRepository<LoginAttempt, UUID> {

    @Query("""
            select count(la)
              from LoginAttempt la
             where la.identifierNormalized = :identifier
               and la.outcome in :outcomes
               and la.attemptedAt > :since
            """)
    long countByIdentifierSince(@Param("identifier") String identifierNormalized,
                                @Param("outcomes") Collection<LoginOutcome> outcomes,
                                @Param("since") OffsetDateTime since);

    List<LoginAttempt> findByIdentifierNormalizedOrderByAttemptedAtAsc(String identifierNormalized);
}
