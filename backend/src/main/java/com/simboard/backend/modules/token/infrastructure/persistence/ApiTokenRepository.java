package com.simboard.backend.modules.token.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.simboard.backend.modules.token.application.ApiTokenSummary;
import com.simboard.backend.modules.token.domain.ApiToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ApiTokenRepository extends JpaRepository<ApiToken, UUID> {

    Optional<ApiToken> findByTokenHash(String tokenHash);

    boolean existsByTokenHash(String tokenHash);

    @Query("""
            select new com.simboard.backend.modules.token.application.ApiTokenSummary(
                       t.id, t.name, t.ownerId, t.createdAt, t.expiresAt, t.revoked)
              from ApiToken t
             order by t.createdAt desc, t.id
            """)
    List<ApiTokenSummary> findAllSummaries();

    @Query("""
            select new com.simboard.backend.modules.token.application.ApiTokenSummary(
                       t.id, t.name, t.ownerId, t.createdAt, t.expiresAt, t.revoked)
              from ApiToken t
             where t.ownerId = :ownerId
             order by t.createdAt desc, t.id
            """)
    List<ApiTokenSummary> findSummariesByOwner(@Param("ownerId") UUID ownerId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update ApiToken t
               set t.revoked = true,
                   t.revokedAt = :revokedAt
             where t.id = :id
               and t.revoked = false
            """)
    int revokeIfActive(@Param("id") UUID id, @Param("revokedAt") OffsetDateTime revokedAt);

    @Modifying
    @Query("update ApiToken t set t.lastUsedAt = :usedAt where t.id = :id")
    int touchLastUsed(@Param("id") UUID id, @Param("usedAt") OffsetDateTime usedAt);
}
