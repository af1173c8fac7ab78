package com.mintflow.repository;

import com.mintflow.model.Connection;
import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface ConnectionRepository extends JpaRepository<Connection, UUID> {
  List<Connection> findByUserIdAndActiveTrue(UUID userId);

  List<Connection> findByActiveTrue();

  Optional<Connection> findByIdAndUserId(UUID id, UUID userId);

  Optional<Connection> findFirstByUserIdAndInstitutionIdAndProviderIdAndActiveTrue(
      UUID userId, String institutionId, String providerId);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select c from Connection c where c.id = :id")
  Optional<Connection> findForUpdate(@Param("id") UUID id);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select c from Connection c where c.id = :id and c.syncSequence = :sequence")
  Optional<Connection> findCurrentForUpdate(@Param("id") UUID id, @Param("sequence") long sequence);

  /**
   * Check-and-set of the sync state. Matches only an active connection that is not running
   * (or whose run started before {@code staleBefore}) and is not waiting for a re-link.
   */
  @Transactional
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("update Connection c set c.syncStatus = com.mintflow.model.SyncStatus.RUNNING, "
      + "c.syncSequence = c.syncSequence + 1, c.syncStartedAt = :now, c.updatedAt = :now "
      + "where c.id = :id and c.active = true "
      + "and (c.syncStatus <> com.mintflow.model.SyncStatus.RUNNING or c.syncStartedAt < :staleBefore) "
      + "and (c.syncStatus <> com.mintflow.model.SyncStatus.ERROR or c.errorCode is null "
      + "or c.errorCode <> com.mintflow.model.ConnectionErrorCode.REAUTH_REQUIRED)")
  int markRunning(@Param("id") UUID id, @Param("now") Instant now, @Param("staleBefore") Instant staleBefore);

  @Transactional
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("update Connection c set c.cursor = :cursor, c.updatedAt = :now where c.id = :id")
  int updateCursor(@Param("id") UUID id, @Param("cursor") String cursor, @Param("now") Instant now);

  @Transactional
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("update Connection c set c.encryptedCredential = :credential, c.updatedAt = :now "
      + "where c.id = :id and c.encryptedCredential = :previous")
  int replaceCredential(@Param("id") UUID id, @Param("previous") String previous,
                        @Param("credential") String credential, @Param("now") Instant now);
}
