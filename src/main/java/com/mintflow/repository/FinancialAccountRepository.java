package com.mintflow.repository;

import com.mintflow.model.FinancialAccount;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface FinancialAccountRepository extends JpaRepository<FinancialAccount, UUID> {
  List<FinancialAccount> findByConnectionId(UUID connectionId);

  Optional<FinancialAccount> findByConnectionIdAndExternalId(UUID connectionId, String externalId);

  List<FinancialAccount> findByUserIdAndActiveTrueOrderByNameAsc(UUID userId);

  @Transactional
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("update FinancialAccount a set a.active = false where a.connection.id = :connectionId")
  int deactivateByConnectionId(@Param("connectionId") UUID connectionId);
}
