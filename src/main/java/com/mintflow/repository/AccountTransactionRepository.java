package com.mintflow.repository;

import com.mintflow.model.AccountTransaction;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AccountTransactionRepository extends JpaRepository<AccountTransaction, UUID> {
  Optional<AccountTransaction> findByAccountIdAndExternalId(UUID accountId, String externalId);

  Optional<AccountTransaction> findByIdAndUserId(UUID id, UUID userId);

  List<AccountTransaction> findByAccountId(UUID accountId);

  @Query("select t from AccountTransaction t "
      + "where t.userId = :userId and t.account.active = true "
      + "and (:accountId is null or t.account.id = :accountId) "
      + "order by t.bookingDate desc, t.createdAt desc")
  Page<AccountTransaction> findVisible(
      @Param("userId") UUID userId,
      @Param("accountId") UUID accountId,
      Pageable pageable);

  @Query("select sum(t.amount) from AccountTransaction t "
      + "where t.userId = :userId and t.category = :category "
      + "and t.bookingDate >= :from and t.bookingDate <= :to and t.amount > 0")
  BigDecimal sumPositiveAmounts(
      @Param("userId") UUID userId,
      @Param("category") String category,
      @Param("from") LocalDate from,
      @Param("to") LocalDate to);

  @Query("select sum(t.amount) from AccountTransaction t "
      + "where t.userId = :userId and t.category = :category "
      + "and t.bookingDate >= :from and t.bookingDate <= :to and t.amount < 0")
  BigDecimal sumNegativeAmounts(
      @Param("userId") UUID userId,
      @Param("category") String category,
      @Param("from") LocalDate from,
      @Param("to") LocalDate to);
}
