package com.mintflow.repository;

import com.mintflow.model.Budget;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BudgetRepository extends JpaRepository<Budget, UUID> {
  List<Budget> findByUserIdAndActiveTrue(UUID userId);
}
