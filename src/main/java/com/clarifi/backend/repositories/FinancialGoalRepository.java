package com.clarifi.backend.repositories;

import com.clarifi.backend.entities.FinancialGoal;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface FinancialGoalRepository extends JpaRepository<FinancialGoal, UUID> {

    List<FinancialGoal> findByUserIdOrderByCreatedAtDesc(UUID userId);
}
