package com.clarifi.backend.repositories;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.clarifi.backend.entities.Budget;

@Repository
public interface BudgetRepository extends JpaRepository<Budget, UUID> {

    @Query("""
            select b from Budget b
            join fetch b.category
            where b.userId = :userId
              and b.budgetMonth = :budgetMonth
            """)
    List<Budget> findByUserAndMonthWithCategory(
            @Param("userId") UUID userId,
            @Param("budgetMonth") LocalDate budgetMonth
    );
}
