package com.clarifi.backend.repositories;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.clarifi.backend.entities.Transaction;

public interface TransactionRepository extends JpaRepository<Transaction, UUID> {

    interface CategorySpendProjection {
        Integer getCategoryId();
        String getCategoryName();
        String getCategoryIcon();
        String getCategoryColor();
        BigDecimal getTotal();
        Long getTransactionCount();
    }

    @Query("""
            select sum(t.amount) from Transaction t
            where t.userId = :userId
              and t.date between :startDate and :endDate
              and t.amount > 0
            """)
    BigDecimal sumIncomeByUserAndDateRange(
            @Param("userId") UUID userId,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate
    );

    @Query("""
            select sum(t.amount) from Transaction t
            where t.userId = :userId
              and t.date between :startDate and :endDate
              and t.amount < 0
            """)
    BigDecimal sumExpensesByUserAndDateRange(
            @Param("userId") UUID userId,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate
    );

    @Query("""
            select c.id as categoryId,
                   c.name as categoryName,
                   c.iconName as categoryIcon,
                   c.colorHex as categoryColor,
                   sum(t.amount) as total,
                   count(t.id) as transactionCount
            from Transaction t left join t.category c
            where t.userId = :userId
              and t.date between :startDate and :endDate
              and t.amount < 0
            group by c.id, c.name, c.iconName, c.colorHex
            """)
    List<CategorySpendProjection> sumExpensesByCategoryForUserAndDateRange(
            @Param("userId") UUID userId,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate
    );

    @Query("""
            select t from Transaction t
            left join fetch t.category
            left join fetch t.merchant
            where t.userId = :userId
            order by t.date desc, t.createdAt desc
            """)
    List<Transaction> findRecentWithDetails(@Param("userId") UUID userId, Pageable pageable);

    @Query("""
            select t from Transaction t
            left join fetch t.category c
            left join fetch t.merchant
            where t.userId = :userId
              and c.id = :categoryId
              and t.date between :startDate and :endDate
            order by t.date desc, t.createdAt desc
            """)
    List<Transaction> findByUserAndCategoryAndDateRange(
            @Param("userId") UUID userId,
            @Param("categoryId") Integer categoryId,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate
    );

    @Query("""
            select t from Transaction t
            left join fetch t.merchant
            where t.userId = :userId
              and t.category is null
              and t.date between :startDate and :endDate
            order by t.date desc, t.createdAt desc
            """)
    List<Transaction> findUncategorizedByUserAndDateRange(
            @Param("userId") UUID userId,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate
    );
}
