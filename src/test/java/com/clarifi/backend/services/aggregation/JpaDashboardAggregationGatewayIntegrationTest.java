package com.clarifi.backend.services.aggregation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import com.clarifi.backend.dto.dashboard.PeriodWindow;
import com.clarifi.backend.dto.dashboard.RecentTransactionDTO;
import com.clarifi.backend.entities.Budget;
import com.clarifi.backend.entities.Category;
import com.clarifi.backend.entities.FinancialGoal;
import com.clarifi.backend.entities.Merchant;
import com.clarifi.backend.entities.Transaction;
import com.clarifi.backend.enums.AmountSign;
import com.clarifi.backend.exceptions.BadRequestException;
import com.clarifi.backend.repositories.BudgetRepository;
import com.clarifi.backend.repositories.CategoryRepository;
import com.clarifi.backend.repositories.FinancialGoalRepository;
import com.clarifi.backend.repositories.MerchantRepository;
import com.clarifi.backend.repositories.TransactionRepository;

/**
 * Runs against the Flyway schema with Hibernate validation on, so mapping drift fails here.
 */
@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest
@AutoConfigureMockMvc
class JpaDashboardAggregationGatewayIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("clarifi_test")
            .withUsername("clarifi")
            .withPassword("clarifi");

    @DynamicPropertySource
    static void registerProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.flyway.enabled", () -> "true");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "validate");

        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", postgres::getDriverClassName);
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private DashboardAggregationGateway gateway;

    @Autowired
    private TransactionRepository transactionRepository;

    @Autowired
    private BudgetRepository budgetRepository;

    @Autowired
    private FinancialGoalRepository financialGoalRepository;

    @Autowired
    private CategoryRepository categoryRepository;

    @Autowired
    private MerchantRepository merchantRepository;

    private final YearMonth month = YearMonth.now();
    private final PeriodWindow window = PeriodWindow.ofMonth(month);

    private UUID userId;
    private Category groceries;

    @BeforeEach
    void seed() {
        transactionRepository.deleteAll();
        budgetRepository.deleteAll();
        financialGoalRepository.deleteAll();
        merchantRepository.deleteAll();
        categoryRepository.deleteAll();

        userId = UUID.randomUUID();
        UUID otherUser = UUID.randomUUID();

        groceries = categoryRepository.save(Category.builder().name("Groceries").iconName("cart").colorHex("#22aa22").build());
        Category transport = categoryRepository.save(Category.builder().name("Transport").iconName("bus").build());
        Merchant market = merchantRepository.save(Merchant.builder().normalizedName("fresh market").displayName("Fresh Market").build());

        transactionRepository.saveAll(List.of(
                tx(userId, day(1), "Salary", "3500.00", null, null),
                tx(userId, day(2), "Weekly shop", "-100.00", groceries, market),
                tx(userId, day(3), "Bakery", "-30.00", groceries, null),
                tx(userId, day(4), "Bus pass", "-50.00", transport, null),
                tx(userId, day(5), "Cash withdrawal", "-20.00", null, null),
                tx(userId, month.minusMonths(1).atDay(20), "Old shop", "-80.00", groceries, null),
                tx(otherUser, day(2), "Someone else", "-999.00", groceries, null)
        ));

        budgetRepository.save(Budget.builder()
                .userId(userId)
                .category(groceries)
                .amount(new BigDecimal("500.00"))
                .budgetMonth(month.atDay(1))
                .build());

        FinancialGoal goal = new FinancialGoal();
        goal.setUserId(userId);
        goal.setName("Vacation");
        goal.setTargetAmount(new BigDecimal("1000.00"));
        goal.setCurrentAmount(new BigDecimal("500.00"));
        financialGoalRepository.save(goal);
    }

    private LocalDate day(int dayOfMonth) {
        return month.atDay(dayOfMonth);
    }

    private static Transaction tx(UUID user, LocalDate date, String description, String amount,
                                  Category category, Merchant merchant) {
        BigDecimal value = new BigDecimal(amount);
        return Transaction.builder()
                .userId(user)
                .date(date)
                .description(description)
                .amount(value)
                .type(value.signum() > 0 ? "income" : "expense")
                .category(category)
                .merchant(merchant)
                .build();
    }

    @Test
    void sumAmount_splitsIncomeAndExpensesForOneUser() {
        assertThat(gateway.sumAmount(userId, window, AmountSign.POSITIVE)).isEqualByComparingTo("3500");
        assertThat(gateway.sumAmount(userId, window, AmountSign.NEGATIVE)).isEqualByComparingTo("-200");
        assertThat(gateway.sumAmount(UUID.randomUUID(), window, AmountSign.POSITIVE)).isNull();
    }

    @Test
    void groupSpendByCategory_includesUncategorizedBucket() {
        List<CategorySpendTotal> totals = gateway.groupSpendByCategory(userId, window);

        assertThat(totals).hasSize(3);
        assertThat(totals).filteredOn(t -> t.categoryName().equals("Groceries")).singleElement().satisfies(t -> {
            assertThat(t.categoryId()).isEqualTo(String.valueOf(groceries.getId()));
            assertThat(t.amount()).isEqualByComparingTo("130");
            assertThat(t.transactionCount()).isEqualTo(2L);
            assertThat(t.categoryIcon()).isEqualTo("cart");
        });
        assertThat(totals).filteredOn(t -> t.categoryId().equals(CategorySpendTotal.UNCATEGORIZED_ID))
                .singleElement()
                .satisfies(t -> assertThat(t.amount()).isEqualByComparingTo("20"));
    }

    @Test
    void recentTransactions_newestFirstWithCategoryAndMerchant() {
        List<RecentTransactionDTO> recent = gateway.recentTransactions(userId, 4);

        assertThat(recent).extracting(RecentTransactionDTO::getDescription)
                .containsExactly("Cash withdrawal", "Bus pass", "Bakery", "Weekly shop");
        assertThat(recent.get(3).getMerchantName()).isEqualTo("Fresh Market");
        assertThat(recent.get(3).getCategoryName()).isEqualTo("Groceries");
        assertThat(recent.get(0).getCategoryName()).isNull();
    }

    @Test
    void budgetLines_normalizesAnchorToFirstDayOfMonth() {
        List<BudgetLine> lines = gateway.budgetLines(userId, day(17));

        assertThat(lines).singleElement().satisfies(line -> {
            assertThat(line.categoryName()).isEqualTo("Groceries");
            assertThat(line.amount()).isEqualByComparingTo("500");
        });
        assertThat(gateway.budgetLines(userId, month.minusMonths(1).atDay(1))).isEmpty();
    }

    @Test
    void transactionsByCategory_resolvesNumericAndUncategorizedIds() {
        assertThat(gateway.transactionsByCategory(userId, String.valueOf(groceries.getId()), window))
                .extracting(RecentTransactionDTO::getDescription)
                .containsExactly("Bakery", "Weekly shop");

        assertThat(gateway.transactionsByCategory(userId, "uncategorized", window))
                .extracting(RecentTransactionDTO::getDescription)
                .containsExactly("Cash withdrawal", "Salary");

        assertThatThrownBy(() -> gateway.transactionsByCategory(userId, "groceries", window))
                .isInstanceOf(BadRequestException.class);
    }

    @Test
    void dashboardEndpoint_composesSnapshotFromDatabase() throws Exception {
        mockMvc.perform(get("/api/dashboard/{userId}", userId).param("period", "current_month"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.summary.income").value(3500.0))
                .andExpect(jsonPath("$.data.summary.expenses").value(200.0))
                .andExpect(jsonPath("$.data.summary.savings").value(3300.0))
                .andExpect(jsonPath("$.data.summary.budget").value(500.0))
                .andExpect(jsonPath("$.data.spendingByCategory[0].categoryName").value("Groceries"))
                .andExpect(jsonPath("$.data.spendingByCategory[0].trend").value("up"))
                .andExpect(jsonPath("$.data.spendingByCategory[0].trendPercentage").value(63))
                .andExpect(jsonPath("$.data.budgetComparisons[0].percentage").value(26))
                .andExpect(jsonPath("$.data.budgetComparisons[0].status").value("under"))
                .andExpect(jsonPath("$.data.financialGoals[0].percentage").value(50))
                .andExpect(jsonPath("$.data.insights[0].id").value("spending_increase"))
                .andExpect(jsonPath("$.data.insights[1].id").value("savings_opportunity"));
    }
}
