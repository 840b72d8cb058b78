package com.penny.ledger.budget;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.penny.ledger.error.LedgerNotFoundException;
import com.penny.ledger.error.LedgerValidationException;
import com.penny.ledger.model.Account;
import com.penny.ledger.model.Budget;
import com.penny.ledger.model.BudgetDraft;
import com.penny.ledger.model.BudgetHealth;
import com.penny.ledger.model.BudgetStatus;
import com.penny.ledger.model.CategoryKind;
import com.penny.ledger.model.CategoryType;
import com.penny.ledger.model.OperationDraft;
import com.penny.ledger.model.OperationType;
import com.penny.ledger.model.PeriodType;
import com.penny.ledger.model.PeriodWindow;
import com.penny.ledger.support.LedgerFixture;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BudgetServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 3, 15);
    private static final PeriodWindow MARCH = new PeriodWindow(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 31));

    private LedgerFixture fixture;
    private BudgetService budgets;
    private Account usd;
    private Account eur;

    @BeforeEach
    void setUp() {
        fixture = LedgerFixture.startingAt("2025-03-15T12:00:00Z");
        budgets = fixture.budgets;
        fixture.category("food", CategoryKind.FOLDER, CategoryType.EXPENSE, null);
        fixture.category("groceries", CategoryKind.ENTRY, CategoryType.EXPENSE, "food");
        fixture.category("salary", CategoryKind.ENTRY, CategoryType.INCOME, null);
        usd = fixture.account("Checking", "USD", "5000.00");
        eur = fixture.account("Euro", "EUR", "5000.00");
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void statusBandsFollowPercentageOfAmount() {
        Budget budget = budget("500.00");

        assertBand(budget, "300.00", 60, BudgetHealth.SAFE);
        assertBand(budget, "350.00", 70, BudgetHealth.WARNING);
        assertBand(budget, "450.00", 90, BudgetHealth.DANGER);
        assertBand(budget, "500.00", 100, BudgetHealth.EXCEEDED);

        BudgetStatus over = budgets.status(budget, new BigDecimal("600.00"), MARCH);
        assertThat(over.percentage()).isEqualTo(120);
        assertThat(over.exceeded()).isTrue();
        assertThat(over.status()).isEqualTo(BudgetHealth.EXCEEDED);
        assertThat(over.remaining()).isEqualByComparingTo("-100.00");
        assertThat(over.periodStart()).isEqualTo(MARCH.start());
        assertThat(over.periodEnd()).isEqualTo(MARCH.end());
    }

    @Test
    void validationReportsFirstProblem() {
        assertThat(budgets.validateBudget(draft(null, "10", "USD", "monthly"))).contains("Category is required");
        assertThat(budgets.validateBudget(draft("food", "0", "USD", "monthly"))).contains("Amount must be greater than zero");
        assertThat(budgets.validateBudget(draft("food", "abc", "USD", "monthly"))).contains("Amount must be greater than zero");
        assertThat(budgets.validateBudget(draft("food", "10", " ", "monthly"))).contains("Currency is required");
        assertThat(budgets.validateBudget(draft("food", "10", "USD", "daily"))).contains("Invalid period type");
        assertThat(budgets.validateBudget(new BudgetDraft("food", "10", "USD", "monthly", null, null, null, null)))
                .contains("Start date is required");
        assertThat(budgets.validateBudget(new BudgetDraft("food", "10", "USD", "monthly", TODAY, TODAY, null, null)))
                .contains("End date must be after start date");
        assertThat(budgets.validateBudget(draft("food", "10", "USD", "monthly"))).isEmpty();
    }

    @Test
    void createRejectsInvalidDraftAndUnknownCategory() {
        assertThatThrownBy(() -> budgets.createBudget(draft("food", "-1", "USD", "monthly")))
                .isInstanceOf(LedgerValidationException.class)
                .hasMessage("Amount must be greater than zero");
        assertThatThrownBy(() -> budgets.createBudget(draft("missing", "10", "USD", "monthly")))
                .isInstanceOf(LedgerNotFoundException.class);
        assertThat(budgets.getAllBudgets()).isEmpty();
    }

    @Test
    void spendingIncludesDescendantsInCurrencyAndWindow() {
        expense(usd, "groceries", "40.00", LocalDate.of(2025, 3, 3));
        expense(usd, "food", "10.00", LocalDate.of(2025, 3, 31));
        expense(eur, "groceries", "100.00", LocalDate.of(2025, 3, 3));
        expense(usd, "groceries", "7.00", LocalDate.of(2025, 2, 28));
        fixture.journal.createOperation(new OperationDraft(OperationType.INCOME, new BigDecimal("999.00"), usd.id(),
                "salary", null, LocalDate.of(2025, 3, 3), null, null, null, null, null));

        assertThat(budgets.calculateSpendingForBudget("food", "USD", MARCH.start(), MARCH.end(), true))
                .isEqualByComparingTo("50.00");
        assertThat(budgets.calculateSpendingForBudget("food", "USD", MARCH.start(), MARCH.end(), false))
                .isEqualByComparingTo("10.00");
        assertThat(budgets.calculateSpendingForBudget("salary", "USD", MARCH.start(), MARCH.end(), true))
                .isEqualByComparingTo("0");
    }

    @Test
    void budgetStatusUsesPeriodAroundReferenceDate() {
        Budget budget = budgets.createBudget(draft("food", "100.00", "USD", "monthly"));
        expense(usd, "groceries", "75.00", LocalDate.of(2025, 3, 3));
        expense(usd, "groceries", "500.00", LocalDate.of(2025, 2, 3));

        BudgetStatus status = budgets.calculateBudgetStatus(budget.id());

        assertThat(status.spent()).isEqualByComparingTo("75.00");
        assertThat(status.percentage()).isEqualTo(75);
        assertThat(status.status()).isEqualTo(BudgetHealth.WARNING);
        assertThat(status.periodStart()).isEqualTo(MARCH.start());
        assertThat(budgets.calculateAllBudgetStatuses()).containsOnlyKeys(budget.id());
    }

    @Test
    void activeBudgetsRespectStartAndEndDates() {
        Budget open = budgets.createBudget(draft("food", "100", "USD", "monthly"));
        Budget ended = budgets.createBudget(new BudgetDraft("groceries", "50", "USD", "weekly",
                LocalDate.of(2025, 1, 1), LocalDate.of(2025, 2, 1), false, null));

        assertThat(budgets.getActiveBudgets(TODAY)).extracting(Budget::id).containsExactly(open.id());
        assertThat(budgets.hasActiveBudget("food")).isTrue();
        assertThat(budgets.hasActiveBudget("groceries")).isFalse();
        assertThat(budgets.getRecurringBudgets()).extracting(Budget::id).containsExactly(open.id());
        assertThat(budgets.getBudgetsByCategory("groceries")).extracting(Budget::id).containsExactly(ended.id());
    }

    @Test
    void budgetsFilterByCurrencyAndPeriodType() {
        Budget monthlyUsd = budgets.createBudget(draft("food", "100", "USD", "monthly"));
        Budget weeklyUsd = budgets.createBudget(draft("groceries", "20", "USD", "weekly"));
        Budget monthlyEur = budgets.createBudget(draft("food", "80", "EUR", "monthly"));

        assertThat(budgets.getBudgetsByCurrency("USD")).extracting(Budget::id)
                .containsExactlyInAnyOrder(monthlyUsd.id(), weeklyUsd.id());
        assertThat(budgets.getBudgetsByCurrency("GBP")).isEmpty();
        assertThat(budgets.getBudgetsByPeriodType(PeriodType.MONTHLY)).extracting(Budget::id)
                .containsExactlyInAnyOrder(monthlyUsd.id(), monthlyEur.id());
        assertThat(budgets.getBudgetsByPeriodType(PeriodType.YEARLY)).isEmpty();
    }

    @Test
    void updateMergesAndRevalidates() {
        Budget budget = budgets.createBudget(draft("food", "100", "USD", "monthly"));

        Budget updated = budgets.updateBudget(budget.id(), new BudgetDraft(null, "250.50", null, "yearly",
                null, null, null, true));

        assertThat(updated.amount()).isEqualByComparingTo("250.50");
        assertThat(updated.periodType()).isEqualTo(PeriodType.YEARLY);
        assertThat(updated.currency()).isEqualTo("USD");
        assertThat(updated.rolloverEnabled()).isTrue();
        assertThatThrownBy(() -> budgets.updateBudget(budget.id(), new BudgetDraft(null, null, null, null,
                null, LocalDate.of(2024, 1, 1), null, null)))
                .isInstanceOf(LedgerValidationException.class)
                .hasMessage("End date must be after start date");
    }

    @Test
    void duplicateLookupAndDelete() {
        Budget budget = budgets.createBudget(draft("food", "100", "USD", "monthly"));

        assertThat(budgets.findDuplicateBudget("food", "USD", PeriodType.MONTHLY, null)).isPresent();
        assertThat(budgets.findDuplicateBudget("food", "USD", PeriodType.MONTHLY, budget.id())).isEmpty();

        budgets.deleteBudget(budget.id());
        assertThat(budgets.budgetExists(budget.id())).isFalse();
        assertThatThrownBy(() -> budgets.deleteBudget(budget.id())).isInstanceOf(LedgerNotFoundException.class);
    }

    private void assertBand(Budget budget, String spent, int percentage, BudgetHealth health) {
        BudgetStatus status = budgets.status(budget, new BigDecimal(spent), MARCH);
        assertThat(status.percentage()).isEqualTo(percentage);
        assertThat(status.exceeded()).isFalse();
        assertThat(status.status()).isEqualTo(health);
    }

    private Budget budget(String amount) {
        Instant now = fixture.clock.instant();
        return new Budget("b-1", "food", new BigDecimal(amount), "USD", PeriodType.MONTHLY,
                MARCH.start(), null, true, false, now, now);
    }

    private BudgetDraft draft(String categoryId, String amount, String currency, String periodType) {
        return new BudgetDraft(categoryId, amount, currency, periodType, LocalDate.of(2025, 3, 1), null, null, null);
    }

    private void expense(Account account, String categoryId, String amount, LocalDate date) {
        fixture.journal.createOperation(new OperationDraft(OperationType.EXPENSE, new BigDecimal(amount), account.id(),
                categoryId, null, date, null, null, null, null, null));
    }
}
