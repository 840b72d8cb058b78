package com.penny.ledger.account;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.penny.ledger.error.LedgerNotFoundException;
import com.penny.ledger.error.LedgerValidationException;
import com.penny.ledger.model.Account;
import com.penny.ledger.model.CategoryKind;
import com.penny.ledger.model.CategorySpending;
import com.penny.ledger.model.CategoryType;
import com.penny.ledger.model.Operation;
import com.penny.ledger.model.OperationDraft;
import com.penny.ledger.model.OperationType;
import com.penny.ledger.support.LedgerFixture;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OperationJournalServiceTest {

    private static final LocalDate DAY = LocalDate.of(2025, 3, 10);

    private LedgerFixture fixture;
    private OperationJournalService journal;
    private Account checking;
    private Account savings;

    @BeforeEach
    void setUp() {
        fixture = LedgerFixture.startingAt("2025-03-15T12:00:00Z");
        journal = fixture.journal;
        fixture.category("groceries", CategoryKind.ENTRY, CategoryType.EXPENSE, null);
        fixture.category("rent", CategoryKind.ENTRY, CategoryType.EXPENSE, null);
        fixture.category("salary", CategoryKind.ENTRY, CategoryType.INCOME, null);
        checking = fixture.account("Checking", "USD", "1000.00");
        savings = fixture.account("Savings", "USD", "500.00");
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void expenseAndIncomeMoveTheAccountBalance() {
        journal.createOperation(draft(OperationType.EXPENSE, "45.10", checking.id(), "groceries", null));
        journal.createOperation(draft(OperationType.INCOME, "2000.00", checking.id(), "salary", null));

        assertThat(balance(checking)).isEqualByComparingTo("2954.90");
    }

    @Test
    void transferDebitsSourceAndCreditsDestination() {
        journal.createOperation(draft(OperationType.TRANSFER, "200.00", checking.id(), null, savings.id()));

        assertThat(balance(checking)).isEqualByComparingTo("800.00");
        assertThat(balance(savings)).isEqualByComparingTo("700.00");
    }

    @Test
    void crossCurrencyTransferCreditsDestinationAmount() {
        Account euro = fixture.account("Euro", "EUR", "0.00");

        Operation transfer = journal.createOperation(new OperationDraft(OperationType.TRANSFER, new BigDecimal("100.00"),
                checking.id(), null, euro.id(), DAY, null, new BigDecimal("0.92"), new BigDecimal("92.00"), "USD", "EUR"));

        assertThat(transfer.categoryId()).isNull();
        assertThat(balance(checking)).isEqualByComparingTo("900.00");
        assertThat(balance(euro)).isEqualByComparingTo("92.00");
    }

    @Test
    void updateReversesOldEffectAndAppliesNewOne() {
        Operation expense = journal.createOperation(draft(OperationType.EXPENSE, "30.00", checking.id(), "groceries", null));

        journal.updateOperation(expense.id(), new OperationDraft(null, new BigDecimal("50.00"), savings.id(),
                null, null, null, null, null, null, null, null));

        assertThat(balance(checking)).isEqualByComparingTo("1000.00");
        assertThat(balance(savings)).isEqualByComparingTo("450.00");
        assertThat(journal.getOperationById(expense.id())).hasValueSatisfying(updated -> {
            assertThat(updated.accountId()).isEqualTo(savings.id());
            assertThat(updated.categoryId()).isEqualTo("groceries");
        });
    }

    @Test
    void deleteRestoresBalance() {
        Operation transfer = journal.createOperation(draft(OperationType.TRANSFER, "200.00", checking.id(), null, savings.id()));

        journal.deleteOperation(transfer.id());

        assertThat(balance(checking)).isEqualByComparingTo("1000.00");
        assertThat(balance(savings)).isEqualByComparingTo("500.00");
        assertThatThrownBy(() -> journal.deleteOperation(transfer.id()))
                .isInstanceOf(LedgerNotFoundException.class);
    }

    @Test
    void invalidEntriesLeaveBalancesUntouched() {
        assertThatThrownBy(() -> journal.createOperation(draft(OperationType.EXPENSE, "0", checking.id(), "groceries", null)))
                .isInstanceOf(LedgerValidationException.class)
                .hasMessage("Amount must be greater than zero");
        assertThatThrownBy(() -> journal.createOperation(draft(OperationType.EXPENSE, "5", checking.id(), null, null)))
                .hasMessage("Category is required");
        assertThatThrownBy(() -> journal.createOperation(draft(OperationType.TRANSFER, "5", checking.id(), null, checking.id())))
                .hasMessage("Cannot transfer to the same account");
        assertThatThrownBy(() -> journal.createOperation(draft(OperationType.TRANSFER, "5", checking.id(), null, null)))
                .hasMessage("Destination account is required for transfers");
        assertThatThrownBy(() -> journal.createOperation(draft(OperationType.EXPENSE, "5", "missing", "groceries", null)))
                .isInstanceOf(LedgerNotFoundException.class);

        assertThat(balance(checking)).isEqualByComparingTo("1000.00");
        assertThat(journal.getOperationsByAccount(checking.id())).isEmpty();
    }

    @Test
    void spendingByCategoryIsSortedAndFilteredByCurrency() {
        Account euro = fixture.account("Euro", "EUR", "1000.00");
        journal.createOperation(draft(OperationType.EXPENSE, "10.00", checking.id(), "groceries", null));
        journal.createOperation(draft(OperationType.EXPENSE, "15.00", savings.id(), "groceries", null));
        journal.createOperation(draft(OperationType.EXPENSE, "900.00", checking.id(), "rent", null));
        journal.createOperation(draft(OperationType.EXPENSE, "300.00", euro.id(), "groceries", null));
        journal.createOperation(draft(OperationType.INCOME, "50.00", checking.id(), "salary", null));

        List<CategorySpending> spending = journal.getSpendingByCategory("USD", DAY.withDayOfMonth(1), DAY);

        assertThat(spending).extracting(CategorySpending::categoryId).containsExactly("rent", "groceries");
        assertThat(spending.get(1).total()).isEqualByComparingTo("25.00");
        assertThat(journal.getIncomeByCategory("USD", DAY, DAY)).singleElement()
                .satisfies(income -> assertThat(income.total()).isEqualByComparingTo("50.00"));
    }

    @Test
    void dateRangeQueryIsInclusiveAndValidated() {
        journal.createOperation(draft(OperationType.EXPENSE, "1.00", checking.id(), "groceries", null));

        assertThat(journal.getOperationsByDateRange(DAY, DAY)).hasSize(1);
        assertThat(journal.getOperationsByDateRange(DAY.plusDays(1), DAY.plusDays(3))).isEmpty();
        assertThatThrownBy(() -> journal.getOperationsByDateRange(DAY, DAY.minusDays(1)))
                .isInstanceOf(LedgerValidationException.class);
    }

    @Test
    void accountTotalsCountOnlyEntriesBookedOnTheAccount() {
        journal.createOperation(draft(OperationType.EXPENSE, "10.10", checking.id(), "groceries", null));
        journal.createOperation(draft(OperationType.EXPENSE, "0.20", checking.id(), "rent", null));
        journal.createOperation(draft(OperationType.EXPENSE, "99.00", savings.id(), "rent", null));
        journal.createOperation(draft(OperationType.INCOME, "40.00", checking.id(), "salary", null));
        journal.createOperation(draft(OperationType.TRANSFER, "300.00", checking.id(), null, savings.id()));

        assertThat(journal.getTotalExpenses(checking.id(), DAY, DAY).toPlainString()).isEqualTo("10.30");
        assertThat(journal.getTotalIncome(checking.id(), DAY, DAY)).isEqualByComparingTo("40.00");
        assertThat(journal.getTotalIncome(savings.id(), DAY, DAY)).isEqualByComparingTo("0.00");
        assertThat(journal.getTotalExpenses(checking.id(), DAY.plusDays(1), DAY.plusDays(2))).isEqualByComparingTo("0.00");
    }

    @Test
    void availableMonthsAreDistinctAndNewestFirst() {
        assertThat(journal.getAvailableMonths()).isEmpty();
        journal.createOperation(draft(OperationType.EXPENSE, "1.00", checking.id(), "groceries", null));
        journal.createOperation(new OperationDraft(OperationType.EXPENSE, new BigDecimal("2.00"), checking.id(), "groceries",
                null, LocalDate.of(2024, 12, 31), null, null, null, null, null));
        journal.createOperation(new OperationDraft(OperationType.INCOME, new BigDecimal("3.00"), checking.id(), "salary",
                null, LocalDate.of(2025, 3, 1), null, null, null, null, null));

        assertThat(journal.getAvailableMonths()).containsExactly(YearMonth.of(2025, 3), YearMonth.of(2024, 12));
    }

    private BigDecimal balance(Account account) {
        return fixture.ledger.getAccountBalance(account.id());
    }

    private OperationDraft draft(OperationType type, String amount, String accountId, String categoryId, String toAccountId) {
        return new OperationDraft(type, new BigDecimal(amount), accountId, categoryId, toAccountId, DAY,
                null, null, null, null, null);
    }
}
