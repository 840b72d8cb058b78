package com.penny.ledger.budget;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.penny.ledger.account.OperationRepository;
import com.penny.ledger.category.CategoryService;
import com.penny.ledger.event.LedgerEventNotifier;
import com.penny.ledger.model.Budget;
import com.penny.ledger.model.BudgetStatus;
import com.penny.ledger.model.PeriodType;
import com.penny.ledger.money.DecimalMoneyMath;
import com.penny.ledger.store.LedgerStore;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BudgetStatusSweepTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 3, 15);

    @Mock
    private LedgerStore store;
    @Mock
    private BudgetRepository repository;
    @Mock
    private OperationRepository operations;
    @Mock
    private CategoryService categoryService;
    @Mock
    private LedgerEventNotifier notifier;

    private BudgetService service;
    private final Clock clock = Clock.fixed(Instant.parse("2025-03-15T12:00:00Z"), ZoneOffset.UTC);

    @BeforeEach
    void setUp() {
        service = new BudgetService(store, repository, operations, categoryService, new DecimalMoneyMath(), notifier, clock);
    }

    @Test
    void failingBudgetIsSkippedAndOthersAreReported() {
        Budget broken = budget("broken");
        Budget healthy = budget("healthy");
        when(repository.findActive(store, TODAY)).thenReturn(List.of(broken, healthy));
        when(repository.findById(store, "broken")).thenThrow(new IllegalStateException("corrupt row"));
        when(repository.findById(store, "healthy")).thenReturn(Optional.of(healthy));
        when(categoryService.getAllDescendants("food")).thenReturn(List.of());
        when(operations.findExpenses(eq(store), anyCollection(), eq("USD"), any(), any())).thenReturn(List.of());

        Map<String, BudgetStatus> statuses = service.calculateAllBudgetStatuses(TODAY);

        assertThat(statuses).containsOnlyKeys("healthy");
        assertThat(statuses.get("healthy").spent()).isEqualByComparingTo("0");
    }

    private Budget budget(String id) {
        return new Budget(id, "food", new BigDecimal("100.00"), "USD", PeriodType.MONTHLY,
                LocalDate.of(2025, 1, 1), null, true, false, clock.instant(), clock.instant());
    }
}
