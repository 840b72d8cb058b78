package com.penny.ledger.budget;

import com.penny.ledger.account.OperationRepository;
import com.penny.ledger.category.CategoryService;
import com.penny.ledger.error.LedgerNotFoundException;
import com.penny.ledger.error.LedgerValidationException;
import com.penny.ledger.event.LedgerEvent;
import com.penny.ledger.event.LedgerEventNotifier;
import com.penny.ledger.model.Budget;
import com.penny.ledger.model.BudgetDraft;
import com.penny.ledger.model.BudgetHealth;
import com.penny.ledger.model.BudgetStatus;
import com.penny.ledger.model.Category;
import com.penny.ledger.model.Operation;
import com.penny.ledger.model.PeriodType;
import com.penny.ledger.model.PeriodWindow;
import com.penny.ledger.money.MoneyMath;
import com.penny.ledger.store.LedgerStore;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class BudgetService {

    private static final Logger log = LoggerFactory.getLogger(BudgetService.class);
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final LedgerStore store;
    private final BudgetRepository repository;
    private final OperationRepository operations;
    private final CategoryService categoryService;
    private final MoneyMath money;
    private final LedgerEventNotifier notifier;
    private final Clock clock;

    public BudgetService(LedgerStore store,
                         BudgetRepository repository,
                         OperationRepository operations,
                         CategoryService categoryService,
                         MoneyMath money,
                         LedgerEventNotifier notifier,
                         Clock clock) {
        this.store = store;
        this.repository = repository;
        this.operations = operations;
        this.categoryService = categoryService;
        this.money = money;
        this.notifier = notifier;
        this.clock = clock;
    }

    /**
     * Checks a draft before any write.
     *
     * @return the first problem found, or empty when the draft is valid
     */
    public Optional<String> validateBudget(BudgetDraft draft) {
        if (draft.categoryId() == null || draft.categoryId().isBlank()) {
            return Optional.of("Category is required");
        }
        BigDecimal amount = parseAmount(draft.amount());
        if (amount == null || amount.signum() <= 0) {
            return Optional.of("Amount must be greater than zero");
        }
        if (draft.currency() == null || draft.currency().isBlank()) {
            return Optional.of("Currency is required");
        }
        if (PeriodType.find(draft.periodType()).isEmpty()) {
            return Optional.of("Invalid period type");
        }
        if (draft.startDate() == null) {
            return Optional.of("Start date is required");
        }
        if (draft.endDate() != null && !draft.endDate().isAfter(draft.startDate())) {
            return Optional.of("End date must be after start date");
        }
        return Optional.empty();
    }

    public Budget createBudget(BudgetDraft draft) {
        validateBudget(draft).ifPresent(error -> {
            throw new LedgerValidationException(error);
        });
        Budget created = store.inTransaction(tx -> {
            if (!categoryService.categoryExists(draft.categoryId())) {
                throw new LedgerNotFoundException("Category", draft.categoryId());
            }
            Instant now = clock.instant();
            Budget budget = new Budget(
                    UUID.randomUUID().toString(),
                    draft.categoryId(),
                    parseAmount(draft.amount()),
                    draft.currency(),
                    PeriodType.fromValue(draft.periodType()),
                    draft.startDate(),
                    draft.endDate(),
                    draft.recurring() == null || draft.recurring(),
                    Boolean.TRUE.equals(draft.rolloverEnabled()),
                    now,
                    now
            );
            repository.insert(tx, budget);
            return budget;
        });
        notifier.publish(LedgerEvent.Kind.BUDGETS_CHANGED, created.id());
        return created;
    }

    /**
     * Applies the non-null fields of {@code changes} and re-validates the merged budget.
     */
    public Budget updateBudget(String id, BudgetDraft changes) {
        Budget updated = store.inTransaction(tx -> {
            Budget existing = repository.findById(tx, id)
                    .orElseThrow(() -> new LedgerNotFoundException("Budget", id));
            BudgetDraft merged = new BudgetDraft(
                    changes.categoryId() != null ? changes.categoryId() : existing.categoryId(),
                    changes.amount() != null ? changes.amount() : existing.amount().toPlainString(),
                    changes.currency() != null ? changes.currency() : existing.currency(),
                    changes.periodType() != null ? changes.periodType() : existing.periodType().value(),
                    changes.startDate() != null ? changes.startDate() : existing.startDate(),
                    changes.endDate() != null ? changes.endDate() : existing.endDate(),
                    changes.recurring() != null ? changes.recurring() : existing.recurring(),
                    changes.rolloverEnabled() != null ? changes.rolloverEnabled() : existing.rolloverEnabled()
            );
            validateBudget(merged).ifPresent(error -> {
                throw new LedgerValidationException(error);
            });
            if (!merged.categoryId().equals(existing.categoryId()) && !categoryService.categoryExists(merged.categoryId())) {
                throw new LedgerNotFoundException("Category", merged.categoryId());
            }
            Budget budget = new Budget(
                    existing.id(),
                    merged.categoryId(),
                    parseAmount(merged.amount()),
                    merged.currency(),
                    PeriodType.fromValue(merged.periodType()),
                    merged.startDate(),
                    merged.endDate(),
                    merged.recurring(),
                    merged.rolloverEnabled(),
                    existing.createdAt(),
                    clock.instant()
            );
            repository.update(tx, budget);
            return budget;
        });
        notifier.publish(LedgerEvent.Kind.BUDGETS_CHANGED, id);
        return updated;
    }

    public void deleteBudget(String id) {
        if (repository.delete(store, id) == 0) {
            throw new LedgerNotFoundException("Budget", id);
        }
        notifier.publish(LedgerEvent.Kind.BUDGETS_CHANGED, id);
    }

    public Optional<Budget> getBudgetById(String id) {
        return repository.findById(store, id);
    }

    public List<Budget> getAllBudgets() {
        return repository.findAll(store);
    }

    public List<Budget> getBudgetsByCategory(String categoryId) {
        return repository.findByCategory(store, categoryId);
    }

    public List<Budget> getBudgetsByCurrency(String currency) {
        return repository.findByCurrency(store, currency);
    }

    public List<Budget> getBudgetsByPeriodType(PeriodType periodType) {
        return repository.findByPeriodType(store, periodType);
    }

    public List<Budget> getActiveBudgets(LocalDate date) {
        return repository.findActive(store, date);
    }

    public List<Budget> getRecurringBudgets() {
        return repository.findRecurring(store);
    }

    public boolean hasActiveBudget(String categoryId) {
        return hasActiveBudget(categoryId, LocalDate.now(clock));
    }

    public boolean hasActiveBudget(String categoryId, LocalDate date) {
        return repository.existsActiveForCategory(store, categoryId, date);
    }

    public Optional<Budget> findDuplicateBudget(String categoryId, String currency, PeriodType periodType, String excludeId) {
        return repository.findDuplicate(store, categoryId, currency, periodType, excludeId);
    }

    public boolean budgetExists(String id) {
        return id != null && repository.exists(store, id);
    }

    /**
     * Sum of expense entries for the category (and optionally everything under it) from accounts
     * in {@code currency}, dated within the inclusive window. Zero when nothing matches.
     */
    public BigDecimal calculateSpendingForBudget(String categoryId, String currency, LocalDate startDate,
                                                 LocalDate endDate, boolean includeChildren) {
        List<String> categoryIds = new ArrayList<>();
        categoryIds.add(categoryId);
        if (includeChildren) {
            for (Category descendant : categoryService.getAllDescendants(categoryId)) {
                categoryIds.add(descendant.id());
            }
        }
        BigDecimal total = ZERO;
        for (Operation operation : operations.findExpenses(store, categoryIds, currency, startDate, endDate)) {
            total = money.add(total, operation.amount());
        }
        return total;
    }

    public BudgetStatus calculateBudgetStatus(String budgetId) {
        return calculateBudgetStatus(budgetId, LocalDate.now(clock));
    }

    public BudgetStatus calculateBudgetStatus(String budgetId, LocalDate referenceDate) {
        Budget budget = repository.findById(store, budgetId)
                .orElseThrow(() -> new LedgerNotFoundException("Budget", budgetId));
        PeriodWindow period = BudgetPeriods.getCurrentPeriodDates(budget.periodType(), referenceDate);
        BigDecimal spent = calculateSpendingForBudget(budget.categoryId(), budget.currency(),
                period.start(), period.end(), true);
        return status(budget, spent, period);
    }

    /**
     * Status of every budget active on the reference date, keyed by budget id. A budget whose
     * status cannot be computed is logged and left out.
     */
    public Map<String, BudgetStatus> calculateAllBudgetStatuses(LocalDate referenceDate) {
        Map<String, BudgetStatus> statuses = new LinkedHashMap<>();
        for (Budget budget : repository.findActive(store, referenceDate)) {
            try {
                statuses.put(budget.id(), calculateBudgetStatus(budget.id(), referenceDate));
            } catch (RuntimeException ex) {
                log.error("Failed to calculate status for budget {}: {}", budget.id(), ex.getMessage(), ex);
            }
        }
        return statuses;
    }

    public Map<String, BudgetStatus> calculateAllBudgetStatuses() {
        return calculateAllBudgetStatuses(LocalDate.now(clock));
    }

    BudgetStatus status(Budget budget, BigDecimal spent, PeriodWindow period) {
        BigDecimal amount = budget.amount();
        int percentage = amount.signum() > 0
                ? spent.multiply(HUNDRED).divide(amount, 0, RoundingMode.HALF_UP).intValue()
                : 0;
        boolean exceeded = spent.compareTo(amount) > 0;
        return new BudgetStatus(
                budget.id(),
                amount,
                spent,
                money.subtract(amount, spent),
                percentage,
                exceeded,
                period.start(),
                period.end(),
                BudgetHealth.of(percentage, exceeded)
        );
    }

    private BigDecimal parseAmount(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(raw.trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
