package com.penny.ledger.account;

import com.penny.ledger.category.CategoryService;
import com.penny.ledger.error.LedgerNotFoundException;
import com.penny.ledger.error.LedgerValidationException;
import com.penny.ledger.event.LedgerEvent;
import com.penny.ledger.event.LedgerEventNotifier;
import com.penny.ledger.model.CategorySpending;
import com.penny.ledger.model.Operation;
import com.penny.ledger.model.OperationDraft;
import com.penny.ledger.model.OperationType;
import com.penny.ledger.money.MoneyMath;
import com.penny.ledger.store.LedgerStore;
import com.penny.ledger.store.StoreSession;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Service;

/**
 * Journal entries and their balance effects. An entry and the balance changes it causes are
 * written on one transaction.
 */
@Service
public class OperationJournalService {

    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);

    private final LedgerStore store;
    private final OperationRepository operations;
    private final AccountRepository accounts;
    private final AccountLedgerService ledger;
    private final CategoryService categoryService;
    private final MoneyMath money;
    private final LedgerEventNotifier notifier;
    private final Clock clock;

    public OperationJournalService(LedgerStore store,
                                   OperationRepository operations,
                                   AccountRepository accounts,
                                   AccountLedgerService ledger,
                                   CategoryService categoryService,
                                   MoneyMath money,
                                   LedgerEventNotifier notifier,
                                   Clock clock) {
        this.store = store;
        this.operations = operations;
        this.accounts = accounts;
        this.ledger = ledger;
        this.categoryService = categoryService;
        this.money = money;
        this.notifier = notifier;
        this.clock = clock;
    }

    public Optional<Operation> getOperationById(String id) {
        return operations.findById(store, id);
    }

    public List<Operation> getOperationsByAccount(String accountId) {
        return operations.findByAccount(store, accountId);
    }

    public List<Operation> getOperationsByDateRange(LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new LedgerValidationException("End date must not be before start date");
        }
        return operations.findByDateRange(store, from, to);
    }

    /**
     * Expense totals per category for accounts held in {@code currency}, dates inclusive.
     */
    public List<CategorySpending> getSpendingByCategory(String currency, LocalDate from, LocalDate to) {
        return totalsByCategory(OperationType.EXPENSE, currency, from, to);
    }

    public List<CategorySpending> getIncomeByCategory(String currency, LocalDate from, LocalDate to) {
        return totalsByCategory(OperationType.INCOME, currency, from, to);
    }

    /**
     * Expenses booked on the account within the inclusive range; zero when there are none.
     */
    public BigDecimal getTotalExpenses(String accountId, LocalDate from, LocalDate to) {
        return accountTotal(accountId, OperationType.EXPENSE, from, to);
    }

    public BigDecimal getTotalIncome(String accountId, LocalDate from, LocalDate to) {
        return accountTotal(accountId, OperationType.INCOME, from, to);
    }

    public List<YearMonth> getAvailableMonths() {
        return operations.findMonths(store);
    }

    public Operation createOperation(OperationDraft draft) {
        Operation created = store.inTransaction(tx -> {
            Operation operation = new Operation(
                    UUID.randomUUID().toString(),
                    draft.type(),
                    draft.amount(),
                    draft.accountId(),
                    draft.type() == OperationType.TRANSFER ? null : draft.categoryId(),
                    draft.type() == OperationType.TRANSFER ? draft.toAccountId() : null,
                    draft.date() != null ? draft.date() : LocalDate.now(clock),
                    clock.instant(),
                    draft.description(),
                    draft.exchangeRate(),
                    draft.destinationAmount(),
                    draft.sourceCurrency(),
                    draft.destinationCurrency()
            );
            validate(tx, operation);
            operations.insert(tx, operation);
            ledger.applyBalanceDeltas(tx, effects(operation, false));
            return operation;
        });
        notifier.publish(LedgerEvent.Kind.OPERATION_CHANGED, created.id());
        return created;
    }

    /**
     * Rewrites an entry, reversing its old balance effect and applying the new one.
     */
    public Operation updateOperation(String id, OperationDraft draft) {
        Operation updated = store.inTransaction(tx -> {
            Operation existing = operations.findById(tx, id)
                    .orElseThrow(() -> new LedgerNotFoundException("Operation", id));
            OperationType type = draft.type() != null ? draft.type() : existing.type();
            Operation operation = new Operation(
                    existing.id(),
                    type,
                    draft.amount() != null ? draft.amount() : existing.amount(),
                    draft.accountId() != null ? draft.accountId() : existing.accountId(),
                    type == OperationType.TRANSFER ? null : coalesce(draft.categoryId(), existing.categoryId()),
                    type == OperationType.TRANSFER ? coalesce(draft.toAccountId(), existing.toAccountId()) : null,
                    draft.date() != null ? draft.date() : existing.date(),
                    existing.createdAt(),
                    coalesce(draft.description(), existing.description()),
                    draft.exchangeRate() != null ? draft.exchangeRate() : existing.exchangeRate(),
                    draft.destinationAmount() != null ? draft.destinationAmount() : existing.destinationAmount(),
                    coalesce(draft.sourceCurrency(), existing.sourceCurrency()),
                    coalesce(draft.destinationCurrency(), existing.destinationCurrency())
            );
            validate(tx, operation);
            operations.update(tx, operation);
            Map<String, BigDecimal> deltas = effects(existing, true);
            effects(operation, false).forEach((accountId, delta) -> deltas.merge(accountId, delta, money::add));
            ledger.applyBalanceDeltas(tx, deltas);
            return operation;
        });
        notifier.publish(LedgerEvent.Kind.OPERATION_CHANGED, id);
        return updated;
    }

    public void deleteOperation(String id) {
        store.inTransaction(tx -> {
            Operation existing = operations.findById(tx, id)
                    .orElseThrow(() -> new LedgerNotFoundException("Operation", id));
            operations.delete(tx, id);
            return ledger.applyBalanceDeltas(tx, effects(existing, true));
        });
        notifier.publish(LedgerEvent.Kind.OPERATION_CHANGED, id);
    }

    private void validate(StoreSession tx, Operation operation) {
        if (operation.type() == null) {
            throw new LedgerValidationException("Operation type is required");
        }
        if (operation.amount() == null || operation.amount().signum() <= 0) {
            throw new LedgerValidationException("Amount must be greater than zero");
        }
        if (operation.accountId() == null) {
            throw new LedgerValidationException("Account is required");
        }
        if (!accounts.exists(tx, operation.accountId())) {
            throw new LedgerNotFoundException("Account", operation.accountId());
        }
        if (operation.isTransfer()) {
            if (operation.toAccountId() == null) {
                throw new LedgerValidationException("Destination account is required for transfers");
            }
            if (operation.toAccountId().equals(operation.accountId())) {
                throw new LedgerValidationException("Cannot transfer to the same account");
            }
            if (!accounts.exists(tx, operation.toAccountId())) {
                throw new LedgerNotFoundException("Account", operation.toAccountId());
            }
            if (operation.destinationAmount() != null && operation.destinationAmount().signum() <= 0) {
                throw new LedgerValidationException("Destination amount must be greater than zero");
            }
        } else {
            if (operation.categoryId() == null) {
                throw new LedgerValidationException("Category is required");
            }
            if (!categoryService.categoryExists(operation.categoryId())) {
                throw new LedgerNotFoundException("Category", operation.categoryId());
            }
        }
    }

    private Map<String, BigDecimal> effects(Operation operation, boolean reverse) {
        Map<String, BigDecimal> deltas = new LinkedHashMap<>();
        switch (operation.type()) {
            case EXPENSE -> deltas.put(operation.accountId(), operation.amount().negate());
            case INCOME -> deltas.put(operation.accountId(), operation.amount());
            case TRANSFER -> {
                deltas.put(operation.accountId(), operation.amount().negate());
                deltas.merge(operation.toAccountId(), operation.creditedAmount(), money::add);
            }
        }
        if (reverse) {
            deltas.replaceAll((accountId, delta) -> delta.negate());
        }
        return deltas;
    }

    private BigDecimal accountTotal(String accountId, OperationType type, LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new LedgerValidationException("End date must not be before start date");
        }
        BigDecimal total = ZERO;
        for (Operation operation : operations.findForAccount(store, accountId, type, from, to)) {
            total = money.add(total, operation.amount());
        }
        return total;
    }

    private List<CategorySpending> totalsByCategory(OperationType type, String currency, LocalDate from, LocalDate to) {
        Map<String, BigDecimal> totals = new LinkedHashMap<>();
        for (Operation operation : operations.findByTypeAndCurrency(store, type, currency, from, to)) {
            totals.merge(operation.categoryId(), operation.amount(), money::add);
        }
        List<CategorySpending> result = new ArrayList<>(totals.size());
        totals.forEach((categoryId, total) -> result.add(new CategorySpending(categoryId, currency, total)));
        result.sort((left, right) -> right.total().compareTo(left.total()));
        return result;
    }

    private static String coalesce(String value, String fallback) {
        return value != null ? value : fallback;
    }
}
