package com.penny.ledger.account;

import com.penny.ledger.category.CategoryService;
import com.penny.ledger.config.PennyProperties;
import com.penny.ledger.error.LedgerIntegrityException;
import com.penny.ledger.error.LedgerNotFoundException;
import com.penny.ledger.error.LedgerValidationException;
import com.penny.ledger.event.LedgerEvent;
import com.penny.ledger.event.LedgerEventNotifier;
import com.penny.ledger.history.BalanceHistoryService;
import com.penny.ledger.model.Account;
import com.penny.ledger.model.AccountDraft;
import com.penny.ledger.model.AccountUpdate;
import com.penny.ledger.model.Category;
import com.penny.ledger.model.Operation;
import com.penny.ledger.model.OperationType;
import com.penny.ledger.model.ShadowCategories;
import com.penny.ledger.money.MoneyMath;
import com.penny.ledger.store.LedgerStore;
import com.penny.ledger.store.StoreSession;
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
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Account balances and the balance-changing side of the journal. Every balance write refreshes
 * today's history snapshot on the same transaction.
 */
@Service
public class AccountLedgerService {

    private static final Logger log = LoggerFactory.getLogger(AccountLedgerService.class);
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
    private static final Pattern ADJUSTMENT_CHAIN = Pattern.compile("Balance adjusted from (-?[\\d.]+(?: → -?[\\d.]+)*)");

    private final LedgerStore store;
    private final AccountRepository accounts;
    private final OperationRepository operations;
    private final CategoryService categoryService;
    private final BalanceHistoryService balanceHistory;
    private final MoneyMath money;
    private final LedgerEventNotifier notifier;
    private final PennyProperties properties;
    private final Clock clock;

    public AccountLedgerService(LedgerStore store,
                                AccountRepository accounts,
                                OperationRepository operations,
                                CategoryService categoryService,
                                BalanceHistoryService balanceHistory,
                                MoneyMath money,
                                LedgerEventNotifier notifier,
                                PennyProperties properties,
                                Clock clock) {
        this.store = store;
        this.accounts = accounts;
        this.operations = operations;
        this.categoryService = categoryService;
        this.balanceHistory = balanceHistory;
        this.money = money;
        this.notifier = notifier;
        this.properties = properties;
        this.clock = clock;
    }

    public List<Account> getAllAccounts() {
        return accounts.findAll(store);
    }

    public Optional<Account> getAccountById(String id) {
        return accounts.findById(store, id);
    }

    public Account createAccount(AccountDraft draft) {
        if (draft == null || draft.name() == null || draft.name().isBlank()) {
            throw new LedgerValidationException("Account name is required");
        }
        Account created = store.inTransaction(tx -> {
            Instant now = clock.instant();
            Account account = new Account(
                    UUID.randomUUID().toString(),
                    draft.name().trim(),
                    draft.balance() == null ? ZERO : draft.balance(),
                    draft.currency() == null || draft.currency().isBlank() ? properties.defaultCurrency() : draft.currency(),
                    accounts.maxDisplayOrder(tx) + 1,
                    Boolean.TRUE.equals(draft.hidden()),
                    draft.monthlyTarget(),
                    now,
                    now
            );
            accounts.insert(tx, account);
            balanceHistory.updateTodayBalance(account.id(), account.balance(), tx);
            return account;
        });
        log.info("Account {} created with currency {}", created.id(), created.currency());
        notifier.publish(LedgerEvent.Kind.ACCOUNTS_CHANGED, created.id());
        return created;
    }

    /**
     * Updates descriptive fields. Balances only change through deltas, adjustments and journal entries.
     */
    public Account updateAccount(String id, AccountUpdate update) {
        if (update.name() != null && update.name().isBlank()) {
            throw new LedgerValidationException("Account name is required");
        }
        Account updated = store.inTransaction(tx -> {
            Account existing = requireAccount(tx, id);
            Account account = new Account(
                    existing.id(),
                    update.name() != null ? update.name().trim() : existing.name(),
                    existing.balance(),
                    update.currency() != null ? update.currency() : existing.currency(),
                    existing.displayOrder(),
                    update.hidden() != null ? update.hidden() : existing.hidden(),
                    update.monthlyTarget() != null ? update.monthlyTarget() : existing.monthlyTarget(),
                    existing.createdAt(),
                    clock.instant()
            );
            accounts.updateDetails(tx, account);
            return account;
        });
        notifier.publish(LedgerEvent.Kind.ACCOUNTS_CHANGED, id);
        return updated;
    }

    /**
     * Assigns display positions in list order. Unknown ids are ignored.
     */
    public void reorderAccounts(List<String> orderedIds) {
        store.inTransaction(tx -> {
            Instant now = clock.instant();
            for (int i = 0; i < orderedIds.size(); i++) {
                accounts.updateDisplayOrder(tx, orderedIds.get(i), i, now);
            }
            return orderedIds.size();
        });
        notifier.publish(LedgerEvent.Kind.ACCOUNTS_CHANGED, null);
    }

    /**
     * Adds a signed delta to the stored balance and returns the new balance.
     */
    public BigDecimal updateAccountBalance(String accountId, BigDecimal delta) {
        BigDecimal balance = store.inTransaction(tx -> applyDelta(tx, accountId, delta)
                .orElseThrow(() -> new LedgerNotFoundException("Account", accountId)));
        notifier.publish(LedgerEvent.Kind.BALANCES_CHANGED, accountId);
        return balance;
    }

    /**
     * Applies many deltas on one transaction. Zero deltas are skipped without touching the store
     * and unknown accounts are logged and skipped.
     *
     * @return new balances of the accounts that were updated
     */
    public Map<String, BigDecimal> batchUpdateBalances(Map<String, BigDecimal> deltasByAccount) {
        Map<String, BigDecimal> updated = store.inTransaction(tx -> applyBalanceDeltas(tx, deltasByAccount));
        if (!updated.isEmpty()) {
            notifier.publish(LedgerEvent.Kind.BALANCES_CHANGED, null);
        }
        return updated;
    }

    /**
     * Delta application for callers that already hold a transaction.
     */
    public Map<String, BigDecimal> applyBalanceDeltas(StoreSession tx, Map<String, BigDecimal> deltasByAccount) {
        Map<String, BigDecimal> updated = new LinkedHashMap<>();
        for (Map.Entry<String, BigDecimal> entry : deltasByAccount.entrySet()) {
            BigDecimal delta = entry.getValue();
            if (delta == null || delta.signum() == 0) {
                continue;
            }
            Optional<BigDecimal> balance = applyDelta(tx, entry.getKey(), delta);
            if (balance.isPresent()) {
                updated.put(entry.getKey(), balance.get());
            } else {
                log.warn("Account {} not found during batch balance update, skipping", entry.getKey());
            }
        }
        return updated;
    }

    /**
     * Moves every journal entry of one account, on either side, to another account of the same
     * currency. Balances are not recomputed.
     *
     * @return rows moved across both the source and destination columns
     */
    public int transferOperations(String fromAccountId, String toAccountId) {
        int moved = store.inTransaction(tx -> transferOperations(tx, fromAccountId, toAccountId));
        notifier.publish(LedgerEvent.Kind.OPERATION_CHANGED, toAccountId);
        return moved;
    }

    private int transferOperations(StoreSession tx, String fromAccountId, String toAccountId) {
        Account from = requireAccount(tx, fromAccountId);
        Account to = requireAccount(tx, toAccountId);
        if (!from.currency().equals(to.currency())) {
            throw new LedgerIntegrityException("Cannot transfer operations: accounts have different currencies ("
                    + from.currency() + " → " + to.currency() + ")");
        }
        int moved = operations.reassignSource(tx, fromAccountId, toAccountId)
                + operations.reassignDestination(tx, fromAccountId, toAccountId);
        log.info("Transferred {} operation references from account {} to {}", moved, fromAccountId, toAccountId);
        return moved;
    }

    public BigDecimal adjustAccountBalance(String accountId, BigDecimal targetBalance, String description) {
        return adjustAccountBalance(accountId, targetBalance, description, categoryService.getShadowCategories());
    }

    /**
     * Sets an absolute balance by recording the difference as an adjustment entry under a shadow
     * category. Repeated adjustments on the same day fold into one entry holding the cumulative
     * delta; a cumulative delta of zero removes the entry.
     */
    public BigDecimal adjustAccountBalance(String accountId, BigDecimal targetBalance, String description, ShadowCategories shadow) {
        if (targetBalance == null) {
            throw new LedgerValidationException("Target balance is required");
        }
        BigDecimal result = store.inTransaction(tx -> {
            Account account = requireAccount(tx, accountId);
            BigDecimal current = account.balance();
            BigDecimal delta = money.subtract(targetBalance, current);
            LocalDate today = LocalDate.now(clock);
            Optional<Operation> existing = operations.findAdjustment(tx, accountId, today,
                    List.of(shadow.expense().id(), shadow.income().id()));

            if (existing.isPresent()) {
                Operation previous = existing.get();
                BigDecimal previousDelta = previous.type() == OperationType.INCOME
                        ? previous.amount()
                        : previous.amount().negate();
                BigDecimal cumulative = money.add(previousDelta, delta);
                if (cumulative.signum() == 0) {
                    operations.delete(tx, previous.id());
                    log.debug("Adjustment on account {} cancelled out, entry {} removed", accountId, previous.id());
                } else {
                    List<BigDecimal> chain = adjustmentChain(previous.description(),
                            money.subtract(current, previousDelta));
                    if (chain.get(chain.size() - 1).compareTo(current) != 0) {
                        chain.add(current);
                    }
                    chain.add(targetBalance);
                    operations.update(tx, adjustment(previous.id(), previous.createdAt(), accountId, cumulative,
                            today, describe(chain, description), shadow));
                }
            } else if (delta.signum() != 0) {
                operations.insert(tx, adjustment(UUID.randomUUID().toString(), clock.instant(), accountId, delta,
                        today, describe(List.of(current, targetBalance), description), shadow));
            }

            if (delta.signum() != 0) {
                accounts.updateBalance(tx, accountId, targetBalance, clock.instant());
                balanceHistory.updateTodayBalance(accountId, targetBalance, tx);
            }
            return delta.signum() == 0 ? current : targetBalance;
        });
        notifier.publish(LedgerEvent.Kind.OPERATION_CHANGED, accountId);
        return result;
    }

    /**
     * Deletes an account. Referenced accounts need a transfer target; the account's derived
     * history rows go with it.
     */
    public void deleteAccount(String id, String transferToId) {
        if (id.equals(transferToId)) {
            throw new LedgerValidationException("Cannot transfer operations to the account being deleted");
        }
        store.inTransaction(tx -> {
            requireAccount(tx, id);
            int count = operations.countForAccount(tx, id);
            if (count > 0) {
                if (transferToId == null) {
                    throw new LedgerIntegrityException("Cannot delete account: " + count
                            + " transaction(s) are associated with this account. Please delete or reassign the transactions first.", count);
                }
                transferOperations(tx, id, transferToId);
            }
            balanceHistory.deleteAccountHistory(tx, id);
            return accounts.delete(tx, id);
        });
        log.info("Account {} deleted (operations moved to {})", id, transferToId);
        notifier.publish(LedgerEvent.Kind.ACCOUNTS_CHANGED, id);
    }

    public BigDecimal getAccountBalance(String accountId) {
        return accounts.findBalance(store, accountId).orElse(ZERO);
    }

    public boolean accountExists(String accountId) {
        return accountId != null && accounts.exists(store, accountId);
    }

    public int getOperationCount(String accountId) {
        return operations.countForAccount(store, accountId);
    }

    private Optional<BigDecimal> applyDelta(StoreSession tx, String accountId, BigDecimal delta) {
        Optional<BigDecimal> current = accounts.findBalance(tx, accountId);
        if (current.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal next = money.add(current.get(), delta);
        accounts.updateBalance(tx, accountId, next, clock.instant());
        balanceHistory.updateTodayBalance(accountId, next, tx);
        return Optional.of(next);
    }

    private Account requireAccount(StoreSession tx, String id) {
        return accounts.findById(tx, id).orElseThrow(() -> new LedgerNotFoundException("Account", id));
    }

    private Operation adjustment(String id, Instant createdAt, String accountId, BigDecimal signedDelta,
                                 LocalDate date, String description, ShadowCategories shadow) {
        Category category = shadow.forDelta(signedDelta);
        OperationType type = signedDelta.signum() > 0 ? OperationType.INCOME : OperationType.EXPENSE;
        return new Operation(id, type, signedDelta.abs(), accountId, category.id(), null, date, createdAt,
                description, null, null, null, null);
    }

    /**
     * Balances recorded so far in a same-day adjustment entry, oldest first. Falls back to the
     * balance before the entry when its description no longer carries the chain.
     */
    private List<BigDecimal> adjustmentChain(String description, BigDecimal original) {
        List<BigDecimal> chain = new ArrayList<>();
        Matcher matcher = description == null ? null : ADJUSTMENT_CHAIN.matcher(description);
        if (matcher != null && matcher.find()) {
            for (String value : matcher.group(1).split("→")) {
                chain.add(money.parse(value.trim()));
            }
        } else {
            chain.add(original);
        }
        return chain;
    }

    private String describe(List<BigDecimal> chain, String userDescription) {
        String text = "Balance adjusted from " + chain.stream().map(money::format).collect(Collectors.joining(" → "));
        if (userDescription == null || userDescription.isBlank()) {
            return text;
        }
        return userDescription.trim() + " (" + text + ")";
    }
}
