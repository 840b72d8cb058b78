package com.penny.ledger.history;

import com.penny.ledger.account.AccountRepository;
import com.penny.ledger.account.OperationRepository;
import com.penny.ledger.error.LedgerNotFoundException;
import com.penny.ledger.error.LedgerValidationException;
import com.penny.ledger.event.LedgerEvent;
import com.penny.ledger.event.LedgerEventNotifier;
import com.penny.ledger.model.Account;
import com.penny.ledger.model.AccountBalanceOnDate;
import com.penny.ledger.model.BalanceSnapshot;
import com.penny.ledger.model.BurndownData;
import com.penny.ledger.model.DailyBalance;
import com.penny.ledger.model.Operation;
import com.penny.ledger.money.MoneyMath;
import com.penny.ledger.store.LedgerStore;
import com.penny.ledger.store.StoreSession;
import com.penny.ledger.store.TransactionConflict;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Derives end-of-day balance snapshots from current balances and the journal.
 *
 * <p>The store only holds current balances, so history is rebuilt by walking backward from
 * today and undoing each day's entries. Snapshots are a cache: they can be deleted and
 * repopulated from the journal at any time.
 */
@Service
public class BalanceHistoryService {

    private static final Logger log = LoggerFactory.getLogger(BalanceHistoryService.class);
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
    public static final int DEFAULT_MEAN_MONTHS = 12;

    private final LedgerStore store;
    private final BalanceHistoryRepository repository;
    private final AccountRepository accounts;
    private final OperationRepository operations;
    private final MoneyMath money;
    private final LedgerEventNotifier notifier;
    private final Clock clock;

    public BalanceHistoryService(LedgerStore store,
                                 BalanceHistoryRepository repository,
                                 AccountRepository accounts,
                                 OperationRepository operations,
                                 MoneyMath money,
                                 LedgerEventNotifier notifier,
                                 Clock clock) {
        this.store = store;
        this.repository = repository;
        this.accounts = accounts;
        this.operations = operations;
        this.money = money;
        this.notifier = notifier;
        this.clock = clock;
    }

    /**
     * Reconstructs this month's snapshots for every account inside a new transaction. A
     * transaction conflict is logged and reported as skipped without changes; any other
     * failure is rethrown.
     */
    public PopulationResult populateCurrentMonthHistory() {
        try {
            int written = store.inTransaction(this::populate);
            log.info("Current month balance history populated: {} snapshots written", written);
            notifier.publish(LedgerEvent.Kind.HISTORY_CHANGED, null);
            return PopulationResult.completed(written);
        } catch (RuntimeException ex) {
            Optional<TransactionConflict> conflict = TransactionConflict.classify(ex);
            if (conflict.isPresent()) {
                log.info("Skipping balance history population: transaction conflict {} ({})", conflict.get(), ex.getMessage());
                return PopulationResult.skipped(conflict.get());
            }
            log.error("Failed to populate current month balance history", ex);
            throw ex;
        }
    }

    /**
     * Same walk on a transaction the caller already holds, for schema steps that run inside
     * their own transaction. Failures never propagate.
     */
    public PopulationResult populateCurrentMonthHistory(StoreSession tx) {
        try {
            int written = populate(tx);
            log.info("Current month balance history populated on caller transaction: {} snapshots written", written);
            return PopulationResult.completed(written);
        } catch (RuntimeException ex) {
            Optional<TransactionConflict> conflict = TransactionConflict.classify(ex);
            if (conflict.isPresent()) {
                log.info("Skipping balance history population: transaction conflict {} ({})", conflict.get(), ex.getMessage());
                return PopulationResult.skipped(conflict.get());
            }
            log.warn("Population failed during migration, but continuing: {}", ex.getMessage(), ex);
            return PopulationResult.failedAndContinued();
        }
    }

    /**
     * Drops this month's derived snapshots before today and reconstructs them in one transaction.
     */
    public PopulationResult rebuildCurrentMonthHistory() {
        int written = store.inTransaction(tx -> {
            LocalDate today = today();
            int removed = repository.deleteBetween(tx, today.withDayOfMonth(1), today);
            log.debug("Balance history rebuild: {} derived snapshots removed", removed);
            return populate(tx);
        });
        log.info("Current month balance history rebuilt: {} snapshots written", written);
        notifier.publish(LedgerEvent.Kind.HISTORY_CHANGED, null);
        return PopulationResult.completed(written);
    }

    /**
     * Balance of the account at the end of {@code date}, computed from the journal.
     */
    public BigDecimal calculateBalanceOnDate(String accountId, LocalDate date) {
        BigDecimal balance = accounts.findBalance(store, accountId)
                .orElseThrow(() -> new LedgerNotFoundException("Account", accountId));
        for (Operation operation : operations.findAffectingAccountAfter(store, accountId, date)) {
            balance = reverse(balance, operation, accountId);
        }
        return balance;
    }

    public BurndownData getBurndownData(String accountId, YearMonth month) {
        return getBurndownData(accountId, month, DEFAULT_MEAN_MONTHS);
    }

    /**
     * Daily balances for {@code month} and the month before it, the per-day mean over the
     * {@code meanMonths} months preceding {@code month}, and a straight line from the month's
     * highest balance down to zero. Computed from the journal in one read; snapshots are not
     * consulted.
     */
    public BurndownData getBurndownData(String accountId, YearMonth month, int meanMonths) {
        if (meanMonths < 1) {
            throw new LedgerValidationException("Months for the mean must be at least 1");
        }
        BigDecimal balance = accounts.findBalance(store, accountId)
                .orElseThrow(() -> new LedgerNotFoundException("Account", accountId));
        LocalDate oldest = month.minusMonths(meanMonths).atDay(1);
        Map<LocalDate, BigDecimal> endOfDay = endOfDayBalances(accountId, balance,
                operations.findAffectingAccountAfter(store, accountId, oldest.minusDays(1)),
                oldest, month.atEndOfMonth());

        int daysInMonth = month.lengthOfMonth();
        List<DailyBalance> currentData = dailyBalances(month, endOfDay);
        List<DailyBalance> previousData = dailyBalances(month.minusMonths(1), endOfDay);

        List<BigDecimal> previous = new ArrayList<>(daysInMonth);
        BigDecimal lastPrevious = previousData.get(previousData.size() - 1).balance();
        for (int i = 0; i < daysInMonth; i++) {
            previous.add(i < previousData.size() ? previousData.get(i).balance() : lastPrevious);
        }

        List<BigDecimal> mean = new ArrayList<>(daysInMonth);
        for (int day = 1; day <= daysInMonth; day++) {
            BigDecimal sum = ZERO;
            int count = 0;
            for (int offset = 1; offset <= meanMonths; offset++) {
                YearMonth earlier = month.minusMonths(offset);
                if (day <= earlier.lengthOfMonth()) {
                    sum = money.add(sum, endOfDay.get(earlier.atDay(day)));
                    count++;
                }
            }
            mean.add(count == 0 ? ZERO : sum.divide(BigDecimal.valueOf(count), 2, RoundingMode.HALF_UP));
        }

        BigDecimal start = currentData.stream().map(DailyBalance::balance).max(BigDecimal::compareTo).orElse(balance);
        BigDecimal dailyDecrease = start.divide(BigDecimal.valueOf(daysInMonth), 2, RoundingMode.HALF_UP);
        List<BigDecimal> planned = new ArrayList<>(daysInMonth);
        for (int day = 1; day <= daysInMonth; day++) {
            planned.add(money.subtract(start, dailyDecrease.multiply(BigDecimal.valueOf(day))));
        }

        LocalDate today = today();
        boolean currentMonth = YearMonth.from(today).equals(month);
        return new BurndownData(accountId, month, daysInMonth, currentMonth ? today.getDayOfMonth() : daysInMonth,
                currentMonth, currentData, previousData, previous, planned, mean);
    }

    public void updateTodayBalance(String accountId, BigDecimal balance) {
        updateTodayBalance(accountId, balance, store);
    }

    /**
     * Upserts today's snapshot. Best effort: a failure is logged and never reaches the caller.
     */
    public void updateTodayBalance(String accountId, BigDecimal balance, StoreSession session) {
        try {
            repository.upsert(session, accountId, today(), balance, clock.instant());
        } catch (RuntimeException ex) {
            log.warn("Failed to update today's balance snapshot for account {}: {}", accountId, ex.getMessage());
        }
    }

    public List<BalanceSnapshot> getBalanceHistory(String accountId, LocalDate startDate, LocalDate endDate) {
        return repository.findRange(store, accountId, startDate, endDate);
    }

    public Optional<BigDecimal> getAccountBalanceOnDate(String accountId, LocalDate date) {
        return repository.findBalance(store, accountId, date);
    }

    public Optional<LocalDate> getLastSnapshotDate(String accountId) {
        return repository.findLastDate(store, accountId);
    }

    public List<AccountBalanceOnDate> getAllAccountsBalanceOnDate(LocalDate date) {
        return repository.findAllOnDate(store, date);
    }

    /**
     * Manual correction of a single day's row.
     */
    public void upsertBalanceHistory(String accountId, LocalDate date, BigDecimal balance) {
        store.inTransaction(tx -> {
            if (!accounts.exists(tx, accountId)) {
                throw new LedgerNotFoundException("Account", accountId);
            }
            repository.upsert(tx, accountId, date, balance, clock.instant());
            return null;
        });
        notifier.publish(LedgerEvent.Kind.HISTORY_CHANGED, accountId);
    }

    public boolean deleteBalanceHistory(String accountId, LocalDate date) {
        boolean removed = repository.delete(store, accountId, date) > 0;
        if (removed) {
            notifier.publish(LedgerEvent.Kind.HISTORY_CHANGED, accountId);
        }
        return removed;
    }

    public int deleteAccountHistory(StoreSession session, String accountId) {
        return repository.deleteByAccount(session, accountId);
    }

    private int populate(StoreSession session) {
        LocalDate today = today();
        LocalDate monthStart = today.withDayOfMonth(1);
        int written = 0;
        for (Account account : accounts.findAll(session)) {
            written += populateAccount(session, account, today, monthStart);
        }
        return written;
    }

    private int populateAccount(StoreSession session, Account account, LocalDate today, LocalDate monthStart) {
        LocalDate created = LocalDate.ofInstant(account.createdAt(), clock.getZone());
        LocalDate floor = created.isAfter(monthStart) ? created : monthStart;
        if (!floor.isBefore(today)) {
            return 0;
        }
        TreeMap<LocalDate, List<Operation>> byDate = new TreeMap<>();
        for (Operation operation : operations.findAffectingAccountAfter(session, account.id(), floor)) {
            byDate.computeIfAbsent(operation.date(), key -> new ArrayList<>()).add(operation);
        }

        // end of today: undo anything dated in the future
        BigDecimal balance = account.balance();
        for (Map.Entry<LocalDate, List<Operation>> entry : byDate.tailMap(today, false).entrySet()) {
            balance = reverseAll(balance, entry.getValue(), account.id());
        }

        Instant now = clock.instant();
        BigDecimal lastPersisted = null;
        int written = 0;
        for (LocalDate leaving = today; leaving.isAfter(floor); leaving = leaving.minusDays(1)) {
            balance = reverseAll(balance, byDate.getOrDefault(leaving, List.of()), account.id());
            LocalDate day = leaving.minusDays(1);
            if (lastPersisted == null || lastPersisted.compareTo(balance) != 0) {
                if (repository.insertIfAbsent(session, account.id(), day, balance, now)) {
                    written++;
                }
                lastPersisted = balance;
            }
        }
        log.debug("Balance history for account {}: {} snapshots written back to {}", account.id(), written, floor);
        return written;
    }

    /**
     * End-of-day balance for every date in [oldest, latest]. {@code newestFirst} must hold every
     * entry touching the account dated after {@code oldest}, including ones after {@code latest}.
     */
    private Map<LocalDate, BigDecimal> endOfDayBalances(String accountId, BigDecimal current, List<Operation> newestFirst,
                                                        LocalDate oldest, LocalDate latest) {
        TreeMap<LocalDate, List<Operation>> byDate = new TreeMap<>();
        for (Operation operation : newestFirst) {
            byDate.computeIfAbsent(operation.date(), key -> new ArrayList<>()).add(operation);
        }
        BigDecimal balance = current;
        for (List<Operation> later : byDate.tailMap(latest, false).values()) {
            balance = reverseAll(balance, later, accountId);
        }
        Map<LocalDate, BigDecimal> result = new HashMap<>();
        for (LocalDate day = latest; !day.isBefore(oldest); day = day.minusDays(1)) {
            result.put(day, balance);
            balance = reverseAll(balance, byDate.getOrDefault(day, List.of()), accountId);
        }
        return result;
    }

    private List<DailyBalance> dailyBalances(YearMonth month, Map<LocalDate, BigDecimal> endOfDay) {
        List<DailyBalance> days = new ArrayList<>(month.lengthOfMonth());
        for (int day = 1; day <= month.lengthOfMonth(); day++) {
            LocalDate date = month.atDay(day);
            days.add(new DailyBalance(day, date, endOfDay.get(date)));
        }
        return days;
    }

    private BigDecimal reverseAll(BigDecimal balance, List<Operation> dayOperations, String accountId) {
        BigDecimal result = balance;
        for (Operation operation : dayOperations) {
            result = reverse(result, operation, accountId);
        }
        return result;
    }

    private BigDecimal reverse(BigDecimal balance, Operation operation, String accountId) {
        return switch (operation.type()) {
            case EXPENSE -> accountId.equals(operation.accountId()) ? money.add(balance, operation.amount()) : balance;
            case INCOME -> accountId.equals(operation.accountId()) ? money.subtract(balance, operation.amount()) : balance;
            case TRANSFER -> {
                BigDecimal result = balance;
                if (accountId.equals(operation.accountId())) {
                    result = money.add(result, operation.amount());
                }
                if (accountId.equals(operation.toAccountId())) {
                    result = money.subtract(result, operation.creditedAmount());
                }
                yield result;
            }
        };
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
