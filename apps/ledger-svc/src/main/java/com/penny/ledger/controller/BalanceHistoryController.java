package com.penny.ledger.controller;

import com.penny.ledger.controller.dto.BalanceResponseDto;
import com.penny.ledger.controller.dto.BalanceSnapshotRequestDto;
import com.penny.ledger.error.LedgerNotFoundException;
import com.penny.ledger.error.LedgerValidationException;
import com.penny.ledger.history.BalanceHistoryService;
import com.penny.ledger.history.PopulationResult;
import com.penny.ledger.model.AccountBalanceOnDate;
import com.penny.ledger.model.BalanceSnapshot;
import com.penny.ledger.model.BurndownData;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/balance-history")
public class BalanceHistoryController {

    private final BalanceHistoryService balanceHistoryService;
    private final Clock clock;

    public BalanceHistoryController(BalanceHistoryService balanceHistoryService, Clock clock) {
        this.balanceHistoryService = balanceHistoryService;
        this.clock = clock;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<BalanceSnapshot> history(
            @RequestParam("accountId") String accountId,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return balanceHistoryService.getBalanceHistory(accountId, from, to);
    }

    @GetMapping(path = "/on-date", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<AccountBalanceOnDate> allOnDate(
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return balanceHistoryService.getAllAccountsBalanceOnDate(date);
    }

    @GetMapping(path = "/{accountId}/burndown", produces = MediaType.APPLICATION_JSON_VALUE)
    public BurndownData burndown(
            @PathVariable String accountId,
            @RequestParam(name = "month", required = false) String month,
            @RequestParam(name = "meanMonths", defaultValue = "12") int meanMonths) {
        YearMonth target;
        try {
            target = month != null ? YearMonth.parse(month) : YearMonth.now(clock);
        } catch (DateTimeParseException ex) {
            throw new LedgerValidationException("month must be formatted as YYYY-MM");
        }
        return balanceHistoryService.getBurndownData(accountId, target, meanMonths);
    }

    @GetMapping(path = "/{accountId}/{date}", produces = MediaType.APPLICATION_JSON_VALUE)
    public BalanceResponseDto balanceOnDate(
            @PathVariable String accountId,
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return balanceHistoryService.getAccountBalanceOnDate(accountId, date)
                .map(balance -> new BalanceResponseDto(accountId, balance))
                .orElseThrow(() -> new LedgerNotFoundException("Snapshot", accountId + "@" + date));
    }

    @GetMapping(path = "/{accountId}/last", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, LocalDate>> lastSnapshot(@PathVariable String accountId) {
        return balanceHistoryService.getLastSnapshotDate(accountId)
                .map(date -> ResponseEntity.ok(Map.of("date", date)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PutMapping("/{accountId}/{date}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void upsert(
            @PathVariable String accountId,
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @Valid @RequestBody BalanceSnapshotRequestDto request) {
        balanceHistoryService.upsertBalanceHistory(accountId, date, request.balance());
    }

    @DeleteMapping("/{accountId}/{date}")
    public ResponseEntity<Void> delete(
            @PathVariable String accountId,
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        if (!balanceHistoryService.deleteBalanceHistory(accountId, date)) {
            throw new LedgerNotFoundException("Snapshot", accountId + "@" + date);
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping(path = "/populate", produces = MediaType.APPLICATION_JSON_VALUE)
    public PopulationResult populate() {
        return balanceHistoryService.populateCurrentMonthHistory();
    }

    @PostMapping(path = "/rebuild", produces = MediaType.APPLICATION_JSON_VALUE)
    public PopulationResult rebuild() {
        return balanceHistoryService.rebuildCurrentMonthHistory();
    }
}
