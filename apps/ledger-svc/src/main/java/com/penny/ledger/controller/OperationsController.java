package com.penny.ledger.controller;

import com.penny.ledger.account.OperationJournalService;
import com.penny.ledger.controller.dto.OperationTotalsResponseDto;
import com.penny.ledger.error.LedgerNotFoundException;
import com.penny.ledger.error.LedgerValidationException;
import com.penny.ledger.model.CategorySpending;
import com.penny.ledger.model.Operation;
import com.penny.ledger.model.OperationDraft;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/operations")
public class OperationsController {

    private final OperationJournalService journalService;

    public OperationsController(OperationJournalService journalService) {
        this.journalService = journalService;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Operation> listOperations(
            @RequestParam(name = "accountId", required = false) String accountId,
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        if (accountId != null) {
            return journalService.getOperationsByAccount(accountId);
        }
        if (from == null || to == null) {
            throw new LedgerValidationException("Either accountId or both from and to are required");
        }
        return journalService.getOperationsByDateRange(from, to);
    }

    @GetMapping(path = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Operation getOperation(@PathVariable String id) {
        return journalService.getOperationById(id).orElseThrow(() -> new LedgerNotFoundException("Operation", id));
    }

    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public Operation createOperation(@RequestBody OperationDraft request) {
        return journalService.createOperation(request);
    }

    @PatchMapping(path = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Operation updateOperation(@PathVariable String id, @RequestBody OperationDraft request) {
        return journalService.updateOperation(id, request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteOperation(@PathVariable String id) {
        journalService.deleteOperation(id);
    }

    @GetMapping(path = "/spending", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<CategorySpending> spendingByCategory(
            @RequestParam("currency") String currency,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return journalService.getSpendingByCategory(currency, from, to);
    }

    @GetMapping(path = "/income", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<CategorySpending> incomeByCategory(
            @RequestParam("currency") String currency,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return journalService.getIncomeByCategory(currency, from, to);
    }

    @GetMapping(path = "/totals", produces = MediaType.APPLICATION_JSON_VALUE)
    public OperationTotalsResponseDto totals(
            @RequestParam("accountId") String accountId,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return new OperationTotalsResponseDto(accountId, from, to,
                journalService.getTotalExpenses(accountId, from, to),
                journalService.getTotalIncome(accountId, from, to));
    }

    @GetMapping(path = "/months", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<YearMonth> availableMonths() {
        return journalService.getAvailableMonths();
    }
}
