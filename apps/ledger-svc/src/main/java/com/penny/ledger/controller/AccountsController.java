package com.penny.ledger.controller;

import com.penny.ledger.account.AccountLedgerService;
import com.penny.ledger.account.OperationJournalService;
import com.penny.ledger.controller.dto.AccountsListResponseDto;
import com.penny.ledger.controller.dto.AccountsOrderRequestDto;
import com.penny.ledger.controller.dto.BalanceAdjustRequestDto;
import com.penny.ledger.controller.dto.BalanceDeltaRequestDto;
import com.penny.ledger.controller.dto.BalanceResponseDto;
import com.penny.ledger.controller.dto.BatchBalanceRequestDto;
import com.penny.ledger.controller.dto.CountResponseDto;
import com.penny.ledger.error.LedgerNotFoundException;
import com.penny.ledger.model.Account;
import com.penny.ledger.model.AccountDraft;
import com.penny.ledger.model.AccountUpdate;
import com.penny.ledger.model.Operation;
import com.penny.ledger.web.RequestContextHolder;
import jakarta.validation.Valid;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/accounts")
public class AccountsController {

    private final AccountLedgerService ledgerService;
    private final OperationJournalService journalService;

    public AccountsController(AccountLedgerService ledgerService, OperationJournalService journalService) {
        this.ledgerService = ledgerService;
        this.journalService = journalService;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public AccountsListResponseDto listAccounts() {
        return new AccountsListResponseDto(ledgerService.getAllAccounts(), RequestContextHolder.traceId().orElse(null));
    }

    @GetMapping(path = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Account getAccount(@PathVariable String id) {
        return ledgerService.getAccountById(id).orElseThrow(() -> new LedgerNotFoundException("Account", id));
    }

    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public Account createAccount(@RequestBody AccountDraft request) {
        return ledgerService.createAccount(request);
    }

    @PatchMapping(path = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Account updateAccount(@PathVariable String id, @RequestBody AccountUpdate request) {
        return ledgerService.updateAccount(id, request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteAccount(@PathVariable String id, @RequestParam(name = "transferTo", required = false) String transferTo) {
        ledgerService.deleteAccount(id, transferTo);
    }

    @PutMapping("/order")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void reorderAccounts(@Valid @RequestBody AccountsOrderRequestDto request) {
        ledgerService.reorderAccounts(request.accountIds());
    }

    @GetMapping(path = "/{id}/balance", produces = MediaType.APPLICATION_JSON_VALUE)
    public BalanceResponseDto getBalance(@PathVariable String id) {
        return new BalanceResponseDto(id, ledgerService.getAccountBalance(id));
    }

    @PostMapping(path = "/{id}/balance/delta", produces = MediaType.APPLICATION_JSON_VALUE)
    public BalanceResponseDto applyDelta(@PathVariable String id, @Valid @RequestBody BalanceDeltaRequestDto request) {
        return new BalanceResponseDto(id, ledgerService.updateAccountBalance(id, request.delta()));
    }

    @PostMapping(path = "/{id}/balance/adjust", produces = MediaType.APPLICATION_JSON_VALUE)
    public BalanceResponseDto adjustBalance(@PathVariable String id, @Valid @RequestBody BalanceAdjustRequestDto request) {
        return new BalanceResponseDto(id, ledgerService.adjustAccountBalance(id, request.targetBalance(), request.description()));
    }

    @PostMapping(path = "/balances/batch", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, BigDecimal> batchUpdate(@Valid @RequestBody BatchBalanceRequestDto request) {
        return ledgerService.batchUpdateBalances(request.deltas());
    }

    @PostMapping(path = "/{id}/operations/transfer", produces = MediaType.APPLICATION_JSON_VALUE)
    public CountResponseDto transferOperations(@PathVariable String id, @RequestParam("to") String to) {
        return new CountResponseDto(ledgerService.transferOperations(id, to));
    }

    @GetMapping(path = "/{id}/operations/count", produces = MediaType.APPLICATION_JSON_VALUE)
    public CountResponseDto operationCount(@PathVariable String id) {
        return new CountResponseDto(ledgerService.getOperationCount(id));
    }

    @GetMapping(path = "/{id}/operations", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Operation> operations(@PathVariable String id) {
        return journalService.getOperationsByAccount(id);
    }
}
