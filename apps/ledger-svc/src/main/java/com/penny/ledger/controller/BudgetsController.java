package com.penny.ledger.controller;

import com.penny.ledger.budget.BudgetPeriods;
import com.penny.ledger.budget.BudgetService;
import com.penny.ledger.error.LedgerNotFoundException;
import com.penny.ledger.error.LedgerValidationException;
import com.penny.ledger.model.Budget;
import com.penny.ledger.model.BudgetDraft;
import com.penny.ledger.model.BudgetStatus;
import com.penny.ledger.model.PeriodType;
import com.penny.ledger.model.PeriodWindow;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
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
@RequestMapping("/budgets")
public class BudgetsController {

    private final BudgetService budgetService;
    private final Clock clock;

    public BudgetsController(BudgetService budgetService, Clock clock) {
        this.budgetService = budgetService;
        this.clock = clock;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Budget> listBudgets(
            @RequestParam(name = "categoryId", required = false) String categoryId,
            @RequestParam(name = "activeOn", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate activeOn,
            @RequestParam(name = "currency", required = false) String currency,
            @RequestParam(name = "periodType", required = false) String periodType,
            @RequestParam(name = "recurring", defaultValue = "false") boolean recurring
    ) {
        if (categoryId != null) {
            return budgetService.getBudgetsByCategory(categoryId);
        }
        if (currency != null) {
            return budgetService.getBudgetsByCurrency(currency);
        }
        if (periodType != null) {
            return budgetService.getBudgetsByPeriodType(PeriodType.find(periodType)
                    .orElseThrow(() -> new LedgerValidationException("Invalid period type: " + periodType)));
        }
        if (activeOn != null) {
            return budgetService.getActiveBudgets(activeOn);
        }
        return recurring ? budgetService.getRecurringBudgets() : budgetService.getAllBudgets();
    }

    @GetMapping(path = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Budget getBudget(@PathVariable String id) {
        return budgetService.getBudgetById(id).orElseThrow(() -> new LedgerNotFoundException("Budget", id));
    }

    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public Budget createBudget(@RequestBody BudgetDraft request) {
        return budgetService.createBudget(request);
    }

    @PatchMapping(path = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Budget updateBudget(@PathVariable String id, @RequestBody BudgetDraft request) {
        return budgetService.updateBudget(id, request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteBudget(@PathVariable String id) {
        budgetService.deleteBudget(id);
    }

    @GetMapping(path = "/{id}/status", produces = MediaType.APPLICATION_JSON_VALUE)
    public BudgetStatus status(
            @PathVariable String id,
            @RequestParam(name = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return budgetService.calculateBudgetStatus(id, date != null ? date : LocalDate.now(clock));
    }

    @GetMapping(path = "/statuses", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, BudgetStatus> statuses(
            @RequestParam(name = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return budgetService.calculateAllBudgetStatuses(date != null ? date : LocalDate.now(clock));
    }

    @GetMapping(path = "/periods", produces = MediaType.APPLICATION_JSON_VALUE)
    public PeriodWindow period(
            @RequestParam("type") String type,
            @RequestParam(name = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(name = "direction", defaultValue = "current") String direction) {
        LocalDate reference = date != null ? date : LocalDate.now(clock);
        return switch (direction) {
            case "current" -> BudgetPeriods.getCurrentPeriodDates(type, reference);
            case "next" -> BudgetPeriods.getNextPeriodDates(type, reference);
            case "previous" -> BudgetPeriods.getPreviousPeriodDates(type, reference);
            default -> throw new LedgerValidationException("direction must be current, next or previous");
        };
    }

    @GetMapping(path = "/duplicates", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Budget> duplicate(
            @RequestParam("categoryId") String categoryId,
            @RequestParam("currency") String currency,
            @RequestParam("periodType") String periodType,
            @RequestParam(name = "excludeId", required = false) String excludeId) {
        return budgetService.findDuplicateBudget(categoryId, currency, PeriodType.fromValue(periodType), excludeId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
