package com.penny.ledger.category;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.penny.ledger.error.LedgerIntegrityException;
import com.penny.ledger.event.LedgerEventNotifier;
import com.penny.ledger.model.Category;
import com.penny.ledger.model.CategoryKind;
import com.penny.ledger.model.CategoryType;
import com.penny.ledger.store.LedgerStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CategoryServiceOrderingTest {

    @Mock
    private LedgerStore store;
    @Mock
    private CategoryRepository repository;
    @Mock
    private LedgerEventNotifier notifier;

    private CategoryService service;
    private final Clock clock = Clock.fixed(Instant.parse("2025-03-15T12:00:00Z"), ZoneOffset.UTC);

    @BeforeEach
    void setUp() {
        service = new CategoryService(store, repository, notifier, clock);
        when(store.inTransaction(any())).thenAnswer(inv ->
                inv.<LedgerStore.TransactionCallback<?>>getArgument(0).doInTransaction(store));
    }

    @Test
    void childrenCheckShortCircuitsUsageCount() {
        Category folder = new Category("food", "Food", CategoryKind.FOLDER, CategoryType.EXPENSE, null,
                null, null, false, false, clock.instant(), clock.instant());
        when(repository.findById(store, "food")).thenReturn(Optional.of(folder));
        when(repository.countChildren(store, "food")).thenReturn(3);

        assertThatThrownBy(() -> service.deleteCategory("food"))
                .isInstanceOf(LedgerIntegrityException.class)
                .hasMessageContaining("3 subcategory(ies)");

        verify(repository, never()).countUsage(any(), any());
        verify(repository, never()).delete(any(), any());
        verify(notifier, never()).publish(any(), any());
    }
}
