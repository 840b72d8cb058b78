package com.penny.ledger.category;

import com.penny.ledger.error.LedgerIntegrityException;
import com.penny.ledger.error.LedgerNotFoundException;
import com.penny.ledger.error.LedgerValidationException;
import com.penny.ledger.event.LedgerEvent;
import com.penny.ledger.event.LedgerEventNotifier;
import com.penny.ledger.model.Category;
import com.penny.ledger.model.CategoryDraft;
import com.penny.ledger.model.CategoryKind;
import com.penny.ledger.model.CategoryType;
import com.penny.ledger.model.CategoryUpdate;
import com.penny.ledger.model.ShadowCategories;
import com.penny.ledger.store.LedgerStore;
import com.penny.ledger.store.StoreSession;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Category tree: CRUD, cycle-safe moves, descendant expansion and the shadow category pair.
 * Traversals load the parent links once and walk them with an explicit queue.
 */
@Service
public class CategoryService {

    private static final Logger log = LoggerFactory.getLogger(CategoryService.class);

    private final LedgerStore store;
    private final CategoryRepository repository;
    private final LedgerEventNotifier notifier;
    private final Clock clock;

    private volatile ShadowCategories shadowCategories;

    public CategoryService(LedgerStore store,
                           CategoryRepository repository,
                           LedgerEventNotifier notifier,
                           Clock clock) {
        this.store = store;
        this.repository = repository;
        this.notifier = notifier;
        this.clock = clock;
    }

    public List<Category> getAllCategories(boolean includeShadow) {
        return repository.findAll(store, includeShadow);
    }

    public Optional<Category> getCategoryById(String id) {
        return repository.findById(store, id);
    }

    public Category requireCategory(String id) {
        return repository.findById(store, id).orElseThrow(() -> new LedgerNotFoundException("Category", id));
    }

    /**
     * Direct children of a category, or the visible root categories when {@code parentId} is null.
     */
    public List<Category> getChildCategories(String parentId) {
        return repository.findChildren(store, parentId);
    }

    public boolean hasChildCategories(String id) {
        return repository.countChildren(store, id) > 0;
    }

    public boolean categoryExists(String id) {
        return id != null && repository.exists(store, id);
    }

    public int countCategoryUsage(String id) {
        return repository.countUsage(store, id);
    }

    public Category createCategory(CategoryDraft draft) {
        if (draft == null || draft.name() == null || draft.name().isBlank()) {
            throw new LedgerValidationException("Category name is required");
        }
        if (draft.type() == null) {
            throw new LedgerValidationException("Category type is required");
        }
        Category created = store.inTransaction(tx -> {
            if (draft.parentId() != null && !repository.exists(tx, draft.parentId())) {
                throw new LedgerNotFoundException("Category", draft.parentId());
            }
            Instant now = clock.instant();
            String id = draft.id() == null || draft.id().isBlank() ? UUID.randomUUID().toString() : draft.id();
            Category category = new Category(
                    id,
                    draft.name().trim(),
                    draft.type(),
                    draft.categoryType() == null ? CategoryType.EXPENSE : draft.categoryType(),
                    draft.parentId(),
                    draft.icon(),
                    draft.color(),
                    false,
                    Boolean.TRUE.equals(draft.excludeFromForecast()),
                    now,
                    now
            );
            repository.insert(tx, category);
            return category;
        });
        notifier.publish(LedgerEvent.Kind.CATEGORIES_CHANGED, created.id());
        return created;
    }

    public Category updateCategory(String id, CategoryUpdate update) {
        Category updated = store.inTransaction(tx -> {
            Category existing = repository.findById(tx, id)
                    .orElseThrow(() -> new LedgerNotFoundException("Category", id));
            if (existing.shadow()
                    && ((update.categoryType() != null && update.categoryType() != existing.categoryType())
                    || (update.type() != null && update.type() != existing.type()))) {
                throw new LedgerIntegrityException("Cannot change the type of a shadow category");
            }
            String parentId = existing.parentId();
            if (update.parentId() != null && !update.parentId().equals(existing.parentId())) {
                if (existing.shadow()) {
                    throw new LedgerIntegrityException("Cannot move a shadow category");
                }
                ensureValidParent(tx, id, update.parentId());
                parentId = update.parentId();
            }
            if (update.name() != null && update.name().isBlank()) {
                throw new LedgerValidationException("Category name is required");
            }
            Category category = new Category(
                    existing.id(),
                    update.name() != null ? update.name().trim() : existing.name(),
                    update.type() != null ? update.type() : existing.type(),
                    update.categoryType() != null ? update.categoryType() : existing.categoryType(),
                    parentId,
                    update.icon() != null ? update.icon() : existing.icon(),
                    update.color() != null ? update.color() : existing.color(),
                    existing.shadow(),
                    update.excludeFromForecast() != null ? update.excludeFromForecast() : existing.excludeFromForecast(),
                    existing.createdAt(),
                    clock.instant()
            );
            repository.update(tx, category);
            return category;
        });
        notifier.publish(LedgerEvent.Kind.CATEGORIES_CHANGED, id);
        return updated;
    }

    /**
     * Deletes a leaf category nobody references. Children are checked before journal usage and
     * the usage count is never queried while children exist.
     */
    public void deleteCategory(String id) {
        store.inTransaction(tx -> {
            Category existing = repository.findById(tx, id)
                    .orElseThrow(() -> new LedgerNotFoundException("Category", id));
            if (existing.shadow()) {
                throw new LedgerIntegrityException("Cannot delete category: shadow categories are managed by the system");
            }
            int children = repository.countChildren(tx, id);
            if (children > 0) {
                throw new LedgerIntegrityException("Cannot delete category: " + children
                        + " subcategory(ies) exist. Please delete or reassign the subcategories first.", children);
            }
            int usage = repository.countUsage(tx, id);
            if (usage > 0) {
                throw new LedgerIntegrityException("Cannot delete category: " + usage
                        + " transaction(s) use this category. Please reassign or delete the transactions first.", usage);
            }
            return repository.delete(tx, id);
        });
        log.info("Category {} deleted", id);
        notifier.publish(LedgerEvent.Kind.CATEGORIES_CHANGED, id);
    }

    /**
     * Re-parents a category. Fails without writing when the new parent is the category itself
     * or one of its descendants. A null parent moves the category to the root level.
     */
    public void moveCategory(String id, String newParentId) {
        store.inTransaction(tx -> {
            Category existing = repository.findById(tx, id)
                    .orElseThrow(() -> new LedgerNotFoundException("Category", id));
            if (existing.shadow()) {
                throw new LedgerIntegrityException("Cannot move a shadow category");
            }
            if (newParentId != null) {
                ensureValidParent(tx, id, newParentId);
            }
            return repository.updateParent(tx, id, newParentId, clock.instant());
        });
        notifier.publish(LedgerEvent.Kind.CATEGORIES_CHANGED, id);
    }

    /**
     * Every transitive child of the category in breadth-first order, excluding the category itself.
     */
    public List<Category> getAllDescendants(String id) {
        return getAllDescendants(store, id);
    }

    public List<Category> getAllDescendants(StoreSession session, String id) {
        List<Category> all = repository.findAll(session, true);
        Map<String, List<Category>> childrenByParent = new HashMap<>();
        for (Category category : all) {
            if (category.parentId() != null) {
                childrenByParent.computeIfAbsent(category.parentId(), key -> new ArrayList<>()).add(category);
            }
        }
        List<Category> descendants = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(id);
        Deque<String> queue = new ArrayDeque<>();
        queue.add(id);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (Category child : childrenByParent.getOrDefault(current, List.of())) {
                if (visited.add(child.id())) {
                    descendants.add(child);
                    queue.add(child.id());
                }
            }
        }
        return descendants;
    }

    /**
     * Root-to-node chain ending with the category itself; empty when the id is unknown.
     */
    public List<Category> getCategoryPath(String id) {
        Map<String, Category> byId = repository.findAll(store, true).stream()
                .collect(Collectors.toMap(Category::id, Function.identity()));
        List<Category> path = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Category current = byId.get(id);
        while (current != null && visited.add(current.id())) {
            path.add(current);
            current = current.parentId() == null ? null : byId.get(current.parentId());
        }
        Collections.reverse(path);
        return path;
    }

    public Optional<ShadowCategories> findShadowCategories() {
        ShadowCategories cached = shadowCategories;
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<ShadowCategories> resolved = resolveShadow(repository.findShadow(store));
        resolved.ifPresent(value -> shadowCategories = value);
        return resolved;
    }

    /**
     * The shadow pair, resolved once and cached for the life of the service.
     *
     * @throws LedgerIntegrityException when the pair has not been bootstrapped
     */
    public ShadowCategories getShadowCategories() {
        return findShadowCategories().orElseThrow(() -> new LedgerIntegrityException(
                "Shadow categories not found. Please reinitialize the database."));
    }

    /**
     * Creates whichever shadow category is missing. Safe to run on every start.
     */
    public ShadowCategories ensureShadowCategories() {
        ShadowCategories ensured = store.inTransaction(tx -> {
            Instant now = clock.instant();
            boolean expenseAdded = repository.insertIfAbsent(tx, shadow(ShadowCategories.EXPENSE_ID,
                    "Balance Adjustment (Expense)", CategoryType.EXPENSE, "cash-minus", now));
            boolean incomeAdded = repository.insertIfAbsent(tx, shadow(ShadowCategories.INCOME_ID,
                    "Balance Adjustment (Income)", CategoryType.INCOME, "cash-plus", now));
            if (expenseAdded || incomeAdded) {
                log.info("Shadow categories bootstrapped: expenseAdded={}, incomeAdded={}", expenseAdded, incomeAdded);
            }
            return resolveShadow(repository.findShadow(tx))
                    .orElseThrow(() -> new IllegalStateException("Shadow categories missing after bootstrap"));
        });
        shadowCategories = ensured;
        return ensured;
    }

    private void ensureValidParent(StoreSession session, String id, String newParentId) {
        if (newParentId.equals(id)) {
            throw new LedgerIntegrityException("Cannot move category to its own descendant");
        }
        Map<String, String> parentLinks = repository.findParentLinks(session);
        if (!parentLinks.containsKey(newParentId)) {
            throw new LedgerNotFoundException("Category", newParentId);
        }
        Set<String> visited = new HashSet<>();
        String cursor = newParentId;
        while (cursor != null && visited.add(cursor)) {
            if (cursor.equals(id)) {
                throw new LedgerIntegrityException("Cannot move category to its own descendant");
            }
            cursor = parentLinks.get(cursor);
        }
    }

    // prefers the well-known ids when stray duplicates exist
    private Optional<ShadowCategories> resolveShadow(List<Category> shadows) {
        Category expense = pickShadow(shadows, CategoryType.EXPENSE, ShadowCategories.EXPENSE_ID);
        Category income = pickShadow(shadows, CategoryType.INCOME, ShadowCategories.INCOME_ID);
        if (expense == null || income == null) {
            return Optional.empty();
        }
        return Optional.of(new ShadowCategories(expense, income));
    }

    private Category pickShadow(List<Category> shadows, CategoryType type, String preferredId) {
        Category fallback = null;
        for (Category category : shadows) {
            if (category.categoryType() != type) {
                continue;
            }
            if (category.id().equals(preferredId)) {
                return category;
            }
            if (fallback == null) {
                fallback = category;
            }
        }
        return fallback;
    }

    private Category shadow(String id, String name, CategoryType type, String icon, Instant now) {
        return new Category(id, name, CategoryKind.ENTRY, type, null, icon, null, true, true, now, now);
    }
}
