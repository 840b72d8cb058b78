package com.penny.ledger.model;

/**
 * New category input. A null id is replaced by a generated one; a null category type
 * defaults to expense.
 */
public record CategoryDraft(
        String id,
        String name,
        CategoryKind type,
        CategoryType categoryType,
        String parentId,
        String icon,
        String color,
        Boolean excludeFromForecast
) {
}
