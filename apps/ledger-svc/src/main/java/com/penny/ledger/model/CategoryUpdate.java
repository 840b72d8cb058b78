package com.penny.ledger.model;

/**
 * Partial category update; null fields are left unchanged. A non-null {@code parentId} is a
 * move and goes through the same cycle check as an explicit move. Moving back to the root
 * level is done with an explicit move to {@code null}.
 */
public record CategoryUpdate(
        String name,
        CategoryKind type,
        CategoryType categoryType,
        String parentId,
        String icon,
        String color,
        Boolean excludeFromForecast
) {
}
