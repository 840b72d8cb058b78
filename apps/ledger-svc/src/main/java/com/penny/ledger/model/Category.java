package com.penny.ledger.model;

import java.time.Instant;

public record Category(
        String id,
        String name,
        CategoryKind type,
        CategoryType categoryType,
        String parentId,
        String icon,
        String color,
        boolean shadow,
        boolean excludeFromForecast,
        Instant createdAt,
        Instant updatedAt
) {

    public boolean isRoot() {
        return parentId == null;
    }
}
