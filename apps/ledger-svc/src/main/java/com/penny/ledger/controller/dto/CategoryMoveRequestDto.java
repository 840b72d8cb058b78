package com.penny.ledger.controller.dto;

/**
 * A null parent moves the category to the root level.
 */
public record CategoryMoveRequestDto(String parentId) {
}
