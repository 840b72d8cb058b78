package com.penny.ledger.controller.dto;

public record CountResponseDto(int count) {
}
