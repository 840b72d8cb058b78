package com.penny.ledger.controller.dto;

import java.util.Map;

/**
 * Body of every non-2xx response. {@code path} is the request URI that failed.
 */
public record ErrorResponseDto(
        String code,
        String message,
        Map<String, Object> details,
        String traceId,
        String path
) {
}
