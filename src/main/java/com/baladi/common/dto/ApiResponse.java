package com.baladi.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Common response envelope for every REST endpoint.
 *
 * <pre>
 *   {"success": true, "data": {...}}
 *   {"success": false, "message": "Order not found"}
 * </pre>
 *
 * @param <T> payload type
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        boolean success,
        T data,
        String message
) {
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T> ApiResponse<T> error(String message) {
        return new ApiResponse<>(false, null, message);
    }
}
