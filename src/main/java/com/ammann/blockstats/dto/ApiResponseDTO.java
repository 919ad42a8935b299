/* (C)2026 */
package com.ammann.blockstats.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Success envelope for REST responses: {@code {"status":"success","data":...}}.
 *
 * @param <T> payload type
 */
@Schema(description = "Successful API response")
public record ApiResponseDTO<T>(
        @Schema(description = "Always 'success'") String status,
        @Schema(description = "Response payload") T data) {

    public static final String SUCCESS = "success";

    public static <T> ApiResponseDTO<T> success(T data) {
        return new ApiResponseDTO<>(SUCCESS, data);
    }
}
