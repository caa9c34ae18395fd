package com.foursite.growth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Unified response envelope for every endpoint
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Unified response envelope used by all APIs")
public class ApiResponse<T> {

    private boolean success;

    @Schema(nullable = true)
    private T data;

    @Schema(nullable = true)
    private ErrorBody error;

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static ApiResponse<Void> error(String code, String message, boolean retryable) {
        return new ApiResponse<>(false, null, new ErrorBody(code, message, retryable));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "Structured error details")
    public static class ErrorBody {
        @Schema(example = "SITE_NOT_FOUND")
        private String code;
        private String message;
        private boolean retryable;
    }
}
