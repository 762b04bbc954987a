package com.relaygate.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * OpenAI-style error envelope: {@code {"error": {...}}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiErrorResponse {

    @JsonProperty("error")
    private ErrorBody error;

    public static ApiErrorResponse of(String type, String code, String message) {
        return new ApiErrorResponse(ErrorBody.builder().type(type).code(code).message(message).build());
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorBody {
        private String type;
        private String message;
        private String code;
        private List<AttemptView> attempts;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AttemptView {
        private String provider;
        private String model;
        private String reason;
    }
}
