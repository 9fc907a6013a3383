package com.narrativeplatform.narrative.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ErrorResponseDTO(
    @JsonProperty("status") String status,
    @JsonProperty("error") String error,
    @JsonProperty("message") String message
) {
    public static ErrorResponseDTO of(String error, String message) {
        return new ErrorResponseDTO("error", error, message);
    }
}
