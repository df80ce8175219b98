package com.finpal.assistant.controller.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record QueryRequestDto(String phone, String message) {

    public static QueryRequestDto empty() {
        return new QueryRequestDto(null, null);
    }
}
