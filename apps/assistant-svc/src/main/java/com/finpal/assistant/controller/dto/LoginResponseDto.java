package com.finpal.assistant.controller.dto;

import com.finpal.assistant.model.FinancialRecord;

public record LoginResponseDto(
        boolean success,
        UserSummaryDto user,
        FinancialRecord finance,
        String accessToken,
        String tokenType,
        long expiresIn
) {

    public record UserSummaryDto(String phone, String name) {}
}
