package com.finpal.assistant.controller.dto;

import com.finpal.assistant.model.FinancialRecord;

public record FinanceUpdateResponseDto(boolean success, FinancialRecord finance) {
}
