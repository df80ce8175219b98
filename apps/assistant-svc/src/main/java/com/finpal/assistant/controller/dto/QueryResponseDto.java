package com.finpal.assistant.controller.dto;

public record QueryResponseDto(String reply) {
}
