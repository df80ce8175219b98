package com.finpal.assistant.controller.dto;

public record RegisterResponseDto(boolean success, String message) {
}
