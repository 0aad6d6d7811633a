package com.example.summarizer_backend.dto.web;

public record ErrorResponse(String error, String message) {
}
