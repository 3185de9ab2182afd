package com.genai.anomaly.model;

public record ErrorResponse(String error, String message) {}
