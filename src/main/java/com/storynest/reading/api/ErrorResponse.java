package com.storynest.reading.api;

public record ErrorResponse(String code, String message) {}
