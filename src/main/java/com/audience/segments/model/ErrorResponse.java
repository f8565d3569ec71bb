package com.audience.segments.model;

public record ErrorResponse(String error, String message) {}
