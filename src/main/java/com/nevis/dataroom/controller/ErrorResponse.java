package com.nevis.dataroom.controller;

public record ErrorResponse(
    String message,
    int status,
    long timestamp
) {}
