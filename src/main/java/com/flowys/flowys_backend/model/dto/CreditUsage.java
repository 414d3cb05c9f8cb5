package com.flowys.flowys_backend.model.dto;

public record CreditUsage(long used, long remaining) {}
