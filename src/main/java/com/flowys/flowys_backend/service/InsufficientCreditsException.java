package com.flowys.flowys_backend.service;

import lombok.Getter;

@Getter
public class InsufficientCreditsException extends RuntimeException {

    private final long required;
    private final long remaining;

    public InsufficientCreditsException(long required, long remaining) {
        super("This workflow requires " + required + " credits, but you only have " + remaining + " remaining.");
        this.required = required;
        this.remaining = remaining;
    }
}
