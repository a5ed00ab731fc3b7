package com.integrationhealth.core.model;

public record RetryResult(int retriedCount) {

    public static RetryResult none() {
        return new RetryResult(0);
    }

    public static RetryResult once() {
        return new RetryResult(1);
    }
}
