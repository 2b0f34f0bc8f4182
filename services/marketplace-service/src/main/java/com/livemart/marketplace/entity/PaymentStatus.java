package com.livemart.marketplace.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PaymentStatus {
    PENDING,
    PAID,
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PaymentStatus fromValue(String value) {
        return PaymentStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
