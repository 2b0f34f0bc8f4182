package com.livemart.marketplace.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum UserRole {
    WHOLESALER,
    RETAILER,
    CONSUMER;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static UserRole fromValue(String value) {
        return UserRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
