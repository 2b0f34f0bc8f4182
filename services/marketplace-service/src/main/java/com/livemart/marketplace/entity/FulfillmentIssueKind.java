package com.livemart.marketplace.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FulfillmentIssueKind {
    /** Order persisted, but some stock decrements failed. */
    DEBIT_INCOMPLETE,
    /** A compensating re-increment failed after a rejected debit. */
    RESTOCK_FAILED,
    /** A rejected order could not be moved to cancelled. */
    CANCEL_FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FulfillmentIssueKind fromValue(String value) {
        return FulfillmentIssueKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
