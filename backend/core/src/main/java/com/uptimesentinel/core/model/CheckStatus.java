package com.uptimesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

public enum CheckStatus {
    @JsonProperty("up")
    UP,
    @JsonProperty("down")
    DOWN;

    public static CheckStatus fromSuccess(boolean success) {
        return success ? UP : DOWN;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
