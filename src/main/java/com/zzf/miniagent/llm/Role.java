package com.zzf.miniagent.llm;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

public enum Role {
    @JsonProperty("user")
    USER("User"),
    @JsonProperty("assistant")
    ASSISTANT("Assistant"),
    @JsonProperty("system")
    SYSTEM("System");

    private final String label;

    Role(String label) {
        this.label = label;
    }

    /**
     * Human readable label used when a transcript is rendered as plain text.
     */
    public String label() {
        return label;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
