package com.autodialer.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 一次呼叫尝试的状态。由网关写入后即为终态，记录不会再被改回。
 */
public enum CallStatus {
    QUEUED,
    ANSWERED,
    FAILED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CallStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        for (CallStatus s : values()) {
            if (s.code().equalsIgnoreCase(code.trim())) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown call status: " + code);
    }
}
