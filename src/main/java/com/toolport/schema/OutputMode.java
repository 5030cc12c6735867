package com.toolport.schema;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum OutputMode {
    VALUE, ERROR, NULL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
