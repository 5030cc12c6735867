package com.toolport.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** The closed set of value types exchanged over the wire. */
public enum WireType {
    STRING("string"),
    INTEGER("integer"),
    FLOAT("float"),
    BOOLEAN("boolean"),
    JSON("json");

    private final String wireName;

    WireType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static WireType fromWireName(String wireName) {
        for (var t : values()) {
            if (t.wireName.equals(wireName)) return t;
        }
        throw new IllegalArgumentException("Unknown wire type: " + wireName);
    }
}
