package com.conveyal.catchment.analyst.scenario;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EditType {
    ADD, MODIFY, DELETE;

    @JsonValue
    public String jsonName () {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Accepts full names in any case, and the one-letter codes a, m and d used in overlay tables. */
    @JsonCreator
    public static EditType forName (String name) {
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "a":
            case "add":
                return ADD;
            case "m":
            case "modify":
                return MODIFY;
            case "d":
            case "delete":
                return DELETE;
            default:
                throw new IllegalArgumentException("Unknown edit type: " + name);
        }
    }
}
