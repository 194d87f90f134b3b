package com.conveyal.catchment.analyst.cluster;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** The externally visible status of a catchment area job. */
public enum JobStatus {
    IN_PROGRESS,
    SUCCESS,
    FAILURE,
    DISCONNECTED_ORIGIN;

    /** Once a job has a terminal status it never changes again. */
    public boolean isTerminal () {
        return this != IN_PROGRESS;
    }

    @JsonValue
    public String jsonName () {
        return name().toLowerCase(Locale.ROOT);
    }
}
