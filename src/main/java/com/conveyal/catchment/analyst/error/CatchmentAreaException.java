package com.conveyal.catchment.analyst.error;

/**
 * Base class of the conditions that abort a catchment area job. Lower components only throw these; the job
 * orchestrator maps them to a terminal job status.
 */
public class CatchmentAreaException extends RuntimeException {

    public enum Type {
        BAD_REQUEST,
        NETWORK_UNAVAILABLE,
        BUFFER_EXCEEDS_NETWORK,
        DISCONNECTED_ORIGIN,
        INVALID_SCENARIO,
        UNKNOWN
    }

    public final Type type;

    public CatchmentAreaException (Type type, String message) {
        super(message);
        this.type = type;
    }

    public CatchmentAreaException (Type type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public static CatchmentAreaException badRequest (String message) {
        return new CatchmentAreaException(Type.BAD_REQUEST, message);
    }

    public static CatchmentAreaException unknown (Throwable cause) {
        return new CatchmentAreaException(Type.UNKNOWN, cause.toString(), cause);
    }

}
