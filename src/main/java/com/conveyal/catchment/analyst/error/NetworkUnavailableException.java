package com.conveyal.catchment.analyst.error;

/** The network database could not be reached, or a partition could not be loaded from it. */
public class NetworkUnavailableException extends CatchmentAreaException {

    public NetworkUnavailableException (String message, Throwable cause) {
        super(Type.NETWORK_UNAVAILABLE, message, cause);
    }

}
