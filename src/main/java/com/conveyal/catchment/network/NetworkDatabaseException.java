package com.conveyal.catchment.network;

/** Thrown by NetworkDatabase implementations when the database cannot be reached or a query fails. */
public class NetworkDatabaseException extends RuntimeException {

    public NetworkDatabaseException (String message) {
        super(message);
    }

    public NetworkDatabaseException (String message, Throwable cause) {
        super(message, cause);
    }

}
