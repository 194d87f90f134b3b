package com.conveyal.catchment.network;

import com.conveyal.catchment.profile.StreetMode;
import com.conveyal.catchment.streets.OriginConnector;

/**
 * Request-scoped resource holding the origin points of one job in the network database, used to link each origin to
 * the network. Sessions must be closed on every exit path, so they are used in try-with-resources blocks.
 */
public interface OriginSession extends AutoCloseable {

    /**
     * Link the origin with the given index to the nearest edge the mode may use.
     * @return the connector for that origin, or null if no eligible edge is within the snapping radius.
     */
    OriginConnector snap (int originIndex, StreetMode mode);

    /** Release the origin points. Closing does not throw checked exceptions. */
    @Override
    void close ();

}
