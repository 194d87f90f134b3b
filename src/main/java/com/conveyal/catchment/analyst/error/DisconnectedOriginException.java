package com.conveyal.catchment.analyst.error;

/** An origin point could not be linked to any edge usable by the requested mode. */
public class DisconnectedOriginException extends CatchmentAreaException {

    public final int originIndex;

    public DisconnectedOriginException (int originIndex, double lat, double lon) {
        super(Type.DISCONNECTED_ORIGIN, String.format(
                "Origin %d at (%.6f, %.6f) is not near any street usable by this mode.", originIndex, lat, lon));
        this.originIndex = originIndex;
    }

}
