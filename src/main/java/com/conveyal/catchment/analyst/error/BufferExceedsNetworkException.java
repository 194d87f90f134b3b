package com.conveyal.catchment.analyst.error;

import gnu.trove.set.TIntSet;

/**
 * The buffer around the origins reaches coarse cells that are not part of the loaded network, so the result would
 * be cut off at the edge of the network.
 */
public class BufferExceedsNetworkException extends CatchmentAreaException {

    public final int[] missingCells;

    public BufferExceedsNetworkException (TIntSet missingCells) {
        super(Type.BUFFER_EXCEEDS_NETWORK, String.format(
                "Search area extends into %d spatial cells outside the network region.", missingCells.size()));
        this.missingCells = missingCells.toArray();
    }

}
