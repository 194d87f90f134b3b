package com.conveyal.catchment.common;

import gnu.trove.set.TIntSet;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpatialCellsTest {

    private static final double LAT = 53.3177;
    private static final double LON = 12.6782;

    @Test
    void tileNumbersFollowWebMercator () {
        assertEquals(4384, SpatialCells.lonToTile(LON, SpatialCells.FINE_ZOOM));
        assertEquals(2656, SpatialCells.latToTile(LAT, SpatialCells.FINE_ZOOM));
        assertEquals(68, SpatialCells.lonToTile(LON, SpatialCells.COARSE_ZOOM));
        assertEquals(41, SpatialCells.latToTile(LAT, SpatialCells.COARSE_ZOOM));
        // Out of range values are clamped onto the edge tiles.
        assertEquals(0, SpatialCells.lonToTile(-180, 7));
        assertEquals(127, SpatialCells.lonToTile(180, 7));
        assertEquals(0, SpatialCells.latToTile(85.06, 7));
    }

    @Test
    void cellIdsPackTileNumbers () {
        int cell = SpatialCells.fineCellForPoint(LAT, LON);
        assertEquals(4384, SpatialCells.cellX(cell, SpatialCells.FINE_ZOOM));
        assertEquals(2656, SpatialCells.cellY(cell, SpatialCells.FINE_ZOOM));
        assertEquals(SpatialCells.cellId(4384, 2656, 13), cell);
    }

    @Test
    void fineCellsNestInCoarseCells () {
        int fine = SpatialCells.fineCellForPoint(LAT, LON);
        int coarse = SpatialCells.coarseCellForPoint(LAT, LON);
        assertEquals(coarse, SpatialCells.coarseParent(fine));
        Envelope coarseEnvelope = SpatialCells.cellEnvelope(coarse, SpatialCells.COARSE_ZOOM);
        Envelope fineEnvelope = SpatialCells.cellEnvelope(fine, SpatialCells.FINE_ZOOM);
        assertTrue(coarseEnvelope.contains(fineEnvelope));
        assertTrue(fineEnvelope.contains(LON, LAT));
    }

    @Test
    void envelopesCoverEveryIntersectedCell () {
        Envelope small = new Envelope(LON - 0.001, LON + 0.001, LAT - 0.001, LAT + 0.001);
        TIntSet single = SpatialCells.cellsInEnvelope(small, SpatialCells.FINE_ZOOM);
        assertEquals(1, single.size());
        assertTrue(single.contains(SpatialCells.fineCellForPoint(LAT, LON)));

        // Three fine tiles wide at zoom 13 is about 0.132 degrees of longitude.
        Envelope wide = new Envelope(LON - 0.05, LON + 0.05, LAT - 0.001, LAT + 0.001);
        TIntSet row = SpatialCells.cellsInEnvelope(wide, SpatialCells.FINE_ZOOM);
        assertEquals(3, row.size());
        for (int cell : row.toArray()) {
            assertEquals(2656, SpatialCells.cellY(cell, SpatialCells.FINE_ZOOM));
        }
    }
}
