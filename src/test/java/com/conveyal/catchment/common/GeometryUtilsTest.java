package com.conveyal.catchment.common;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeometryUtilsTest {

    @Test
    void fixedPointDegrees () {
        assertEquals(533177000, GeometryUtils.floatingDegreesToFixed(53.3177));
        assertEquals(-1267820, GeometryUtils.floatingDegreesToFixed(-0.126782));
        assertEquals(53.3177, GeometryUtils.fixedDegreesToFloating(533177000), 1e-9);
    }

    @Test
    void distances () {
        // One degree of latitude is about 111 km.
        assertEquals(111_132, GeometryUtils.distance(53, 12, 54, 12), 100);
        // Degrees of longitude shrink with the cosine of the latitude.
        double eastWest = GeometryUtils.distance(60, 12, 60, 13);
        assertEquals(111_132 / 2.0, eastWest, 300);
        assertEquals(0, GeometryUtils.distance(53, 12, 53, 12), 0);
    }

    @Test
    void bufferEnvelopeContainsTheBuffer () {
        Envelope envelope = GeometryUtils.bufferEnvelope(53.3177, 12.6782, 1000);
        double north = GeometryUtils.distance(53.3177, 12.6782, envelope.getMaxY(), 12.6782);
        double east = GeometryUtils.distance(53.3177, 12.6782, 53.3177, envelope.getMaxX());
        assertTrue(north >= 990 && north < 1100, "north extent " + north);
        assertTrue(east >= 990 && east < 1100, "east extent " + east);
        assertThrows(IllegalArgumentException.class, () -> GeometryUtils.bufferEnvelope(90, 0, 10));
        assertThrows(IllegalArgumentException.class, () -> GeometryUtils.bufferEnvelope(0, 0, -1));
    }
}
