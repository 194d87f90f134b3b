package com.conveyal.catchment.streets;

import com.conveyal.catchment.common.GeometryUtils;
import com.conveyal.catchment.common.SpatialCells;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineString;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;

import static com.conveyal.catchment.common.GeometryUtils.fixedDegreesToFloating;
import static com.conveyal.catchment.common.GeometryUtils.floatingDegreesToFixed;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * One road or path segment of the routing network, running from sourceNode to targetNode. Edges are immutable: a
 * scenario edit or an origin connector produces a new Edge rather than changing an existing one.
 *
 * Impedances and speed limits are optional. They are kept as nullable boxed values so that an absent value survives
 * a round trip through the partition cache, and are read as zero (impedances) or as "no speed" (limits).
 *
 * The geometry is a polyline including both endpoints, stored as interleaved fixed-point latitude and longitude
 * integers (lat0, lon0, lat1, lon1...) using the same fixed-point scheme as the rest of the network code.
 */
@JsonDeserialize(builder = Edge.Builder.class)
public final class Edge implements Serializable {

    private static final long serialVersionUID = 1L;

    public final long id;
    public final long sourceNode;
    public final long targetNode;

    /** Length along the ground in meters. All cost functions use this length. */
    public final double lengthM;

    /** Length of the geometry in projected units, as supplied by the network database. Informational only. */
    public final double lengthProjected;

    public final StreetClass streetClass;

    public final Double slopeImpedanceForward;
    public final Double slopeImpedanceReverse;
    public final Double surfaceImpedance;
    public final Double maxSpeedForwardKph;
    public final Double maxSpeedReverseKph;

    private final int[] geometry;

    /** Coarse spatial cell (network partition) this edge is stored in. */
    public final int coarseCell;

    /** Fine spatial cell used to filter edges near the origins. */
    public final int fineCell;

    private Edge (Builder builder) {
        this.id = builder.id;
        this.sourceNode = builder.sourceNode;
        this.targetNode = builder.targetNode;
        this.lengthM = builder.lengthM;
        this.lengthProjected = builder.lengthProjected;
        this.streetClass = builder.streetClass;
        this.slopeImpedanceForward = builder.slopeImpedanceForward;
        this.slopeImpedanceReverse = builder.slopeImpedanceReverse;
        this.surfaceImpedance = builder.surfaceImpedance;
        this.maxSpeedForwardKph = builder.maxSpeedForwardKph;
        this.maxSpeedReverseKph = builder.maxSpeedReverseKph;
        this.geometry = builder.geometry;
        this.coarseCell = builder.coarseCell;
        this.fineCell = builder.fineCell;
    }

    public static Builder builder () {
        return new Builder();
    }

    /** A builder pre-filled with all the values of this edge, for deriving modified copies. */
    public Builder toBuilder () {
        Builder builder = new Builder();
        builder.id = id;
        builder.sourceNode = sourceNode;
        builder.targetNode = targetNode;
        builder.lengthM = lengthM;
        builder.lengthProjected = lengthProjected;
        builder.streetClass = streetClass;
        builder.slopeImpedanceForward = slopeImpedanceForward;
        builder.slopeImpedanceReverse = slopeImpedanceReverse;
        builder.surfaceImpedance = surfaceImpedance;
        builder.maxSpeedForwardKph = maxSpeedForwardKph;
        builder.maxSpeedReverseKph = maxSpeedReverseKph;
        builder.geometry = geometry;
        builder.coarseCell = coarseCell;
        builder.fineCell = fineCell;
        return builder;
    }

    /** The slope impedance in the direction of travel, zero when absent. */
    public double slopeImpedance (boolean reverse) {
        Double value = reverse ? slopeImpedanceReverse : slopeImpedanceForward;
        return value == null ? 0 : value;
    }

    /** The surface impedance, zero when absent. */
    public double surfaceImpedanceOrZero () {
        return surfaceImpedance == null ? 0 : surfaceImpedance;
    }

    public int pointCount () {
        return geometry.length / 2;
    }

    public int getFixedLat (int point) {
        return geometry[point * 2];
    }

    public int getFixedLon (int point) {
        return geometry[point * 2 + 1];
    }

    /** A copy of the interleaved fixed-point geometry. */
    public int[] getFixedGeometry () {
        return geometry.clone();
    }

    /** Coordinates of the geometry in floating point degrees, x is longitude. */
    public Coordinate[] getCoordinates () {
        Coordinate[] coordinates = new Coordinate[pointCount()];
        for (int i = 0; i < coordinates.length; i++) {
            coordinates[i] = new Coordinate(fixedDegreesToFloating(getFixedLon(i)), fixedDegreesToFloating(getFixedLat(i)));
        }
        return coordinates;
    }

    public LineString getGeometry () {
        return GeometryUtils.geometryFactory.createLineString(getCoordinates());
    }

    /** Sum of the great circle lengths of all segments of the geometry, in meters. */
    public double geometricLengthMeters () {
        double length = 0;
        Coordinate[] coordinates = getCoordinates();
        for (int i = 1; i < coordinates.length; i++) {
            length += GeometryUtils.distance(coordinates[i - 1], coordinates[i]);
        }
        return length;
    }

    @FunctionalInterface
    public interface SegmentConsumer {
        void consumeSegment (int index, int fixedLat0, int fixedLon0, int fixedLat1, int fixedLon1);
    }

    /** Call the given function on each segment of the geometry, in order from source to target. */
    public void forEachSegment (SegmentConsumer segmentConsumer) {
        for (int s = 0; s < pointCount() - 1; s++) {
            segmentConsumer.consumeSegment(s, getFixedLat(s), getFixedLon(s), getFixedLat(s + 1), getFixedLon(s + 1));
        }
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Edge other = (Edge) o;
        return id == other.id && sourceNode == other.sourceNode && targetNode == other.targetNode
                && Double.compare(lengthM, other.lengthM) == 0
                && Double.compare(lengthProjected, other.lengthProjected) == 0
                && streetClass == other.streetClass
                && Objects.equals(slopeImpedanceForward, other.slopeImpedanceForward)
                && Objects.equals(slopeImpedanceReverse, other.slopeImpedanceReverse)
                && Objects.equals(surfaceImpedance, other.surfaceImpedance)
                && Objects.equals(maxSpeedForwardKph, other.maxSpeedForwardKph)
                && Objects.equals(maxSpeedReverseKph, other.maxSpeedReverseKph)
                && Arrays.equals(geometry, other.geometry)
                && coarseCell == other.coarseCell && fineCell == other.fineCell;
    }

    @Override
    public int hashCode () {
        return Objects.hash(id, sourceNode, targetNode, lengthM, streetClass, coarseCell, fineCell)
                * 31 + Arrays.hashCode(geometry);
    }

    @Override
    public String toString () {
        return String.format("Edge %d (%d -> %d, %s, %.1fm)", id, sourceNode, targetNode, streetClass, lengthM);
    }

    /**
     * Builds Edge instances in code and from JSON (scenario overlays). Geometry must be supplied. If the length is
     * not supplied it is computed from the geometry, and missing spatial cells are derived from the geometry's
     * midpoint.
     */
    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {
        private long id;
        private long sourceNode;
        private long targetNode;
        private double lengthM = Double.NaN;
        private double lengthProjected = Double.NaN;
        private StreetClass streetClass = StreetClass.UNKNOWN;
        private Double slopeImpedanceForward;
        private Double slopeImpedanceReverse;
        private Double surfaceImpedance;
        private Double maxSpeedForwardKph;
        private Double maxSpeedReverseKph;
        private int[] geometry;
        private int coarseCell = -1;
        private int fineCell = -1;

        public Builder id (long id) {
            this.id = id;
            return this;
        }

        public Builder sourceNode (long sourceNode) {
            this.sourceNode = sourceNode;
            return this;
        }

        public Builder targetNode (long targetNode) {
            this.targetNode = targetNode;
            return this;
        }

        public Builder lengthM (double lengthM) {
            this.lengthM = lengthM;
            return this;
        }

        public Builder lengthProjected (double lengthProjected) {
            this.lengthProjected = lengthProjected;
            return this;
        }

        public Builder streetClass (StreetClass streetClass) {
            this.streetClass = streetClass == null ? StreetClass.UNKNOWN : streetClass;
            return this;
        }

        public Builder slopeImpedanceForward (Double slopeImpedanceForward) {
            this.slopeImpedanceForward = slopeImpedanceForward;
            return this;
        }

        public Builder slopeImpedanceReverse (Double slopeImpedanceReverse) {
            this.slopeImpedanceReverse = slopeImpedanceReverse;
            return this;
        }

        public Builder surfaceImpedance (Double surfaceImpedance) {
            this.surfaceImpedance = surfaceImpedance;
            return this;
        }

        public Builder maxSpeedForwardKph (Double maxSpeedForwardKph) {
            this.maxSpeedForwardKph = maxSpeedForwardKph;
            return this;
        }

        public Builder maxSpeedReverseKph (Double maxSpeedReverseKph) {
            this.maxSpeedReverseKph = maxSpeedReverseKph;
            return this;
        }

        /** Geometry as an array of [longitude, latitude] pairs, the GeoJSON axis order. */
        public Builder coordinates (double[][] lonLatPairs) {
            int[] fixed = new int[lonLatPairs.length * 2];
            for (int i = 0; i < lonLatPairs.length; i++) {
                checkArgument(lonLatPairs[i].length == 2, "Each coordinate must have exactly two values.");
                GeometryUtils.checkLon(lonLatPairs[i][0]);
                GeometryUtils.checkLat(lonLatPairs[i][1]);
                fixed[i * 2] = floatingDegreesToFixed(lonLatPairs[i][1]);
                fixed[i * 2 + 1] = floatingDegreesToFixed(lonLatPairs[i][0]);
            }
            this.geometry = fixed;
            return this;
        }

        /** Geometry as interleaved fixed-point latitude and longitude. */
        public Builder fixedGeometry (int[] fixedLatLon) {
            checkArgument(fixedLatLon.length % 2 == 0, "Fixed geometry must contain latitude, longitude pairs.");
            this.geometry = fixedLatLon.clone();
            return this;
        }

        public Builder coarseCell (int coarseCell) {
            this.coarseCell = coarseCell;
            return this;
        }

        public Builder fineCell (int fineCell) {
            this.fineCell = fineCell;
            return this;
        }

        public Edge build () {
            checkState(geometry != null && geometry.length >= 4, "Edge %s needs a geometry with at least two points.", id);
            if (Double.isNaN(lengthM) || Double.isNaN(lengthProjected) || coarseCell < 0 || fineCell < 0) {
                // Derive missing values from the geometry.
                Edge provisional = new Edge(this);
                if (Double.isNaN(lengthM)) lengthM = provisional.geometricLengthMeters();
                if (Double.isNaN(lengthProjected)) lengthProjected = lengthM;
                int last = provisional.pointCount() - 1;
                double midLat = fixedDegreesToFloating(provisional.getFixedLat(0) / 2 + provisional.getFixedLat(last) / 2);
                double midLon = fixedDegreesToFloating(provisional.getFixedLon(0) / 2 + provisional.getFixedLon(last) / 2);
                if (fineCell < 0) fineCell = SpatialCells.fineCellForPoint(midLat, midLon);
                if (coarseCell < 0) coarseCell = SpatialCells.coarseParent(fineCell);
            }
            checkState(lengthM >= 0, "Edge %s has a negative length.", id);
            return new Edge(this);
        }
    }
}
