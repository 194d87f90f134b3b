package com.conveyal.catchment.analyst.scenario;

import com.conveyal.catchment.streets.Edge;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * One edit in a scenario overlay. Deletions identify the edge by id. Additions and modifications carry the complete
 * new edge, whose id is the id being added or replaced.
 */
public class EdgeEdit {

    public final EditType type;

    /** Id of the edge to delete. For additions and modifications this is taken from the edge. */
    public final long edgeId;

    /** The new version of the edge, null for deletions. */
    public final Edge edge;

    @JsonCreator
    public EdgeEdit (@JsonProperty("type") EditType type,
                     @JsonProperty("edgeId") Long edgeId,
                     @JsonProperty("edge") Edge edge) {
        this.type = type;
        this.edge = edge;
        if (edgeId != null) {
            this.edgeId = edgeId;
        } else {
            this.edgeId = edge == null ? 0 : edge.id;
        }
    }

    public static EdgeEdit add (Edge edge) {
        return new EdgeEdit(EditType.ADD, edge.id, edge);
    }

    public static EdgeEdit modify (Edge edge) {
        return new EdgeEdit(EditType.MODIFY, edge.id, edge);
    }

    public static EdgeEdit delete (long edgeId) {
        return new EdgeEdit(EditType.DELETE, edgeId, null);
    }

    /** @return human readable descriptions of everything wrong with this edit, empty if it can be applied. */
    public List<String> validate () {
        List<String> errors = new ArrayList<>();
        if (type == null) {
            errors.add("edit has no type");
            return errors;
        }
        if (edgeId < 0) {
            errors.add(String.format("%s of edge %d: negative ids are reserved for origin connectors", type, edgeId));
        }
        if (type == EditType.DELETE) {
            if (edge != null) {
                errors.add(String.format("delete of edge %d should not carry an edge", edgeId));
            }
        } else if (edge == null) {
            errors.add(String.format("%s of edge %d is missing the new edge", type, edgeId));
        } else if (edge.id != edgeId) {
            errors.add(String.format("%s of edge %d carries an edge with id %d", type, edgeId, edge.id));
        }
        return errors;
    }

    @Override
    public String toString () {
        return type + " " + edgeId;
    }
}
