package com.conveyal.catchment.analyst.scenario;

import com.conveyal.catchment.analyst.error.InvalidScenarioException;
import com.conveyal.catchment.profile.StreetMode;
import com.conveyal.catchment.streets.SubNetworkBuilder;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An ordered list of edge edits applied non-destructively on top of the base network for one request. Overlays are
 * never written back into the network store.
 *
 * When several edits concern the same edge id, the last one wins. Applying an overlay first removes every edge that
 * is deleted or replaced, then appends the new versions of added and modified edges that the mode may use.
 */
public class ScenarioOverlay {

    private static final Logger LOG = LoggerFactory.getLogger(ScenarioOverlay.class);

    public final String id;

    public final String description;

    public final List<EdgeEdit> edits;

    @JsonCreator
    public ScenarioOverlay (@JsonProperty("id") String id,
                            @JsonProperty("description") String description,
                            @JsonProperty("edits") List<EdgeEdit> edits) {
        this.id = id;
        this.description = description == null ? "no description provided" : description;
        this.edits = edits == null ? Collections.emptyList() : List.copyOf(edits);
    }

    public ScenarioOverlay (String id, List<EdgeEdit> edits) {
        this(id, null, edits);
    }

    /**
     * Check every edit and collapse the list to the final edit for each edge id, keeping the order in which each id
     * was last edited.
     * @throws InvalidScenarioException listing every invalid edit, if there are any.
     */
    public Collection<EdgeEdit> resolve () {
        List<String> errors = new ArrayList<>();
        Map<Long, EdgeEdit> finalEdits = new LinkedHashMap<>();
        for (int i = 0; i < edits.size(); i++) {
            EdgeEdit edit = edits.get(i);
            if (edit == null) {
                errors.add(String.format("edit %d is empty", i));
                continue;
            }
            for (String error : edit.validate()) {
                errors.add(String.format("edit %d: %s", i, error));
            }
            // Remove first so that re-inserting moves the id to the end of the iteration order.
            finalEdits.remove(edit.edgeId);
            finalEdits.put(edit.edgeId, edit);
        }
        if (!errors.isEmpty()) {
            throw new InvalidScenarioException(id, errors);
        }
        return finalEdits.values();
    }

    /** Apply this overlay to a sub-network under construction for the given mode. */
    public void applyTo (SubNetworkBuilder builder, StreetMode mode) {
        Collection<EdgeEdit> finalEdits = resolve();
        LOG.info("Applying scenario {} ({} edits on {} edges)", id, edits.size(), finalEdits.size());
        int removed = 0;
        for (EdgeEdit edit : finalEdits) {
            if (builder.delete(edit.edgeId)) {
                removed++;
            } else if (edit.type != EditType.ADD) {
                LOG.debug("Edge {} targeted by {} is not in this sub-network.", edit.edgeId, edit.type);
            }
        }
        int appended = 0;
        for (EdgeEdit edit : finalEdits) {
            if (edit.type == EditType.DELETE) continue;
            if (mode.allows(edit.edge.streetClass)) {
                builder.add(edit.edge);
                appended++;
            }
        }
        LOG.debug("Scenario {} removed {} edges and appended {}.", id, removed, appended);
    }
}
