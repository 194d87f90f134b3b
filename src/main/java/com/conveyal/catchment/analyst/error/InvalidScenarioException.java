package com.conveyal.catchment.analyst.error;

import java.util.Collection;
import java.util.List;

/**
 * A scenario overlay could not be found or contains edits that cannot be applied. All problems found while
 * resolving the overlay are reported together.
 */
public class InvalidScenarioException extends CatchmentAreaException {

    public final String scenarioId;

    public final List<String> errors;

    public InvalidScenarioException (String scenarioId, Collection<String> errors) {
        super(Type.INVALID_SCENARIO, String.format("Scenario %s is invalid: %s", scenarioId, String.join("; ", errors)));
        this.scenarioId = scenarioId;
        this.errors = List.copyOf(errors);
    }

}
