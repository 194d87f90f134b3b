package com.conveyal.catchment.profile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The limit on travel cost for one request: either a travel time or a travel distance, never both.
 */
public class CostBudget {

    public enum Kind {
        /** Value is in seconds. */
        TIME,
        /** Value is in meters. */
        DISTANCE;

        @JsonValue
        public String jsonName () {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Kind forName (String name) {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        }
    }

    public final Kind kind;

    public final double value;

    @JsonCreator
    public CostBudget (@JsonProperty("kind") Kind kind, @JsonProperty("value") double value) {
        checkArgument(kind != null, "Cost budget kind is required.");
        checkArgument(value > 0 && Double.isFinite(value), "Cost budget must be a positive number, was %s.", value);
        this.kind = kind;
        this.value = value;
    }

    public static CostBudget seconds (double seconds) {
        return new CostBudget(Kind.TIME, seconds);
    }

    public static CostBudget minutes (double minutes) {
        return new CostBudget(Kind.TIME, minutes * 60);
    }

    public static CostBudget meters (double meters) {
        return new CostBudget(Kind.DISTANCE, meters);
    }

    public boolean isTime () {
        return kind == Kind.TIME;
    }

    @Override
    public String toString () {
        return isTime() ? String.format("%.0f s", value) : String.format("%.0f m", value);
    }
}
