package io.visitfile.parser.model;

import java.util.List;
import java.util.Objects;

/**
 * Ordered activities opened by a {@code SEQ} marker.
 */
public record Sequence(int index, List<Parameter> parameters, List<Activity> activities, int lineNumber) {

    public Sequence {
        parameters = List.copyOf(Objects.requireNonNull(parameters, "parameters"));
        activities = List.copyOf(Objects.requireNonNull(activities, "activities"));
    }

    public Sequence(int index, List<Activity> activities) {
        this(index, List.of(), activities, 0);
    }

    /**
     * Returns the activity at the given 0-based position.
     */
    public Activity activity(int position) {
        return activities.get(position);
    }
}
