package space.ketterling.climatetime.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Successful items plus whatever had to be skipped on the way.
 */
public record PartialResult<T>(List<T> items, List<Skipped> skipped) {

    public PartialResult {
        items = List.copyOf(items);
        skipped = List.copyOf(skipped);
    }

    @JsonIgnore
    public boolean isComplete() {
        return skipped.isEmpty();
    }
}
