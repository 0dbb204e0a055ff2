package ai.lawdiff.align;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Externally supplied pairing that forces old article {@code oldNumber} onto new article {@code newNumber}.
 */
public record ManualMatch(int oldNumber, int newNumber) {

    @JsonCreator
    public ManualMatch(@JsonProperty(value = "old_number", required = true) int oldNumber,
                       @JsonProperty(value = "new_number", required = true) int newNumber) {
        this.oldNumber = oldNumber;
        this.newNumber = newNumber;
    }
}
