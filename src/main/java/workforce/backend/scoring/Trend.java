package workforce.backend.scoring;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Direction of an employee's score over the last two 30-day windows.
 */
public enum Trend {
    IMPROVING,
    DECLINING,
    STABLE,
    INSUFFICIENT_DATA;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
