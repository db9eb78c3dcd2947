package io.github.drompincen.clarity.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Recall outcome fed to the scheduler, ordered from worst to best.
 */
public enum RecallRating {
    FORGOT("forgot", 1),
    HARD("hard", 2),
    GOOD("good", 3),
    EASY("easy", 4);

    private final String value;
    private final int grade;

    RecallRating(String value, int grade) {
        this.value = value;
        this.grade = grade;
    }

    @JsonValue
    public String value() { return value; }

    /** FSRS grade, 1 (again) to 4 (easy). */
    public int grade() { return grade; }

    @JsonCreator
    public static RecallRating fromValue(String value) {
        if (value != null) {
            for (RecallRating rating : values()) {
                if (rating.value.equalsIgnoreCase(value.trim())) return rating;
            }
        }
        throw new IllegalArgumentException("Unknown recall rating: " + value);
    }
}
