package com.triprelay.extract;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ArtifactValidator unit tests
 */
class ArtifactValidatorTest {

    static final String VALID_CALENDAR = String.join("\r\n",
            "BEGIN:VCALENDAR",
            "VERSION:2.0",
            "PRODID:-//TripRelay//Test//EN",
            "BEGIN:VEVENT",
            "UID:flight-aa100@example.com",
            "DTSTAMP:20250301T100000Z",
            "DTSTART:20250310T080000Z",
            "DTEND:20250310T110000Z",
            "SUMMARY:Flight AA100 JFK-LAX",
            "END:VEVENT",
            "END:VCALENDAR",
            "");

    private final ArtifactValidator validator = new ArtifactValidator();

    @Test
    @DisplayName("Well-formed VCALENDAR is valid")
    void testValidate_Valid() {
        assertThat(validator.validate(VALID_CALENDAR)).isTrue();
    }

    @Test
    @DisplayName("LF line endings and surrounding whitespace are accepted")
    void testValidate_LineFeeds() {
        assertThat(validator.validate("\n  " + VALID_CALENDAR.replace("\r\n", "\n"))).isTrue();
    }

    @Test
    @DisplayName("Root component other than VCALENDAR is invalid")
    void testValidate_WrongRoot() {
        assertThat(validator.validate("BEGIN:VEVENT\r\nSUMMARY:x\r\nEND:VEVENT\r\n")).isFalse();
    }

    @Test
    @DisplayName("Free text and empty input are invalid, never an exception")
    void testValidate_Garbage() {
        assertThat(validator.validate("Here is your calendar!")).isFalse();
        assertThat(validator.validate("")).isFalse();
        assertThat(validator.validate(null)).isFalse();
    }

    @Test
    @DisplayName("Calendar cut off before END:VCALENDAR is invalid")
    void testValidate_Truncated() {
        String truncated = VALID_CALENDAR.substring(0, VALID_CALENDAR.indexOf("END:VEVENT"));

        assertThat(validator.validate(truncated)).isFalse();
    }
}
