package com.triprelay.extract;

import lombok.extern.slf4j.Slf4j;
import net.fortuna.ical4j.data.CalendarBuilder;
import net.fortuna.ical4j.data.ParserException;
import net.fortuna.ical4j.model.Calendar;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;

/**
 * Syntactic check of a generated iCalendar payload (RFC 5545 via ical4j).
 * Never throws: any parse problem means "invalid".
 */
@Slf4j
@Component
public class ArtifactValidator {

    public boolean validate(String calendarText) {
        if (calendarText == null || calendarText.isBlank()) {
            return false;
        }
        try {
            Calendar calendar = new CalendarBuilder().build(new StringReader(calendarText.strip()));
            if (calendar == null) {
                return false;
            }
            log.debug("Calendar parsed: {} component(s)", calendar.getComponents().size());
            return true;
        } catch (ParserException e) {
            log.warn("Calendar validation failed at line {}: {}", e.getLineNo(), e.getMessage());
            return false;
        } catch (IOException | RuntimeException e) {
            log.warn("Calendar validation failed: {}", e.getMessage());
            return false;
        }
    }
}
