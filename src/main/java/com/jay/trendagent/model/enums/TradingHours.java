package com.jay.trendagent.model.enums;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Venue session predicate. Connectors outside their session are skipped for the whole tick.
 */
public enum TradingHours {

    ALWAYS {
        @Override
        public boolean isOpen(Instant now) {
            return true;
        }
    },

    /** Regular US equity session, Mon-Fri 09:30-16:00 New York time. Holidays are not modelled. */
    US_EQUITY {
        @Override
        public boolean isOpen(Instant now) {
            ZonedDateTime ny = now.atZone(NEW_YORK);
            DayOfWeek day = ny.getDayOfWeek();
            if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) return false;
            LocalTime t = ny.toLocalTime();
            return !t.isBefore(US_OPEN) && t.isBefore(US_CLOSE);
        }
    };

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");
    private static final LocalTime US_OPEN = LocalTime.of(9, 30);
    private static final LocalTime US_CLOSE = LocalTime.of(16, 0);

    public abstract boolean isOpen(Instant now);
}
