package com.punchclock.backend.modules.attendance.application;

import java.time.DateTimeException;
import java.time.ZoneId;

import com.punchclock.backend.global.error.ProblemException;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Zone used for day and month boundaries when a caller does not pass one.
 */
@Component
public class AttendanceZones {

    private final ZoneId defaultZone;

    public AttendanceZones(@Value("${app.attendance.default-zone:UTC}") String defaultZone) {
        this.defaultZone = ZoneId.of(defaultZone.trim());
    }

    public ZoneId resolve(ZoneId requested) {
        return requested != null ? requested : defaultZone;
    }

    /**
     * Parses a caller-supplied zone id; blank means "use the default".
     */
    public static ZoneId parse(String zone) {
        if (zone == null || zone.isBlank()) {
            return null;
        }
        try {
            return ZoneId.of(zone.trim());
        } catch (DateTimeException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_ZONE", "unknown zone id '" + zone + "'");
        }
    }
}
