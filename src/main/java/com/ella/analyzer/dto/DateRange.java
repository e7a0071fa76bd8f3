package com.ella.analyzer.dto;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("start and end are required");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end must not be before start");
        }
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(start) && !date.isAfter(end);
    }

    public long lengthInDays() {
        return ChronoUnit.DAYS.between(start, end);
    }

    /**
     * Interseção entre dois intervalos, ou null quando não se sobrepõem.
     */
    public DateRange intersect(DateRange other) {
        if (other == null) {
            return null;
        }
        LocalDate s = start.isAfter(other.start) ? start : other.start;
        LocalDate e = end.isBefore(other.end) ? end : other.end;
        return s.isAfter(e) ? null : new DateRange(s, e);
    }
}
