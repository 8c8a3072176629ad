package com.trafficlens.reporting.core.model;

import com.trafficlens.reporting.core.exception.InvalidDateRangeException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * 日期范围，起止均为包含的自然日（规范时区）
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        if (start == null || end == null) {
            throw new InvalidDateRangeException("Date range requires both start and end");
        }
        if (end.isBefore(start)) {
            throw new InvalidDateRangeException(
                    String.format("Date range end %s is before start %s", end, start));
        }
    }

    public static DateRange of(LocalDate start, LocalDate end) {
        return new DateRange(start, end);
    }

    public static DateRange parse(String start, String end) {
        try {
            return new DateRange(LocalDate.parse(start), LocalDate.parse(end));
        } catch (DateTimeParseException | NullPointerException e) {
            throw new InvalidDateRangeException(
                    String.format("Unparseable date range: start=%s, end=%s", start, end), e);
        }
    }

    public static DateRange singleDay(LocalDate day) {
        return new DateRange(day, day);
    }
}
