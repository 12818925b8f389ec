package org.hcpdata.extractor.engagement.util;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.hcpdata.extractor.engagement.exception.DateFormatException;

/**
 * Calendar date handling shared by every source: parsing raw date cells, year-month labels and the retention window.
 * Dates are plain calendar dates; no time zone conversion happens here.
 */
public final class DateEngine {

    // Month-first for slash dates, matching the exports
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE,
        DateTimeFormatter.ofPattern("uuuu/MM/dd").withResolverStyle(ResolverStyle.STRICT),
        DateTimeFormatter.BASIC_ISO_DATE,
        DateTimeFormatter.ofPattern("M/d/uuuu").withResolverStyle(ResolverStyle.STRICT)
    );

    // A date followed by a time of day, which is discarded
    private static final Pattern DATE_TIME_PATTERN = Pattern.compile("^(\\S+)[T ]\\d{1,2}:\\d{2}(?::\\d{2}(?:\\.\\d{1,9})?)?$");

    private DateEngine() {
    }

    /**
     * Parses a raw date cell.
     *
     * @param rawValue the cell value
     * @return the calendar date
     * @throws DateFormatException if the value is blank or matches no accepted format
     */
    public static LocalDate parseDate(String rawValue) throws DateFormatException {
        if (StringUtils.isBlank(rawValue)) {
            throw new DateFormatException(rawValue);
        }
        String value = rawValue.trim();
        Matcher matcher = DATE_TIME_PATTERN.matcher(value);
        String datePart = matcher.matches() ? matcher.group(1) : value;

        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(datePart, format);
            } catch (DateTimeParseException e) {
                // fall through to the next format
            }
        }
        throw new DateFormatException(rawValue);
    }

    public static String toYrmo(LocalDate date) {
        return date.format(Constants.YRMO_FORMAT);
    }

    /**
     * First retained day: the first of the reference month, moved back {@code monthsToRetain} months.
     *
     * @param monthsToRetain whole months to keep before the reference month
     * @param referenceDate  date the run started
     * @return the inclusive cutoff date
     */
    public static LocalDate retentionCutoff(int monthsToRetain, LocalDate referenceDate) {
        if (monthsToRetain < 0) {
            throw new IllegalArgumentException("monthsToRetain must not be negative, was " + monthsToRetain);
        }
        return referenceDate.withDayOfMonth(1).minusMonths(monthsToRetain);
    }

    /**
     * Whether a date is inside the retention window. The lower bound is inclusive and there is no upper bound.
     */
    public static boolean withinRetention(LocalDate date, int monthsToRetain, LocalDate referenceDate) {
        return !date.isBefore(retentionCutoff(monthsToRetain, referenceDate));
    }
}
