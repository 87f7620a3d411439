package com.streamhistory.insights;

import java.time.DayOfWeek;
import java.time.Month;
import java.time.ZoneOffset;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Calendar labels used by the breakdowns. All bucketing happens in UTC.
 */
final class Calendars {
    static final ZoneOffset ZONE = ZoneOffset.UTC;

    static final String WINTER = "Winter";
    static final String SPRING = "Spring";
    static final String SUMMER = "Summer";
    static final String FALL = "Fall";

    private Calendars() {}

    static String season(Month month) {
        return switch (month) {
            case DECEMBER, JANUARY, FEBRUARY -> WINTER;
            case MARCH, APRIL, MAY -> SPRING;
            case JUNE, JULY, AUGUST -> SUMMER;
            default -> FALL;
        };
    }

    static String monthName(Month month) {
        return month.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    static String weekdayName(DayOfWeek day) {
        return day.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }
}
