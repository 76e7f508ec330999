package com.photobooth.common.util;

/**
 * Constants shared by the booking engine modules.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String BOOKINGS_KEY = "pb_bookings_v1";

    public static final int DEFAULT_DURATION_MINUTES = 30;
    public static final int MIN_LEAD_MINUTES = 10;
    public static final int MAX_ADVANCE_DAYS = 730;

    public static final int MIN_DURATION_MINUTES = 5;
    public static final int MAX_DURATION_MINUTES = 1440;
    public static final int MAX_GUESTS = 1000;
    public static final int MAX_NOTES_LENGTH = 2000;

    public static final int MONEY_SCALE = 2;
}
