package com.largomodo.zipbundle.service.zip;

import java.time.LocalDateTime;

/**
 * Packs timestamps into the 16-bit MS-DOS time and date fields used by ZIP records.
 * <p>
 * Time: bits 15-11 hour, 10-5 minute, 4-0 seconds/2.
 * Date: bits 15-9 years since 1980, 8-5 month, 4-0 day.
 * Values outside 1980..2107 are clamped to the nearest representable instant.
 */
public final class DosDateTime {

    private static final LocalDateTime MIN = LocalDateTime.of(1980, 1, 1, 0, 0, 0);
    private static final LocalDateTime MAX = LocalDateTime.of(2107, 12, 31, 23, 59, 58);

    private final int time;
    private final int date;

    private DosDateTime(int time, int date) {
        this.time = time;
        this.date = date;
    }

    public static DosDateTime of(LocalDateTime dateTime) {
        LocalDateTime t = dateTime;
        if (t.isBefore(MIN)) {
            t = MIN;
        } else if (t.isAfter(MAX)) {
            t = MAX;
        }
        int time = (t.getHour() << 11) | (t.getMinute() << 5) | (t.getSecond() >> 1);
        int date = ((t.getYear() - 1980) << 9) | (t.getMonthValue() << 5) | t.getDayOfMonth();
        return new DosDateTime(time, date);
    }

    public int time() {
        return time;
    }

    public int date() {
        return date;
    }
}
