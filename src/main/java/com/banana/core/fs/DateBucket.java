package com.banana.core.fs;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Objects;

/**
 * Day-of-month plus lowercase three-letter month, e.g. {@code 1sep} or {@code 24dec}.
 * <p>
 * The key has no year: the same day in different years maps to the same bucket.
 */
public final class DateBucket {
    private final String value;

    private DateBucket(String value) {
        this.value = value;
    }

    public static DateBucket of(LocalDate date) {
        Objects.requireNonNull(date, "date");
        String month = date.getMonth().name().substring(0, 3).toLowerCase(Locale.ROOT);
        return new DateBucket(date.getDayOfMonth() + month);
    }

    public static DateBucket today(Clock clock) {
        return of(LocalDate.now(clock));
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof DateBucket other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
