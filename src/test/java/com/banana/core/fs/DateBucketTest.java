package com.banana.core.fs;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DateBucketTest {

    @Test
    void usesDayAndLowercaseMonth() {
        assertEquals("1sep", DateBucket.of(LocalDate.of(2025, 9, 1)).value());
        assertEquals("24dec", DateBucket.of(LocalDate.of(2024, 12, 24)).value());
    }

    @Test
    void ignoresTheYear() {
        assertEquals(DateBucket.of(LocalDate.of(2024, 3, 5)), DateBucket.of(LocalDate.of(2025, 3, 5)));
    }

    @Test
    void followsTheClockZone() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-31T23:30:00Z"), ZoneOffset.ofHours(2));

        assertEquals("1feb", DateBucket.today(clock).value());
    }
}
