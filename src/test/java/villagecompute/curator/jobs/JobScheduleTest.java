package villagecompute.curator.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import villagecompute.curator.exceptions.ValidationException;

class JobScheduleTest {

    // Wednesday
    private static final Instant NOW = Instant.parse("2024-01-03T12:07:30Z");

    @Test
    void testWeeklyCron_nextSundayMidnightUtc() {
        JobSchedule schedule = JobSchedule.parse("0 0 * * 0");

        assertFalse(schedule.isOneTime());
        assertEquals(Instant.parse("2024-01-07T00:00:00Z"), schedule.nextRunAfter(NOW).orElseThrow());
    }

    @Test
    void testQuarterHourCron_nextBoundary() {
        assertEquals(Instant.parse("2024-01-03T12:15:00Z"),
                JobSchedule.parse("*/15 * * * *").nextRunAfter(NOW).orElseThrow());
    }

    @Test
    void testCron_nextRunIsStrictlyAfterNow() {
        Instant onBoundary = Instant.parse("2024-01-03T12:15:00Z");

        assertEquals(Instant.parse("2024-01-03T12:30:00Z"),
                JobSchedule.parse("*/15 * * * *").nextRunAfter(onBoundary).orElseThrow());
    }

    @Test
    void testIsoTimestamp_isOneTime() {
        JobSchedule schedule = JobSchedule.parse("2024-02-01T09:30:00Z");

        assertTrue(schedule.isOneTime());
        assertEquals(Instant.parse("2024-02-01T09:30:00Z"), schedule.nextRunAfter(NOW).orElseThrow());
    }

    @Test
    void testIsoTimestamp_withOffset() {
        assertEquals(Instant.parse("2024-02-01T07:30:00Z"),
                JobSchedule.parse("2024-02-01T09:30:00+02:00").nextRunAfter(NOW).orElseThrow());
    }

    @Test
    void testIsoTimestamp_withoutOffset_readAsUtc() {
        assertEquals(Instant.parse("2024-02-01T09:30:00Z"),
                JobSchedule.parse("2024-02-01T09:30:00").nextRunAfter(NOW).orElseThrow());
    }

    @Test
    void testIsoTimestamp_minutePrecision() {
        JobSchedule schedule = JobSchedule.parse("2026-01-01T09:00Z");

        assertTrue(schedule.isOneTime());
        assertEquals(Instant.parse("2026-01-01T09:00:00Z"), schedule.nextRunAfter(NOW).orElseThrow());
        assertEquals(Instant.parse("2026-01-01T09:00:00Z"),
                JobSchedule.parse("2026-01-01T09:00").nextRunAfter(NOW).orElseThrow());
    }

    @Test
    void testIsoTimestamp_inPast_stillReturned() {
        Instant past = Instant.parse("2023-12-31T00:00:00Z");

        assertEquals(past, JobSchedule.parse("2023-12-31T00:00:00Z").nextRunAfter(NOW).orElseThrow());
    }

    @Test
    void testIsIsoTimestamp() {
        assertTrue(JobSchedule.isIsoTimestamp("2024-02-01T09:30:00Z"));
        assertTrue(JobSchedule.isIsoTimestamp(" 2024-02-01T09:30:00.123+01:00 "));
        assertTrue(JobSchedule.isIsoTimestamp("2024-02-01T09:30Z"));
        assertFalse(JobSchedule.isIsoTimestamp("0 0 * * 0"));
        assertFalse(JobSchedule.isIsoTimestamp("2024-02-01"));
        assertFalse(JobSchedule.isIsoTimestamp(null));
    }

    @Test
    void testParse_invalidCron_throwsValidation() {
        assertThrows(ValidationException.class, () -> JobSchedule.parse("not a cron"));
        assertThrows(ValidationException.class, () -> JobSchedule.parse("61 * * * *"));
    }

    @Test
    void testParse_sixFieldCron_rejected() {
        assertThrows(ValidationException.class, () -> JobSchedule.parse("0 0 0 * * ?"));
    }

    @Test
    void testParse_blank_throwsValidation() {
        assertThrows(ValidationException.class, () -> JobSchedule.parse(null));
        assertThrows(ValidationException.class, () -> JobSchedule.parse("   "));
    }

    @Test
    void testParse_malformedTimestamp_throwsValidation() {
        assertThrows(ValidationException.class, () -> JobSchedule.parse("2024-13-45T99:00:00Z"));
    }

    @Test
    void testNextRunAtOrNull() {
        assertEquals(Instant.parse("2024-01-03T13:00:00Z"), JobSchedule.nextRunAtOrNull("0 * * * *", NOW));
        assertNull(JobSchedule.nextRunAtOrNull("bogus", NOW));
        assertNull(JobSchedule.nextRunAtOrNull(null, NOW));
    }
}
