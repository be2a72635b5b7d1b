package taskclock.trigger;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JobTriggerTest {

    private static final ZoneId UTC = ZoneOffset.UTC;

    @Test
    void classicFormFiresAtSecondZero() {
        CronSchedule schedule = CronSchedule.parse("*/5 * * * *", UTC);

        Optional<Instant> next = schedule.nextAfter(Instant.parse("2030-01-01T00:01:30Z"));

        assertEquals(Optional.of(Instant.parse("2030-01-01T00:05:00Z")), next);
        assertEquals("0 */5 * * * * *", schedule.expression());
        assertEquals("*/5 * * * *", schedule.source());
    }

    @Test
    void secondsFormFiresBelowOneMinute() {
        CronSchedule schedule = CronSchedule.parse("*/5 * * * * * *", UTC);

        assertEquals(Optional.of(Instant.parse("2030-01-01T00:00:05Z")),
                schedule.nextAfter(Instant.parse("2030-01-01T00:00:00Z")));
    }

    @Test
    void nextFireTimeIsStrictlyAfter() {
        CronSchedule schedule = CronSchedule.parse("0 2 * * *", UTC);
        Instant slot = Instant.parse("2030-03-01T02:00:00Z");

        assertEquals(Optional.of(Instant.parse("2030-03-02T02:00:00Z")), schedule.nextAfter(slot));
    }

    @Test
    void dayOfWeekZeroIsMonday() {
        // 2030-01-01 is a Tuesday
        Instant tuesday = Instant.parse("2030-01-01T00:00:00Z");

        assertEquals(Optional.of(Instant.parse("2030-01-07T00:00:00Z")),
                CronSchedule.parse("0 0 * * 0", UTC).nextAfter(tuesday));
        assertEquals(Optional.of(Instant.parse("2030-01-06T00:00:00Z")),
                CronSchedule.parse("0 0 * * 6", UTC).nextAfter(tuesday));
    }

    @Test
    void dayOfWeekSevenIsOutOfRange() {
        assertThrows(InvalidTriggerSyntaxException.class, () -> CronSchedule.parse("0 0 * * 7", UTC));
    }

    @Test
    void weekdayRangeSkipsWeekend() {
        CronSchedule schedule = CronSchedule.parse("30 14 * * 0-4", UTC);
        // Friday after the slot -> next Monday
        Instant friday = Instant.parse("2030-01-04T15:00:00Z");

        assertEquals(Optional.of(Instant.parse("2030-01-07T14:30:00Z")), schedule.nextAfter(friday));
    }

    @Test
    void dayNamesMatchNumbers() {
        Instant friday = Instant.parse("2030-01-04T15:00:00Z");

        assertEquals(CronSchedule.parse("30 14 * * 0-4", UTC).nextAfter(friday),
                CronSchedule.parse("30 14 * * MON-FRI", UTC).nextAfter(friday));
    }

    @Test
    void dayOfMonthAndDayOfWeekMustBothMatch() {
        // first Friday the 13th after 2030-01-01
        assertEquals(Optional.of(Instant.parse("2030-09-13T00:00:00Z")),
                CronSchedule.parse("0 0 13 * 4", UTC).nextAfter(Instant.parse("2030-01-01T00:00:00Z")));
    }

    @Test
    void pastYearIsExhausted() {
        CronSchedule schedule = CronSchedule.parse("0 0 0 1 1 * 2020", UTC);

        assertTrue(schedule.nextAfter(Instant.parse("2025-01-01T00:00:00Z")).isEmpty());
    }

    @Test
    void evaluatesInConfiguredZone() {
        ZoneId berlin = ZoneId.of("Europe/Berlin");
        CronSchedule schedule = CronSchedule.parse("0 9 * * *", berlin);

        Instant next = schedule.nextAfter(Instant.parse("2030-06-01T00:00:00Z")).orElseThrow();

        assertEquals(ZonedDateTime.of(2030, 6, 1, 9, 0, 0, 0, berlin).toInstant(), next);
    }

    @Test
    void outOfRangeFieldIsInvalid() {
        InvalidTriggerSyntaxException e = assertThrows(InvalidTriggerSyntaxException.class,
                () -> CronSchedule.parse("0 25 * * *", UTC));
        assertEquals("Invalid crontab syntax: 0 25 * * *", e.getMessage());
    }

    @Test
    void combinedTriggerTakesEarliestSchedule() {
        JobTrigger trigger = JobTrigger.of(List.of("0 2 * * *", "30 14 * * *"), UTC);

        assertEquals(Optional.of(Instant.parse("2030-01-01T14:30:00Z")),
                trigger.nextFireTime(Instant.parse("2030-01-01T03:00:00Z")));
        assertEquals(Optional.of(Instant.parse("2030-01-02T02:00:00Z")),
                trigger.nextFireTime(Instant.parse("2030-01-01T15:00:00Z")));
    }

    @Test
    void combinedTriggerIsExhaustedWhenAllSchedulesAre() {
        JobTrigger trigger = JobTrigger.of(List.of("0 0 0 1 1 * 2020", "0 0 0 1 1 * 2021"), UTC);

        assertTrue(trigger.nextFireTime(Instant.parse("2024-01-01T00:00:00Z")).isEmpty());
    }

    @Test
    void runTimesListsMissedSlotsOldestFirst() {
        JobTrigger trigger = JobTrigger.of(List.of("*/5 * * * * * *"), UTC);
        Instant first = Instant.parse("2030-01-01T00:00:05Z");

        List<Instant> times = trigger.runTimes(first, Instant.parse("2030-01-01T00:00:20Z"), 100);

        assertEquals(List.of(
                Instant.parse("2030-01-01T00:00:05Z"),
                Instant.parse("2030-01-01T00:00:10Z"),
                Instant.parse("2030-01-01T00:00:15Z"),
                Instant.parse("2030-01-01T00:00:20Z")), times);
    }

    @Test
    void runTimesHonorsLimit() {
        JobTrigger trigger = JobTrigger.of(List.of("* * * * * * *"), UTC);
        Instant first = Instant.parse("2030-01-01T00:00:00Z");

        assertEquals(3, trigger.runTimes(first, first.plusSeconds(60), 3).size());
    }

    @Test
    void requiresAnExpression() {
        assertThrows(IllegalArgumentException.class, () -> JobTrigger.of(List.of(), UTC));
    }

    @Test
    void equalityFollowsExpressionsAndZone() {
        assertEquals(JobTrigger.of(List.of("0 2 * * *"), UTC), JobTrigger.of(List.of("0 2 * * *"), UTC));
        assertNotEquals(JobTrigger.of(List.of("0 2 * * *"), UTC),
                JobTrigger.of(List.of("0 2 * * *"), ZoneId.of("Europe/Berlin")));
        assertEquals(List.of("0 2 * * *"), JobTrigger.of(List.of("0 2 * * *"), UTC).expressions());
    }
}
