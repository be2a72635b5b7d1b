package taskclock.trigger;

import com.cronutils.model.Cron;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * One evaluable cron schedule built from a decoded expression.
 *
 * Missing seconds default to {@code 0} and a missing year to {@code *}, so a
 * classic 5-token expression fires at second zero of each matching minute.
 * Day-of-week numbers run from 0 (Monday) to 6 (Sunday); names such as
 * {@code MON-FRI} are accepted as well.
 */
public final class CronSchedule {

    private static final CronDefinition DEFINITION = CronDefinitionBuilder.defineCron()
            .withSeconds().withValidRange(0, 59).and()
            .withMinutes().withValidRange(0, 59).and()
            .withHours().withValidRange(0, 23).and()
            .withDayOfMonth().supportsL().supportsW().supportsLW().supportsQuestionMark().withValidRange(1, 31).and()
            .withMonth().withValidRange(1, 12).and()
            .withDayOfWeek().withMondayDoWValue(0).supportsHash().supportsL().supportsQuestionMark()
            .withValidRange(0, 6).and()
            .withYear().withValidRange(1970, 2099).and()
            .instance();

    private static final CronParser PARSER = new CronParser(DEFINITION);

    private final String source;
    private final String expression;
    private final ExecutionTime executionTime;
    private final ZoneId zone;

    private CronSchedule(String source, String expression, ExecutionTime executionTime, ZoneId zone) {
        this.source = source;
        this.expression = expression;
        this.executionTime = executionTime;
        this.zone = zone;
    }

    /**
     * Decode and compile an expression.
     *
     * @throws InvalidTriggerSyntaxException if the token count is wrong or a
     *                                       field is out of range
     */
    public static CronSchedule parse(String source, ZoneId zone) {
        CronFields fields = CronDecoder.decode(source);
        String expression = String.join(" ",
                fields.second() != null ? fields.second() : "0",
                fields.minute(),
                fields.hour(),
                fields.day(),
                fields.month(),
                fields.dayOfWeek(),
                fields.year() != null ? fields.year() : "*");
        try {
            Cron cron = PARSER.parse(expression);
            return new CronSchedule(source, expression, ExecutionTime.forCron(cron), Objects.requireNonNull(zone));
        } catch (IllegalArgumentException e) {
            throw new InvalidTriggerSyntaxException(source, e);
        }
    }

    /**
     * First fire time strictly after the given instant, if any remains.
     */
    public Optional<Instant> nextAfter(Instant instant) {
        ZonedDateTime from = ZonedDateTime.ofInstant(instant, zone);
        return executionTime.nextExecution(from).map(ZonedDateTime::toInstant);
    }

    /** Expression as written in the document. */
    public String source() {
        return source;
    }

    /** Normalized 7-field expression handed to the evaluator. */
    public String expression() {
        return expression;
    }

    public ZoneId zone() {
        return zone;
    }

    @Override
    public String toString() {
        return "CronSchedule{" + expression + " @" + zone + "}";
    }
}
