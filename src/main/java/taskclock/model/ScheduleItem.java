package taskclock.model;

import taskclock.trigger.CronDecoder;
import taskclock.trigger.CronFields;

import java.util.regex.Pattern;

/**
 * A raw trigger expression as written in a timetable.
 *
 * Construction only checks the rough shape (5 to 7 groups of cron tokens).
 * Field ranges are validated when the expression is decoded or evaluated.
 */
public record ScheduleItem(String cron) {

    private static final Pattern CRONTAB_SHAPE =
            Pattern.compile("^\\s*[\\w*?/,#-]+(\\s+[\\w*?/,#-]+){4,6}\\s*$");

    public ScheduleItem {
        if (cron == null || !CRONTAB_SHAPE.matcher(cron).matches()) {
            throw new ValidationException("Invalid crontab syntax: " + cron);
        }
    }

    public CronFields crontab() {
        return CronDecoder.decode(cron);
    }
}
