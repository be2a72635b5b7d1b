package taskclock.trigger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decoded extended crontab expression. Every field is nullable:
 * {@code second} and {@code year} are absent for the short forms.
 */
public record CronFields(
        String second,
        String minute,
        String hour,
        String day,
        String month,
        String dayOfWeek,
        String year) {

    /**
     * Field map keyed the way trigger arguments are named, in field order.
     */
    public Map<String, String> toMap() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("second", second);
        map.put("minute", minute);
        map.put("hour", hour);
        map.put("day", day);
        map.put("month", month);
        map.put("day_of_week", dayOfWeek);
        map.put("year", year);
        return map;
    }
}
