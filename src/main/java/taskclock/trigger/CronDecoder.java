package taskclock.trigger;

/**
 * Decodes extended crontab expressions, including sub-minute resolution and
 * year constraints.
 *
 * <pre>
 * 5 tokens: minute hour day month day_of_week
 * 6 tokens: second minute hour day month day_of_week
 * 7 tokens: second minute hour day month day_of_week year
 * </pre>
 *
 * The token count is the only disambiguator. A 5-token expression is always
 * the classic form, even when one of its fields looks like a year.
 */
public final class CronDecoder {

    private CronDecoder() {
    }

    public static CronFields decode(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidTriggerSyntaxException(expression);
        }

        String[] tokens = expression.trim().split("\\s+");
        return switch (tokens.length) {
            case 5 -> new CronFields(null, tokens[0], tokens[1], tokens[2], tokens[3], tokens[4], null);
            case 6 -> new CronFields(tokens[0], tokens[1], tokens[2], tokens[3], tokens[4], tokens[5], null);
            case 7 -> new CronFields(tokens[0], tokens[1], tokens[2], tokens[3], tokens[4], tokens[5], tokens[6]);
            default -> throw new InvalidTriggerSyntaxException(expression);
        };
    }
}
