package taskclock.load;

import taskclock.model.ValidationException;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts fenced metadata blocks embedded in script comments:
 *
 * <pre>
 * # /// task
 * # cron = "*&#47;5 * * * *"
 * # ///
 * </pre>
 *
 * Both {@code #} and {@code //} comment markers are recognized; a block must use
 * one marker throughout.
 */
public final class ScriptMetadataReader {

    private static final Pattern BLOCK = Pattern.compile(
            "(?m)^(?<prefix>#|//) /// (?<type>[a-zA-Z0-9-]+)$\\s(?<content>(^\\k<prefix>(| .*)$\\s)+)^\\k<prefix> ///$");

    private ScriptMetadataReader() {
    }

    /**
     * Content of the block of the given type with comment markers stripped.
     *
     * @return empty when the script has no such block
     * @throws ValidationException when more than one block of the type exists
     */
    public static Optional<String> read(String type, String script) {
        String text = script.replace("\r\n", "\n");
        Matcher matcher = BLOCK.matcher(text);
        String found = null;
        while (matcher.find()) {
            if (!type.equals(matcher.group("type"))) {
                continue;
            }
            if (found != null) {
                throw new ValidationException("Multiple '" + type + "' blocks found");
            }
            found = strip(matcher.group("prefix"), matcher.group("content"));
        }
        return Optional.ofNullable(found);
    }

    private static String strip(String prefix, String content) {
        StringBuilder out = new StringBuilder();
        for (String line : content.split("\n")) {
            String rest = line.substring(prefix.length());
            if (rest.startsWith(" ")) {
                rest = rest.substring(1);
            }
            out.append(rest).append('\n');
        }
        return out.toString();
    }
}
