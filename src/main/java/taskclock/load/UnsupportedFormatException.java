package taskclock.load;

import taskclock.model.ValidationException;

/**
 * The source's suffix does not name a known document format.
 */
public class UnsupportedFormatException extends ValidationException {

    public UnsupportedFormatException(String source) {
        super("Task or timetable file type not supported: " + source);
    }
}
