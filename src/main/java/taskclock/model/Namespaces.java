package taskclock.model;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives namespace identifiers for timetables that do not declare one.
 *
 * The same host, user and source always yield the same identifier, so jobs
 * written by an earlier process are found again after a restart.
 */
public final class Namespaces {

    static final String GLOBAL_RESOURCE = "global";

    private Namespaces() {
    }

    /**
     * Namespace for a timetable loaded from {@code source} by this process.
     *
     * @param source path or URL of the timetable, or null for none
     */
    public static String forSource(String source) {
        return derive(hostname(), System.getProperty("user.name", "unknown"), resource(source));
    }

    /**
     * Pure derivation: hex MD5 of {@code hostname-username-resource}.
     */
    public static String derive(String hostname, String username, String resource) {
        String value = hostname + "-" + username + "-" + resource;
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md5.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    /**
     * Absolute path when the source names an existing file, the source string otherwise.
     */
    static String resource(String source) {
        if (source == null || source.isBlank()) {
            return GLOBAL_RESOURCE;
        }
        try {
            Path path = Path.of(source);
            if (Files.exists(path)) {
                return path.toAbsolutePath().normalize().toString();
            }
        } catch (InvalidPathException e) {
            // URLs and other non-path sources are used verbatim
        }
        return source;
    }

    private static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String env = System.getenv("HOSTNAME");
            return env != null && !env.isBlank() ? env : "localhost";
        }
    }
}
