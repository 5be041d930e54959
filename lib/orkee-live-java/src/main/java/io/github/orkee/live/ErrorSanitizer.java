package io.github.orkee.live;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns raw error strings from the server into short messages that are safe to show a user.
 * <p>
 * The raw string is logged at WARN for operators. The returned message has filesystem
 * paths replaced by {@value #PATH_PLACEHOLDER}, keeps only the first line, drops a leading
 * {@code "Error:"} or {@code "Failed to "}, maps well-known system error codes to a fixed
 * phrase and is at most {@value #MAX_LENGTH} characters long.
 */
public final class ErrorSanitizer {

    private static final Logger log = LoggerFactory.getLogger(ErrorSanitizer.class);

    /** longest message returned, including the truncation marker */
    public static final int MAX_LENGTH = 100;

    /** messages shorter than this are replaced by {@link #GENERIC_MESSAGE} */
    public static final int MIN_LENGTH = 5;

    /** appended to truncated messages */
    public static final String TRUNCATION_MARKER = "...";

    /** replaces every path-like substring */
    public static final String PATH_PLACEHOLDER = "[path]";

    /** returned when nothing meaningful is left */
    public static final String GENERIC_MESSAGE = "An unexpected error occurred";

    // rooted paths (unix, home, dot-relative, windows drive) or bare relative paths of two or more segments
    private static final Pattern PATH = Pattern.compile(
            "(?<![\\w.\\-/\\\\])"
                    + "(?:(?:[A-Za-z]:[\\\\/]|~/|\\.{1,2}/|/)[\\w.\\-@+]+(?:[\\\\/][\\w.\\-@+]*)*"
                    + "|[\\w.\\-@+]+(?:[\\\\/][\\w.\\-@+]+)+[\\\\/]?)");

    private static final Pattern PREFIX = Pattern.compile("^(?:error:\\s*|failed to\\s+)", Pattern.CASE_INSENSITIVE);

    private static final Map<Pattern, String> KNOWN_CODES = new LinkedHashMap<>();

    static {
        KNOWN_CODES.put(code("ENOENT"), "File or directory not found");
        KNOWN_CODES.put(code("EACCES"), "Permission denied");
        KNOWN_CODES.put(code("EADDRINUSE"), "Port is already in use");
        KNOWN_CODES.put(code("ECONNREFUSED"), "Connection refused");
        KNOWN_CODES.put(code("ENOTFOUND"), "Host not found");
        KNOWN_CODES.put(code("ETIMEDOUT"), "Operation timed out");
        KNOWN_CODES.put(code("EPERM"), "Operation not permitted");
    }

    private ErrorSanitizer() {
    }

    /**
     * Sanitizes a raw error string for display.
     *
     * @param raw the error as reported by the server, may be null
     * @return a short user-facing message, never null or empty
     */
    public static String sanitize(String raw) {
        log.warn("raw error: {}", raw);
        if (raw == null) {
            return GENERIC_MESSAGE;
        }

        String message = PATH.matcher(raw).replaceAll(PATH_PLACEHOLDER);
        message = firstLine(message).trim();
        message = PREFIX.matcher(message).replaceFirst("").trim();

        String known = knownCode(message);
        if (known != null) {
            return known;
        }

        if (message.length() > MAX_LENGTH) {
            message = message.substring(0, MAX_LENGTH - TRUNCATION_MARKER.length()).trim() + TRUNCATION_MARKER;
        }
        if (message.length() < MIN_LENGTH) {
            return GENERIC_MESSAGE;
        }
        return message;
    }

    /**
     * Returns the friendly phrase for the first known error code found in the message.
     *
     * @param message the message to scan
     * @return the mapped phrase, or null when no known code is present
     */
    static String knownCode(String message) {
        for (Map.Entry<Pattern, String> entry : KNOWN_CODES.entrySet()) {
            if (entry.getKey().matcher(message).find()) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static String firstLine(String message) {
        int end = message.indexOf('\n');
        if (end < 0) {
            return message;
        }
        String line = message.substring(0, end);
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private static Pattern code(String code) {
        return Pattern.compile("\\b" + code + "\\b");
    }
}
