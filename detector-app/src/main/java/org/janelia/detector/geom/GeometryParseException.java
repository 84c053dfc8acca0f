package org.janelia.detector.geom;

/**
 * Thrown when geometry text is malformed or omits a required attribute.
 */
public class GeometryParseException
        extends IllegalArgumentException {

    private final Integer lineNumber;
    private final String key;

    public GeometryParseException(final String message,
                                  final Integer lineNumber,
                                  final String key) {
        this(message, lineNumber, key, null);
    }

    public GeometryParseException(final String message,
                                  final Integer lineNumber,
                                  final String key,
                                  final Throwable cause) {
        super(buildMessage(message, lineNumber, key), cause);
        this.lineNumber = lineNumber;
        this.key = key;
    }

    /**
     * @return one-based line number of the offending line, or null if the problem is not tied to one line.
     */
    public Integer getLineNumber() {
        return lineNumber;
    }

    /**
     * @return the offending key, or null if the problem is not tied to one key.
     */
    public String getKey() {
        return key;
    }

    private static String buildMessage(final String message,
                                       final Integer lineNumber,
                                       final String key) {
        final StringBuilder sb = new StringBuilder(message);
        if (lineNumber != null) {
            sb.append(" (line ").append(lineNumber);
            if (key != null) {
                sb.append(", key '").append(key).append("'");
            }
            sb.append(")");
        } else if (key != null) {
            sb.append(" (key '").append(key).append("')");
        }
        return sb.toString();
    }
}
