package net.javahippie.workoutlog.util;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Comma-separated value encoding.
 */
public final class CsvFormatter {

    public static final String DELIMITER = ",";
    public static final String LINE_SEPARATOR = "\n";

    private CsvFormatter() {
    }

    /**
     * Quotes a field containing the delimiter, a quote or a line break, doubling inner quotes.
     *
     * @param field the raw value, may be null
     * @return the encoded field, empty for null
     */
    public static String escape(String field) {
        if (field == null) {
            return "";
        }
        if (field.contains(DELIMITER) || field.contains("\"") || field.contains("\n") || field.contains("\r")) {
            return "\"" + field.replace("\"", "\"\"") + "\"";
        }
        return field;
    }

    /**
     * Encodes one line, terminated by {@link #LINE_SEPARATOR}.
     */
    public static String row(List<String> fields) {
        return fields.stream()
                .map(CsvFormatter::escape)
                .collect(Collectors.joining(DELIMITER)) + LINE_SEPARATOR;
    }
}
