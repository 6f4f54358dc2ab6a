package io.entityforge.store;

import org.springframework.dao.DuplicateKeyException;

import java.util.Comparator;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps unique-violation messages back to index columns.
 * Understands PostgreSQL and H2 message formats.
 */
final class ConstraintViolations {

    private static final Pattern PG_DETAIL = Pattern.compile("Key \\(([^)]+)\\)=\\((.*?)\\) already exists");
    private static final Pattern H2_INDEX = Pattern.compile("ON [\\w.\"]+\\(\"?(\\w+)\"?[^)]*\\)");
    private static final Pattern H2_VALUE = Pattern.compile("VALUES \\( /\\* \\d+ \\*/ (.+?) \\)");

    private ConstraintViolations() {}

    /**
     * @param constraints constraint name to column name, as configured in the schema
     */
    static ConstraintViolationException translate(String table, Map<String, String> constraints, DuplicateKeyException e) {
        String message = messageOf(e);
        String column = byConstraintName(message, constraints);
        String value = null;

        var pg = PG_DETAIL.matcher(message);
        if (pg.find()) {
            if (column == null) column = pg.group(1).trim();
            value = pg.group(2);
        } else {
            var h2 = H2_INDEX.matcher(message);
            if (column == null && h2.find()) column = h2.group(1).toLowerCase(Locale.ROOT);
            var v = H2_VALUE.matcher(message);
            if (v.find()) value = unquote(v.group(1).trim());
        }
        return new ConstraintViolationException(table, column, value, e);
    }

    private static String byConstraintName(String message, Map<String, String> constraints) {
        String upper = message.toUpperCase(Locale.ROOT);
        return constraints.entrySet().stream()
                .sorted(Comparator.comparingInt((Map.Entry<String, String> c) -> c.getKey().length()).reversed())
                .filter(c -> upper.contains(c.getKey().toUpperCase(Locale.ROOT)))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
    }

    private static String messageOf(Throwable e) {
        var sb = new StringBuilder();
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t.getMessage() != null) sb.append(t.getMessage()).append('\n');
        }
        return sb.toString();
    }

    private static String unquote(String raw) {
        if (raw.length() >= 2 && raw.startsWith("'") && raw.endsWith("'")) {
            return raw.substring(1, raw.length() - 1).replace("''", "'");
        }
        return raw;
    }
}
