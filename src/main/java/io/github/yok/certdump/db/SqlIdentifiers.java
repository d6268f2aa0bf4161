package io.github.yok.certdump.db;

import java.util.regex.Pattern;

/**
 * Validation and quoting of table and column names taken from configuration.
 *
 * <p>
 * Only plain identifiers ({@code [A-Za-z_][A-Za-z0-9_]*}) are accepted, so configured names can be
 * embedded in SQL text after quoting.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class SqlIdentifiers {

    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private SqlIdentifiers() {
        // Utility class; do not instantiate.
    }

    /**
     * Double-quotes a validated identifier.
     *
     * @param identifier table or column name
     * @return quoted identifier
     * @throws IllegalArgumentException if the name is not a plain identifier
     */
    public static String quote(String identifier) {
        return "\"" + requireValid(identifier) + "\"";
    }

    /**
     * Checks that a name is a plain identifier.
     *
     * @param identifier table or column name
     * @return the same name
     * @throws IllegalArgumentException if the name is not a plain identifier
     */
    public static String requireValid(String identifier) {
        if (identifier == null || !PLAIN_IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + identifier);
        }
        return identifier;
    }
}
