package io.graphvault.server.graph;

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * The only place where identifiers are interpolated into Cypher text.
 * <p>
 * Labels, relationship types and property keys cannot be passed as query
 * parameters, so every such identifier must match
 * {@code ^[A-Za-z_][A-Za-z0-9_]*$} before it is spliced into a statement.
 * Anything else (backticks, spaces, braces, comment markers) is rejected.
 */
public final class CypherLabels {
    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    private CypherLabels() {
        // utility
    }

    public static boolean isValid(String identifier) {
        return identifier != null && IDENTIFIER.matcher(identifier).matches();
    }

    /**
     * @throws IllegalArgumentException if {@code identifier} is not a safe identifier
     */
    public static String requireValid(String identifier, String what) {
        if (!isValid(identifier)) {
            throw new IllegalArgumentException("invalid " + what + ": '" + identifier + "'");
        }
        return identifier;
    }

    /** {@code ["User", "Admin"]} -> {@code ":User:Admin"}. */
    public static String labelExpression(Collection<String> labels) {
        if (labels == null || labels.isEmpty()) {
            throw new IllegalArgumentException("a node needs at least one label");
        }
        StringBuilder sb = new StringBuilder();
        for (String label : labels) {
            sb.append(':').append(requireValid(label, "label"));
        }
        return sb.toString();
    }
}
