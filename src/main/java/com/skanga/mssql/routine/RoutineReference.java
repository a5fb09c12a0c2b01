package com.skanga.mssql.routine;

/**
 * Identifies a callable database object, optionally qualified by schema.
 * Identifiers are rendered bracket-quoted so that they can never be read as expressions.
 *
 * @param schema schema name, or null for the database default schema
 * @param name   object name
 */
public record RoutineReference(String schema, String name) {
    public RoutineReference {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Object name must not be empty");
        }
    }

    /**
     * Parses a caller-supplied {@code [schema.]name}. Only the first two dot-separated
     * segments are consulted; anything after the second segment is ignored.
     *
     * @param qualifiedName the name as supplied by the caller
     * @return the parsed reference
     * @throws IllegalArgumentException if the name is null or empty
     */
    public static RoutineReference parse(String qualifiedName) {
        if (qualifiedName == null || qualifiedName.isBlank()) {
            throw new IllegalArgumentException("Object name must not be empty");
        }
        String trimmedName = qualifiedName.trim();
        if (!trimmedName.contains(".")) {
            return new RoutineReference(null, unquote(trimmedName));
        }
        String[] nameParts = trimmedName.split("\\.", -1);
        String schemaPart = unquote(nameParts[0]);
        return new RoutineReference(schemaPart.isEmpty() ? null : schemaPart, unquote(nameParts[1]));
    }

    /**
     * Renders the reference as {@code [schema].[name]}, or {@code [name]} without a schema.
     */
    public String quoted() {
        return schema != null ? quote(schema) + "." + quote(name) : quote(name);
    }

    public static String quote(String identifier) {
        return "[" + identifier.replace("]", "]]") + "]";
    }

    private static String unquote(String identifierPart) {
        String trimmedPart = identifierPart.trim();
        if (trimmedPart.length() >= 2 && trimmedPart.startsWith("[") && trimmedPart.endsWith("]")) {
            return trimmedPart.substring(1, trimmedPart.length() - 1).replace("]]", "]");
        }
        return trimmedPart;
    }

    @Override
    public String toString() {
        return schema != null ? schema + "." + name : name;
    }
}
