package dev.contentagents.error;

/**
 * A candidate payload broke a structural constraint of its artifact schema.
 */
public class SchemaViolationException extends UnitFailureException {

    private final String path;
    private final String expected;
    private final String actual;

    public SchemaViolationException(String schema, String path, String expected, String actual) {
        super(FailureKind.SCHEMA_VIOLATION,
            "%s: field '%s' expected %s but was %s".formatted(schema, path, expected, actual));
        this.path = path;
        this.expected = expected;
        this.actual = actual;
    }

    public String path() { return path; }
    public String expected() { return expected; }
    public String actual() { return actual; }
}
