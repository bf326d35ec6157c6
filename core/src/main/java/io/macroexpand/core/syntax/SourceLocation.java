package io.macroexpand.core.syntax;

/**
 * A position in a source file, used for attributing diagnostics.
 *
 * @param file   the source file name
 * @param line   1-based line, 0 when unknown
 * @param column 1-based column, 0 when unknown
 */
public record SourceLocation(String file, int line, int column) {

    /** Location used for synthesized syntax that has no source text. */
    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0);

    public SourceLocation {
        file = file != null ? file : "<unknown>";
    }

    public static SourceLocation of(String file, int line, int column) {
        return new SourceLocation(file, line, column);
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
