package io.macroexpand.core.manifest;

import io.macroexpand.core.error.ManifestParseException;
import io.macroexpand.core.model.NamePattern;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the manifest spelling of a name pattern:
 * <ul>
 * <li>{@code overloaded}
 * <li>{@code arbitrary}
 * <li>{@code prefixed(_)}, {@code suffixed(Async)}, {@code named(init)}
 * </ul>
 *
 * <p>
 * Stateless; all methods are static.
 */
public final class NamePatternParser {

    /** {@code kind(argument)} with a non-empty argument. */
    private static final Pattern PARAMETERIZED = Pattern.compile("^(prefixed|suffixed|named)\\(([^()\\s]+)\\)$");

    private NamePatternParser() {}

    /**
     * Parses one pattern.
     *
     * @param text      the pattern as written in the manifest
     * @param macroName the macro being parsed, for error messages
     * @param source    the manifest path, for error messages
     * @throws ManifestParseException if the text is not a known pattern
     */
    public static NamePattern parse(String text, String macroName, String source) {
        String trimmed = text == null ? "" : text.trim();
        if ("overloaded".equals(trimmed)) {
            return NamePattern.overloaded();
        }
        if ("arbitrary".equals(trimmed)) {
            return NamePattern.arbitrary();
        }
        Matcher matcher = PARAMETERIZED.matcher(trimmed);
        if (!matcher.matches()) {
            throw new ManifestParseException(
                    "Invalid name pattern '" + trimmed + "': expected overloaded, arbitrary, prefixed(p), "
                            + "suffixed(s) or named(n)",
                    macroName,
                    source);
        }
        String argument = matcher.group(2);
        return switch (matcher.group(1)) {
            case "prefixed" -> NamePattern.prefixed(argument);
            case "suffixed" -> NamePattern.suffixed(argument);
            default -> NamePattern.named(argument);
        };
    }
}
