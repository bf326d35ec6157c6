package io.macroexpand.core.manifest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.macroexpand.core.error.ManifestParseException;
import io.macroexpand.core.model.NamePattern;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

/** Tests for {@link NamePatternParser}. */
class NamePatternParserTest {

    @Test
    void parsesEveryKind() {
        assertThat(NamePatternParser.parse("overloaded", "M", "m.yaml")).isEqualTo(NamePattern.overloaded());
        assertThat(NamePatternParser.parse("arbitrary", "M", "m.yaml")).isEqualTo(NamePattern.arbitrary());
        assertThat(NamePatternParser.parse("prefixed(_)", "M", "m.yaml")).isEqualTo(NamePattern.prefixed("_"));
        assertThat(NamePatternParser.parse(" suffixed(Async) ", "M", "m.yaml"))
                .isEqualTo(NamePattern.suffixed("Async"));
        assertThat(NamePatternParser.parse("named(init)", "M", "m.yaml")).isEqualTo(NamePattern.named("init"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "prefixed()", "named(a b)", "suffix(x)", "Overloaded", "named((x))"})
    void rejectsMalformedPatterns(String text) {
        assertThatThrownBy(() -> NamePatternParser.parse(text, "M", "m.yaml"))
                .isInstanceOfSatisfying(ManifestParseException.class, e -> {
                    assertThat(e.macroName()).isEqualTo("M");
                    assertThat(e.source()).isEqualTo("m.yaml");
                })
                .hasMessageStartingWith("Invalid name pattern");
    }
}
