package io.macroexpand.core.manifest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.macroexpand.core.spi.ExpansionFunction;
import io.macroexpand.core.spi.MacroImplementation;
import io.macroexpand.core.testkit.TestMacros;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link MacroImplementationRegistry}. */
class MacroImplementationRegistryTest {

    private static final ExpansionFunction PEER = ExpansionFunction.peer((a, d, c) -> List.of());

    @Test
    void registerAndRetrieve() {
        var registry = new MacroImplementationRegistry();
        MacroImplementation impl = TestMacros.implementation("peer", PEER);
        registry.register(impl);

        assertThat(registry.getImplementation("peer")).hasValue(impl);
        assertThat(registry.hasImplementation("peer")).isTrue();
        assertThat(registry.getImplementation("other")).isEmpty();
    }

    @Test
    void laterRegistrationReplacesEarlier() {
        var registry = new MacroImplementationRegistry();
        MacroImplementation first = TestMacros.implementation("peer", PEER);
        MacroImplementation second = TestMacros.implementation("peer", PEER);
        registry.register(first);
        registry.register(second);

        assertThat(registry.getImplementation("peer")).hasValue(second);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void rejectsMissingIds() {
        var registry = new MacroImplementationRegistry();

        assertThatThrownBy(() -> registry.register(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> registry.register(TestMacros.implementation("", PEER)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
