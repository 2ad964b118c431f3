package org.javelin.transpiler.types;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SyntheticTypeRegistryTest {

    private static UnionInfo union(String name, boolean synthetic, String... tags) {
        List<VariantInfo> variants = new ArrayList<>();
        for (String tag : tags) {
            variants.add(new VariantInfo(name, tag, List.of()));
        }
        return new UnionInfo(name, List.of(), variants, synthetic);
    }

    @Test
    void userUnion_replacesBuiltin() {
        SyntheticTypeRegistry registry = new SyntheticTypeRegistry();
        registry.register(union("Option", true, "Some", "None"));
        registry.register(union("Option", false, "Present", "Absent"));

        assertThat(registry.isSynthetic("Option")).isFalse();
        assertThat(registry.union("Option").orElseThrow().tags()).containsExactly("Present", "Absent");
    }

    @Test
    void builtin_neverReplacesUserUnion() {
        SyntheticTypeRegistry registry = new SyntheticTypeRegistry();
        registry.register(union("Result", false, "Good", "Bad"));
        registry.register(union("Result", true, "Ok", "Err"));

        assertThat(registry.union("Result").orElseThrow().tags()).containsExactly("Good", "Bad");
    }

    @Test
    void duplicateUserUnion_isRejected() {
        SyntheticTypeRegistry registry = new SyntheticTypeRegistry();
        registry.register(union("Shape", false, "Circle"));

        assertThatThrownBy(() -> registry.register(union("Shape", false, "Square")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("union 'Shape' is declared more than once");
    }

    @Test
    void lookups_ignoreQualifiersAndTypeArguments() {
        SyntheticTypeRegistry registry = new SyntheticTypeRegistry();
        registry.register(union("Result", true, "Ok", "Err"));

        assertThat(registry.isUnion("com.acme.Result<String, Integer>")).isTrue();
        assertThat(SyntheticTypeRegistry.simpleName("a.b.Result<X, Y>")).isEqualTo("Result");
    }

    @Test
    void variantsNamed_searchesEveryUnion() {
        SyntheticTypeRegistry registry = new SyntheticTypeRegistry();
        registry.register(union("Shape", false, "Circle", "Empty"));
        registry.register(union("Slot", false, "Full", "Empty"));

        assertThat(registry.variantsNamed("Empty")).extracting(VariantInfo::qualifiedName)
                                                   .containsExactly("Shape.Empty", "Slot.Empty");
        assertThat(registry.variantsNamed("Square")).isEmpty();
    }
}
