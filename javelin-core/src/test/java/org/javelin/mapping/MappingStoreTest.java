package org.javelin.mapping;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.google.gson.JsonParseException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MappingStoreTest {

    @Test
    void exactMapping_translatesColumnOffset() {
        MappingStore store = new MappingStore();
        store.recordOriginal(new Position(3, 5), new Position(7, 12), 10, MappingTag.EXPRESSION);

        assertThat(store.mapToOriginal(7, 12)).isEqualTo(new Position(3, 5));
        assertThat(store.mapToOriginal(7, 16)).isEqualTo(new Position(3, 9));
        assertThat(store.mapToOriginal(7, 21)).isEqualTo(new Position(3, 14));
    }

    @Test
    void nestedSpans_innermostWins() {
        MappingStore store = new MappingStore();
        store.recordOriginal(new Position(1, 1), new Position(1, 1), 40, MappingTag.STATEMENT);
        store.recordOriginal(new Position(2, 3), new Position(1, 10), 4, MappingTag.TOKEN);

        assertThat(store.mapToOriginal(1, 11)).isEqualTo(new Position(2, 4));
        assertThat(store.mapToOriginal(1, 30)).isEqualTo(new Position(1, 30));
    }

    @Test
    void nearestMarker_answersVerbatim() {
        MappingStore store = new MappingStore();
        store.record(Mapping.marker(new Position(4, 9), new Position(4, 1)));

        assertThat(store.mapToOriginal(4, 7)).isEqualTo(new Position(4, 9));
    }

    @Test
    void nearestSpan_honoursSlack() {
        MappingStore store = new MappingStore();
        store.recordOriginal(new Position(2, 20), new Position(5, 10), 3, MappingTag.TOKEN);

        // one past the end plus two columns of slack
        assertThat(store.mapToOriginal(5, 14)).isEqualTo(new Position(2, 24));
        assertThat(store.mapToOriginal(5, 15)).isEqualTo(new Position(5, 15));
        // before the span never matches
        assertThat(store.mapToOriginal(5, 8)).isEqualTo(new Position(5, 8));
    }

    @Test
    void equallyNearMappings_preferLargerSpan() {
        MappingStore store = new MappingStore();
        store.recordOriginal(new Position(8, 1), new Position(3, 10), 4, MappingTag.STATEMENT);
        store.record(Mapping.marker(new Position(9, 1), new Position(3, 20)));

        // both five columns away, the statement span is preferred over the marker
        assertThat(store.mapToOriginal(3, 15)).isEqualTo(new Position(8, 6));
    }

    @Test
    void noMappingOnLine_isIdentity() {
        MappingStore store = new MappingStore();
        store.recordOriginal(new Position(1, 1), new Position(1, 1), 5, MappingTag.TOKEN);

        assertThat(store.mapToOriginal(12, 4)).isEqualTo(new Position(12, 4));
        assertThat(store.mapToGenerated(12, 4)).isEqualTo(new Position(12, 4));
    }

    @Test
    void shift_movesOnlyLinesStrictlyAfter() {
        MappingStore store = new MappingStore();
        store.recordOriginal(new Position(4, 1), new Position(4, 1), 5, MappingTag.STATEMENT);
        store.recordOriginal(new Position(5, 1), new Position(5, 1), 5, MappingTag.STATEMENT);
        store.recordOriginal(new Position(6, 1), new Position(6, 1), 5, MappingTag.STATEMENT);

        store.shift(5, 3);

        assertThat(store.mappings()).extracting(Mapping::getGeneratedLine).containsExactly(4, 5, 9);
        assertThat(store.mappings()).extracting(Mapping::getOriginalLine).containsExactly(4, 5, 6);
    }

    @Test
    void shift_leavesHeldMappingsUnchanged() {
        Mapping moved = Mapping.span(new Position(6, 1), new Position(6, 1), 5, MappingTag.STATEMENT);
        Set<Mapping> held = new HashSet<>(List.of(moved));
        MappingStore store = new MappingStore(List.of(moved));

        store.shift(5, 3);

        assertThat(moved.getGeneratedLine()).isEqualTo(6);
        assertThat(held).contains(moved);
        assertThat(store.mappings()).containsExactly(
                Mapping.span(new Position(6, 1), new Position(9, 1), 5, MappingTag.STATEMENT));
    }

    @Test
    void injectedBlockAboveLine_keepsLinesBelowTranslatable() {
        // 3-line block injected after generated line 10
        MappingStore store = new MappingStore();
        store.recordOriginal(new Position(10, 5), new Position(10, 5), 8, MappingTag.STATEMENT);
        store.recordOriginal(new Position(11, 5), new Position(11, 5), 8, MappingTag.STATEMENT);
        store.recordOriginal(new Position(20, 1), new Position(20, 1), 12, MappingTag.DECLARATION);

        store.shift(10, 3);

        assertThat(store.mapToOriginal(10, 6)).isEqualTo(new Position(10, 6));
        assertThat(store.mapToOriginal(14, 6)).isEqualTo(new Position(11, 6));
        assertThat(store.mapToOriginal(23, 1)).isEqualTo(new Position(20, 1));
        assertThat(store.mappings()).extracting(Mapping::original)
                                    .containsExactly(new Position(10, 5), new Position(11, 5), new Position(20, 1));
    }

    @Test
    void mapToGenerated_invertsExactSpan() {
        MappingStore store = new MappingStore();
        store.recordOriginal(new Position(2, 7), new Position(9, 15), 6, MappingTag.TOKEN);
        store.record(Mapping.marker(new Position(3, 1), new Position(11, 40)));

        assertThat(store.mapToGenerated(2, 9)).isEqualTo(new Position(9, 17));
        assertThat(store.mapToGenerated(3, 1)).isEqualTo(new Position(11, 40));
    }

    @Test
    void negativeLength_isRejected() {
        assertThatThrownBy(() -> new Mapping(1, 1, 1, 1, -1, MappingTag.TOKEN))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("length");
    }

    @Test
    void merge_appendsOtherStore() {
        MappingStore first = new MappingStore(List.of(Mapping.marker(new Position(1, 1), new Position(1, 1))));
        MappingStore second = new MappingStore(List.of(Mapping.marker(new Position(2, 1), new Position(2, 1))));

        first.merge(second);

        assertThat(first.size()).isEqualTo(2);
        assertThat(first.hasMappingOnLine(2)).isTrue();
        assertThat(first.hasMappingOnLine(3)).isFalse();
    }

    @Test
    void json_restoresEveryField() {
        MappingStore store = new MappingStore();
        store.recordOriginal(new Position(2, 7), new Position(9, 15), 6, MappingTag.PATTERN);
        store.record(Mapping.marker(new Position(3, 1), new Position(11, 40)));

        String json = store.toJson();
        MappingStore restored = MappingStore.fromJson(json);

        assertThat(json).contains("\"generated_line\": 9").contains("\"tag\": \"PATTERN\"");
        assertThat(restored.mappings()).containsExactlyElementsOf(store.mappings());
    }

    @Test
    void json_malformedInputIsReported() {
        assertThatThrownBy(() -> MappingStore.fromJson("{\"mappings\": [{\"original_line\": 1}]}"))
            .isInstanceOf(JsonParseException.class)
            .hasMessageContaining("malformed mapping store");
    }
}
