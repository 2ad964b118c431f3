package org.javelin.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Position correspondence between the original Javelin source and the generated Java text.
 * <p>
 * Mappings are appended by the text rewrite stage. The tree stage only ever moves their
 * generated lines with {@link #shift(int, int)} when whole lines are inserted or removed.
 * A store belongs to exactly one file run and is not thread-safe.
 */
public class MappingStore {

    /**
     * Columns past the end of a mapping that a nearest-mapping fallback may still claim.
     */
    public static final int SLACK = 2;

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private static final Comparator<Mapping> FALLBACK_PREFERENCE =
            Comparator.comparingInt((Mapping m) -> -m.getTag().getSpanRank())
                      .thenComparingInt(m -> -m.getLength());

    private final List<Mapping> mappings;

    public MappingStore() {
        this.mappings = new ArrayList<>();
    }

    public MappingStore(List<Mapping> mappings) {
        this.mappings = new ArrayList<>(mappings);
    }

    public void record(Mapping mapping) {
        mappings.add(mapping);
    }

    public void recordOriginal(Position original, Position generated, int length, MappingTag tag) {
        mappings.add(Mapping.span(original, generated, length, tag));
    }

    public void recordAll(List<Mapping> other) {
        mappings.addAll(other);
    }

    public void merge(MappingStore other) {
        mappings.addAll(other.mappings);
    }

    public List<Mapping> mappings() {
        return Collections.unmodifiableList(mappings);
    }

    public int size() {
        return mappings.size();
    }

    public boolean hasMappingOnLine(int generatedLine) {
        for (Mapping m : mappings) {
            if (m.getGeneratedLine() == generatedLine) {
                return true;
            }
        }
        return false;
    }

    /**
     * Moves every mapping whose generated line is strictly greater than {@code fromGenLine}
     * by {@code byLines}. Mappings on {@code fromGenLine} itself stay where they are.
     */
    public void shift(int fromGenLine, int byLines) {
        if (byLines == 0) {
            return;
        }
        mappings.replaceAll(m -> m.getGeneratedLine() > fromGenLine ? m.shiftGeneratedLine(byLines) : m);
    }

    /**
     * Translates a generated position back to the original source.
     * <ol>
     *   <li>a mapping whose range contains the column answers exactly;</li>
     *   <li>otherwise the nearest mapping on the line: a marker answers verbatim, a span
     *   answers only if the offset stays within its length plus {@link #SLACK};</li>
     *   <li>otherwise the position is returned unchanged.</li>
     * </ol>
     */
    public Position mapToOriginal(int genLine, int genCol) {
        Mapping exact = null;
        Mapping nearest = null;
        int nearestDistance = Integer.MAX_VALUE;
        for (Mapping m : mappings) {
            if (m.getGeneratedLine() != genLine) {
                continue;
            }
            if (m.containsGenerated(genLine, genCol)) {
                // innermost span wins when ranges nest
                if (exact == null || m.getLength() < exact.getLength()) {
                    exact = m;
                }
                continue;
            }
            int distance = Math.abs(genCol - m.getGeneratedColumn());
            if (distance < nearestDistance ||
                (distance == nearestDistance && FALLBACK_PREFERENCE.compare(m, nearest) < 0)) {
                nearest = m;
                nearestDistance = distance;
            }
        }

        if (exact != null) {
            return new Position(exact.getOriginalLine(), exact.getOriginalColumn() + (genCol - exact.getGeneratedColumn()));
        }
        if (nearest != null) {
            if (nearest.getTag().isMarker()) {
                return nearest.original();
            }
            int offset = genCol - nearest.getGeneratedColumn();
            if (offset >= 0 && offset < nearest.getLength() + SLACK) {
                return new Position(nearest.getOriginalLine(), nearest.getOriginalColumn() + offset);
            }
        }
        return new Position(genLine, genCol);
    }

    public Position mapToOriginal(Position generated) {
        return mapToOriginal(generated.line(), generated.column());
    }

    /**
     * Inverse of {@link #mapToOriginal(int, int)}: exact containment on the original side,
     * otherwise the position unchanged.
     */
    public Position mapToGenerated(int origLine, int origCol) {
        Mapping exact = null;
        for (Mapping m : mappings) {
            if (m.containsOriginal(origLine, origCol) && (exact == null || m.getLength() < exact.getLength())) {
                exact = m;
            }
        }
        if (exact == null) {
            return new Position(origLine, origCol);
        }
        if (exact.getTag().isMarker()) {
            return exact.generated();
        }
        return new Position(exact.getGeneratedLine(), exact.getGeneratedColumn() + (origCol - exact.getOriginalColumn()));
    }

    public String toJson() {
        JsonArray array = new JsonArray();
        for (Mapping m : mappings) {
            JsonObject entry = new JsonObject();
            entry.addProperty("original_line", m.getOriginalLine());
            entry.addProperty("original_column", m.getOriginalColumn());
            entry.addProperty("generated_line", m.getGeneratedLine());
            entry.addProperty("generated_column", m.getGeneratedColumn());
            entry.addProperty("length", m.getLength());
            entry.addProperty("tag", m.getTag().name());
            array.add(entry);
        }
        JsonObject root = new JsonObject();
        root.add("mappings", array);
        return GSON.toJson(root);
    }

    public static MappingStore fromJson(String json) {
        try {
            JsonObject root = JsonParser.parseString(json).getAsJsonObject();
            MappingStore store = new MappingStore();
            for (JsonElement element : root.getAsJsonArray("mappings")) {
                JsonObject entry = element.getAsJsonObject();
                store.record(new Mapping(entry.get("original_line").getAsInt(),
                                         entry.get("original_column").getAsInt(),
                                         entry.get("generated_line").getAsInt(),
                                         entry.get("generated_column").getAsInt(),
                                         entry.get("length").getAsInt(),
                                         MappingTag.valueOf(entry.get("tag").getAsString())));
            }
            return store;
        } catch (IllegalStateException | NullPointerException | IllegalArgumentException e) {
            throw new JsonParseException("malformed mapping store: " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "MappingStore{" + mappings.size() + " mappings}";
    }
}
