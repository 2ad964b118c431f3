package org.javelin.transpiler.match;

import java.util.List;

/**
 * One column of a match arm pattern.
 */
public sealed interface Pattern permits Pattern.Wildcard, Pattern.Binding, Pattern.Variant {

    /**
     * True when the pattern accepts every value of its column.
     */
    boolean isIrrefutable();

    record Wildcard() implements Pattern {
        @Override
        public boolean isIrrefutable() {
            return true;
        }

        @Override
        public String toString() {
            return "_";
        }
    }

    record Binding(String name) implements Pattern {
        @Override
        public boolean isIrrefutable() {
            return true;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * {@code Tag}, {@code Tag(a, _)} or {@code Union.Tag(a)}. Field patterns are
     * {@link Wildcard}s or {@link Binding}s only; {@code fields} is empty when the pattern
     * was written without parentheses.
     */
    record Variant(String qualifier, String tag, List<Pattern> fields, boolean hasFieldList) implements Pattern {

        public Variant {
            fields = List.copyOf(fields);
        }

        @Override
        public boolean isIrrefutable() {
            return false;
        }

        @Override
        public String toString() {
            String head = qualifier == null ? tag : qualifier + "." + tag;
            if (!hasFieldList) {
                return head;
            }
            StringBuilder sb = new StringBuilder(head).append('(');
            for (int i = 0; i < fields.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(fields.get(i));
            }
            return sb.append(')').toString();
        }
    }
}
