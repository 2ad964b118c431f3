package org.javelin.rewrite;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.javelin.SyntaxRewriteException;
import org.javelin.mapping.Mapping;
import org.javelin.mapping.MappingTag;
import org.javelin.mapping.Position;

/**
 * Lowers the null coalescing operator to a marker call the tree stage understands.
 * {@code a ?? b} becomes {@code $coalesce(a , b)}; a chain nests to the right, so
 * {@code a ?? b ?? c} becomes {@code $coalesce(a , $coalesce( b , c))}.
 * <p>
 * Both operands are primary expressions (names, literals, calls, member and index
 * accesses, {@code new}); anything wider has to be parenthesized.
 */
public class NullCoalescingRewriter implements Rewriter {

    public static final String MARKER = "$coalesce";

    static final String NAME = "null-coalescing";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RewriteResult rewrite(String source, List<Mapping> mappings) {
        SourceScanner scanner = new SourceScanner(source);
        SourceEditor editor = new SourceEditor(NAME, scanner, mappings);
        Set<Integer> done = new HashSet<>();

        for (int i = 0; i + 1 < scanner.length(); i++) {
            if (!isCoalescingAt(scanner, i) || done.contains(i)) {
                continue;
            }
            int left = scanner.operandStart(i);
            if (left < 0) {
                throw error(editor, i, "'??' needs an operand on its left");
            }
            List<Integer> operators = new ArrayList<>();
            int operator = i;
            int end;
            while (true) {
                operators.add(operator);
                end = scanner.operandEnd(operator + 2);
                if (end < 0) {
                    throw error(editor, operator, "'??' needs an operand on its right");
                }
                int next = scanner.skipTrivia(end);
                if (!isCoalescingAt(scanner, next)) {
                    break;
                }
                operator = next;
            }

            editor.insert(left, MARKER + "(").anchor(0, i, 2, MappingTag.MARKER);
            for (int k = 0; k < operators.size(); k++) {
                int op = operators.get(k);
                String separator = k < operators.size() - 1 ? ", " + MARKER + "(" : ",";
                editor.replace(op, op + 2, separator).anchor(0, op, 2, MappingTag.TOKEN);
                done.add(op);
            }
            editor.insert(end, ")".repeat(operators.size()));
        }
        return editor.finish();
    }

    static boolean isCoalescingAt(SourceScanner scanner, int i) {
        return i + 1 < scanner.length() && scanner.charAt(i) == '?' && scanner.charAt(i + 1) == '?' &&
               scanner.isCode(i) && scanner.isCode(i + 1);
    }

    private static SyntaxRewriteException error(SourceEditor editor, int index, String message) {
        Position at = editor.originalOf(index);
        return new SyntaxRewriteException(NAME, message, at.line(), at.column());
    }
}
