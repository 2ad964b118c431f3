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
 * Lowers safe navigation chains to a marker call the tree stage understands:
 * <pre>
 * user?.address().city?.name()
 * </pre>
 * becomes, on the same line,
 * <pre>
 * $nav(user, $it.address().city, $it.name())
 * </pre>
 * Each step after the receiver reads {@code $it} as the value produced so far.
 */
public class SafeNavigationRewriter implements Rewriter {

    public static final String MARKER = "$nav";
    public static final String STEP_RECEIVER = "$it";

    static final String NAME = "safe-navigation";

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
            if (!isSafeNavigationAt(scanner, i) || done.contains(i)) {
                continue;
            }
            int receiver = scanner.operandStart(i);
            if (receiver < 0) {
                throw error(editor, i, "'?.' needs a receiver on its left");
            }
            List<Integer> operators = new ArrayList<>();
            int operator = i;
            int end;
            while (true) {
                operators.add(operator);
                int member = scanner.skipTrivia(operator + 2);
                if (member >= scanner.length() || !Character.isJavaIdentifierStart(scanner.charAt(member))) {
                    throw error(editor, operator, "'?.' must be followed by a member name");
                }
                end = scanner.chainEnd(member);
                if (end < 0) {
                    throw error(editor, member, "unbalanced brackets after '?.'");
                }
                int next = scanner.skipTrivia(end);
                if (!isSafeNavigationAt(scanner, next)) {
                    break;
                }
                operator = next;
            }

            editor.insert(receiver, MARKER + "(").anchor(0, i, 2, MappingTag.MARKER);
            for (int op : operators) {
                editor.replace(op, op + 2, ", " + STEP_RECEIVER + ".").anchor(2, op, 2, MappingTag.TOKEN);
                done.add(op);
            }
            editor.insert(end, ")");
        }
        return editor.finish();
    }

    static boolean isSafeNavigationAt(SourceScanner scanner, int i) {
        if (i + 1 >= scanner.length() || scanner.charAt(i) != '?' || scanner.charAt(i + 1) != '.') {
            return false;
        }
        if (!scanner.isCode(i) || !scanner.isCode(i + 1)) {
            return false;
        }
        // cond?.5:1 is a ternary
        return i + 2 >= scanner.length() || !Character.isDigit(scanner.charAt(i + 2));
    }

    private static SyntaxRewriteException error(SourceEditor editor, int index, String message) {
        Position at = editor.originalOf(index);
        return new SyntaxRewriteException(NAME, message, at.line(), at.column());
    }
}
