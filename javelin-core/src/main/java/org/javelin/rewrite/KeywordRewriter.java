package org.javelin.rewrite;

import java.util.List;

import org.javelin.SyntaxRewriteException;
import org.javelin.mapping.Mapping;
import org.javelin.mapping.MappingTag;
import org.javelin.mapping.Position;

/**
 * Normalises {@code let} bindings to Java local declarations:
 * {@code let x = e;} becomes {@code final var x = e;} and {@code let x: T = e;} becomes
 * {@code final T x = e;}. In an enhanced for header {@code let x : items} becomes
 * {@code final var x : items}.
 */
public class KeywordRewriter implements Rewriter {

    static final String NAME = "keywords";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RewriteResult rewrite(String source, List<Mapping> mappings) {
        SourceScanner scanner = new SourceScanner(source);
        SourceEditor editor = new SourceEditor(NAME, scanner, mappings);

        int at = scanner.findWord("let", 0);
        while (at >= 0) {
            if (startsStatement(scanner, at)) {
                rewriteLet(editor, at);
            }
            at = scanner.findWord("let", at + 1);
        }
        return editor.finish();
    }

    private static boolean startsStatement(SourceScanner scanner, int keyword) {
        int prev = scanner.previousSignificant(keyword);
        if (prev < 0) {
            return true;
        }
        char c = scanner.charAt(prev);
        return c == ';' || c == '{' || c == '}' || c == '(' || (c == '>' && prev > 0 && scanner.charAt(prev - 1) == '-');
    }

    private void rewriteLet(SourceEditor editor, int keyword) {
        SourceScanner scanner = editor.scanner();
        int nameStart = scanner.skipTrivia(keyword + "let".length());
        int nameEnd = scanner.identifierEnd(nameStart);
        if (nameEnd == nameStart) {
            // an identifier named let, e.g. let.size()
            return;
        }
        int next = scanner.skipTrivia(nameEnd);
        if (next >= scanner.length()) {
            return;
        }
        char c = scanner.charAt(next);
        if (c == '=' && (next + 1 >= scanner.length() || scanner.charAt(next + 1) != '=')) {
            editor.replace(keyword, keyword + "let".length(), "final var").anchor(0, keyword, 1, MappingTag.MARKER);
            editor.anchorSource(nameStart, nameEnd - nameStart, MappingTag.TOKEN);
        } else if (c == ':') {
            int typeStart = scanner.skipTrivia(next + 1);
            int boundary = scanner.findTopLevel(typeStart, scanner.length(), i -> scanner.charAt(i) == '=' || scanner.charAt(i) == ';');
            if (boundary >= 0 && scanner.charAt(boundary) == '=') {
                int typeEnd = scanner.previousSignificant(boundary) + 1;
                if (typeEnd <= typeStart) {
                    throw error(editor, next, "missing type after ':'");
                }
                String type = SourceScanner.normalizeSpace(scanner.source().substring(typeStart, typeEnd));
                String name = scanner.source().substring(nameStart, nameEnd);
                String replaced = scanner.source().substring(keyword, typeEnd);
                editor.replace(keyword, typeEnd, "final " + type + " " + name + SourceScanner.newlinesOf(replaced))
                      .anchor(0, keyword, 1, MappingTag.MARKER)
                      .anchor(6, typeStart, type.length(), MappingTag.TOKEN)
                      .anchor(7 + type.length(), nameStart, name.length(), MappingTag.TOKEN);
            } else if (boundary >= 0 && scanner.charAt(boundary) == ')') {
                // enhanced for over an iterable
                editor.replace(keyword, keyword + "let".length(), "final var").anchor(0, keyword, 1, MappingTag.MARKER);
            } else {
                throw error(editor, keyword, "typed let binding needs an initializer");
            }
        }
    }

    private static SyntaxRewriteException error(SourceEditor editor, int index, String message) {
        Position at = editor.originalOf(index);
        return new SyntaxRewriteException(NAME, message, at.line(), at.column());
    }
}
