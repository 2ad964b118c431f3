package org.javelin.rewrite;

import java.util.List;
import java.util.Set;

import org.javelin.SyntaxRewriteException;
import org.javelin.mapping.Mapping;
import org.javelin.mapping.MappingTag;
import org.javelin.mapping.Position;

/**
 * Turns {@code union Shape { Circle(double radius), Empty }} into an annotated interface
 * whose abstract methods describe the variants:
 * <pre>
 * &#64;JavelinUnion interface Shape { void Circle(double radius); void Empty(); }
 * </pre>
 * The interface is valid Java, so the structural parser accepts it; the sum-types plugin
 * then replaces it with a sealed interface.
 */
public class UnionRewriter implements Rewriter {

    public static final String MARKER_ANNOTATION = "JavelinUnion";

    static final String NAME = "union";

    private static final Set<String> MODIFIERS = Set.of("public", "protected", "private", "static");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RewriteResult rewrite(String source, List<Mapping> mappings) {
        SourceScanner scanner = new SourceScanner(source);
        SourceEditor editor = new SourceEditor(NAME, scanner, mappings);

        int at = scanner.findWord("union", 0);
        while (at >= 0) {
            int next = at + 1;
            if (startsDeclaration(scanner, at)) {
                int nameStart = scanner.skipTrivia(at + "union".length());
                int nameEnd = scanner.identifierEnd(nameStart);
                if (nameEnd > nameStart) {
                    next = rewriteUnion(editor, at, nameStart, nameEnd);
                }
            }
            at = scanner.findWord("union", next);
        }
        return editor.finish();
    }

    private static boolean startsDeclaration(SourceScanner scanner, int keyword) {
        int prev = scanner.previousSignificant(keyword);
        if (prev < 0) {
            return true;
        }
        char c = scanner.charAt(prev);
        if (c == ';' || c == '{' || c == '}') {
            return true;
        }
        return MODIFIERS.contains(scanner.wordEndingAt(prev));
    }

    private int rewriteUnion(SourceEditor editor, int keyword, int nameStart, int nameEnd) {
        SourceScanner scanner = editor.scanner();
        int cursor = scanner.skipTrivia(nameEnd);
        if (cursor < scanner.length() && scanner.charAt(cursor) == '<') {
            int close = angleClose(scanner, cursor);
            if (close < 0) {
                throw error(editor, cursor, "unterminated type parameter list");
            }
            cursor = scanner.skipTrivia(close + 1);
        }
        if (cursor >= scanner.length() || scanner.charAt(cursor) != '{') {
            // not a union declaration, e.g. a variable named union
            return nameStart;
        }
        int open = cursor;
        int close = scanner.matchingClose(open);
        if (close < 0) {
            throw error(editor, open, "unbalanced braces in union body");
        }

        editor.replace(keyword, nameStart, "@" + MARKER_ANNOTATION + " interface" + spacing(scanner, keyword + "union".length(), nameStart))
              .anchor(0, keyword, 1, MappingTag.MARKER);
        editor.anchorSource(nameStart, nameEnd - nameStart, MappingTag.TOKEN);

        int variant = scanner.skipTrivia(open + 1);
        boolean any = false;
        while (variant < close) {
            int tagEnd = scanner.identifierEnd(variant);
            if (tagEnd == variant) {
                throw error(editor, variant, "expected variant name");
            }
            editor.insert(variant, "void ");
            editor.anchorSource(variant, tagEnd - variant, MappingTag.TOKEN);
            int after = scanner.skipTrivia(tagEnd);
            int fieldsEnd;
            if (after < close && scanner.charAt(after) == '(') {
                int paren = scanner.matchingClose(after);
                if (paren < 0 || paren > close) {
                    throw error(editor, after, "unbalanced parentheses in variant fields");
                }
                fieldsEnd = paren + 1;
            } else {
                editor.insert(tagEnd, "()");
                fieldsEnd = tagEnd;
            }
            int sep = scanner.skipTrivia(fieldsEnd);
            if (sep < close && scanner.charAt(sep) == ',') {
                editor.replace(sep, sep + 1, ";");
                variant = scanner.skipTrivia(sep + 1);
            } else if (sep == close) {
                editor.insert(fieldsEnd, ";");
                variant = close;
            } else {
                throw error(editor, sep, "expected ',' or '}' after variant");
            }
            any = true;
        }
        if (!any) {
            throw error(editor, open, "union declares no variants");
        }
        return close + 1;
    }

    private static String spacing(SourceScanner scanner, int from, int to) {
        String between = scanner.source().substring(from, to);
        return between.contains("\n") ? between : " ";
    }

    static int angleClose(SourceScanner scanner, int open) {
        int depth = 0;
        for (int i = open; i < scanner.length(); i++) {
            if (!scanner.isCode(i)) {
                continue;
            }
            char c = scanner.charAt(i);
            if (c == '<') {
                depth++;
            } else if (c == '>' && --depth == 0) {
                return i;
            } else if (c == '{' || c == ';') {
                return -1;
            }
        }
        return -1;
    }

    private static SyntaxRewriteException error(SourceEditor editor, int index, String message) {
        Position at = editor.originalOf(index);
        return new SyntaxRewriteException(NAME, message, at.line(), at.column());
    }
}
