package org.javelin.rewrite;

import java.util.ArrayList;
import java.util.List;

import org.javelin.LimitExceededException;
import org.javelin.SyntaxRewriteException;
import org.javelin.mapping.Mapping;
import org.javelin.mapping.MappingTag;
import org.javelin.mapping.Position;

/**
 * Rewrites {@code match} expressions into a call chain the structural parser accepts:
 * <pre>
 * match (a, b) {            $match(a, b)
 *     (Ok(x), _) if x > 0    .guarded("(Ok(x), _)", () -&gt; x &gt; 0, () -&gt; x)
 *         =&gt; x,
 *     _ =&gt; 0                  .arm("_", () -&gt; 0)
 * }                         .end();
 * </pre>
 * Patterns travel as string literals; arm bodies and guards stay in place so their
 * columns only shift. A match nested in an arm body is picked up by the next scan.
 */
public class MatchRewriter implements Rewriter {

    public static final String CHAIN_START = "$match";

    static final String NAME = "match";

    private final int maxTupleArity;

    public MatchRewriter(int maxTupleArity) {
        this.maxTupleArity = maxTupleArity;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RewriteResult rewrite(String source, List<Mapping> mappings) {
        RewriteResult current = RewriteResult.unchanged(source, mappings);
        int from = 0;
        while (true) {
            SourceScanner scanner = new SourceScanner(current.source());
            int keyword = nextMatch(scanner, from);
            if (keyword < 0) {
                return current;
            }
            SourceEditor editor = new SourceEditor(NAME, scanner, current.mappings());
            rewriteMatch(editor, keyword);
            current = editor.finish();
            from = keyword;
        }
    }

    private static int nextMatch(SourceScanner scanner, int from) {
        int at = scanner.findWord("match", from);
        while (at >= 0) {
            if (inExpressionStart(scanner, at)) {
                int next = scanner.skipTrivia(at + "match".length());
                if (next < scanner.length() && (scanner.charAt(next) == '(' || Character.isJavaIdentifierStart(scanner.charAt(next)))) {
                    // a plain call such as match(x); reaches ';' or a closing bracket first
                    int open = scanner.findTopLevel(next, scanner.length(), i -> scanner.charAt(i) == '{' || scanner.charAt(i) == ';');
                    if (open >= 0 && scanner.charAt(open) == '{') {
                        return at;
                    }
                }
            }
            at = scanner.findWord("match", at + 1);
        }
        return -1;
    }

    /**
     * {@code match} is a keyword only where a statement or an expression may begin.
     */
    static boolean inExpressionStart(SourceScanner scanner, int keyword) {
        int prev = scanner.previousSignificant(keyword);
        if (prev < 0) {
            return true;
        }
        char c = scanner.charAt(prev);
        switch (c) {
            case ';':
            case '{':
            case '}':
            case '=':
            case '(':
            case ',':
                return c != '=' || prev == 0 || "=!<>".indexOf(scanner.charAt(prev - 1)) < 0;
            case '>':
                return prev > 0 && (scanner.charAt(prev - 1) == '-' || scanner.charAt(prev - 1) == '=');
            default:
                return "return".equals(scanner.wordEndingAt(prev));
        }
    }

    private void rewriteMatch(SourceEditor editor, int keyword) {
        SourceScanner scanner = editor.scanner();
        boolean statement = isStatementPosition(scanner, keyword);
        int afterKeyword = scanner.skipTrivia(keyword + "match".length());

        int open;
        List<int[]> scrutinees;
        Position keywordPos = editor.originalOf(keyword);
        if (scanner.charAt(afterKeyword) == '(') {
            int close = scanner.matchingClose(afterKeyword);
            if (close < 0) {
                throw error(editor, afterKeyword, "unbalanced parentheses in match scrutinee");
            }
            open = scanner.skipTrivia(close + 1);
            if (open < scanner.length() && scanner.charAt(open) == '{') {
                scrutinees = splitTopLevel(scanner, afterKeyword + 1, close);
                editor.replace(keyword, afterKeyword + 1, CHAIN_START + "(" + SourceScanner.newlinesOf(scanner.source().substring(keyword, afterKeyword)))
                      .anchor(0, keyword, 1, MappingTag.MARKER);
                editor.replace(close, open + 1, ")" + SourceScanner.newlinesOf(scanner.source().substring(close, open)));
            } else {
                // parenthesised prefix of a longer scrutinee expression
                open = scanner.findTopLevel(afterKeyword, scanner.length(), i -> scanner.charAt(i) == '{');
                scrutinees = wholeScrutinee(editor, keyword, afterKeyword, open);
            }
        } else {
            open = scanner.findTopLevel(afterKeyword, scanner.length(), i -> scanner.charAt(i) == '{');
            scrutinees = wholeScrutinee(editor, keyword, afterKeyword, open);
        }

        if (scrutinees.isEmpty()) {
            throw error(editor, afterKeyword, "match needs at least one scrutinee");
        }
        if (scrutinees.size() > maxTupleArity) {
            throw new LimitExceededException("maxTupleArity", scrutinees.size(), maxTupleArity,
                    "match over " + scrutinees.size() + " values at " + keywordPos + " exceeds the maximum tuple arity of " + maxTupleArity);
        }
        for (int[] s : scrutinees) {
            editor.anchorSource(s[0], s[1] - s[0], MappingTag.EXPRESSION);
        }

        int close = scanner.matchingClose(open);
        if (close < 0) {
            throw error(editor, open, "unbalanced braces in match body");
        }
        rewriteArms(editor, open + 1, close);

        String end = ".end()";
        if (statement) {
            int after = scanner.skipTrivia(close + 1);
            if (after >= scanner.length() || scanner.charAt(after) != ';') {
                end += ";";
            }
        }
        editor.replace(close, close + 1, end).anchor(1, close, 1, MappingTag.MARKER);
    }

    private List<int[]> wholeScrutinee(SourceEditor editor, int keyword, int from, int open) {
        SourceScanner scanner = editor.scanner();
        if (open < 0 || scanner.charAt(open) != '{') {
            throw error(editor, keyword, "expected '{' after match scrutinee");
        }
        int end = scanner.previousSignificant(open) + 1;
        editor.replace(keyword, from, CHAIN_START + "(" + SourceScanner.newlinesOf(scanner.source().substring(keyword, from)))
              .anchor(0, keyword, 1, MappingTag.MARKER);
        editor.replace(end, open + 1, ")" + SourceScanner.newlinesOf(scanner.source().substring(end, open)));
        List<int[]> single = new ArrayList<>();
        single.add(new int[] {from, end});
        return single;
    }

    private void rewriteArms(SourceEditor editor, int from, int close) {
        SourceScanner scanner = editor.scanner();
        int armStart = scanner.skipTrivia(from);
        while (armStart < close) {
            int arrow = findArrow(scanner, armStart, close);
            if (arrow < 0) {
                throw error(editor, armStart, "expected '=>' in match arm");
            }
            int guardKeyword = findGuard(scanner, armStart, arrow);
            int patternEnd = scanner.previousSignificant(guardKeyword >= 0 ? guardKeyword : arrow) + 1;
            if (patternEnd <= armStart) {
                throw error(editor, armStart, "match arm has no pattern");
            }
            String pattern = SourceScanner.normalizeSpace(scanner.source().substring(armStart, patternEnd));
            String literal = "\"" + pattern.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";

            int bodyStart = scanner.skipTrivia(arrow + 2);
            if (bodyStart >= close) {
                throw error(editor, arrow, "match arm has no body");
            }
            if (guardKeyword >= 0) {
                int guardStart = scanner.skipTrivia(guardKeyword + 2);
                int guardEnd = scanner.previousSignificant(arrow) + 1;
                if (guardEnd <= guardStart) {
                    throw error(editor, guardKeyword, "empty guard in match arm");
                }
                String head = ".guarded(";
                editor.replace(armStart, guardStart, head + literal + ", () -> " + SourceScanner.newlinesOf(scanner.source().substring(armStart, guardStart)))
                      .anchor(head.length() + 1, armStart, pattern.length(), MappingTag.PATTERN)
                      .anchor(head.length() + literal.length() + 2, guardKeyword, 1, MappingTag.MARKER);
                editor.anchorSource(guardStart, guardEnd - guardStart, MappingTag.EXPRESSION);
                editor.replace(guardEnd, bodyStart, ", () -> " + SourceScanner.newlinesOf(scanner.source().substring(guardEnd, bodyStart)));
            } else {
                String head = ".arm(";
                editor.replace(armStart, bodyStart, head + literal + ", () -> " + SourceScanner.newlinesOf(scanner.source().substring(armStart, bodyStart)))
                      .anchor(head.length() + 1, armStart, pattern.length(), MappingTag.PATTERN);
            }

            int bodyEnd;
            if (scanner.charAt(bodyStart) == '{') {
                int blockClose = scanner.matchingClose(bodyStart);
                if (blockClose < 0 || blockClose > close) {
                    throw error(editor, bodyStart, "unbalanced braces in match arm body");
                }
                bodyEnd = blockClose + 1;
            } else {
                int comma = findArmSeparator(scanner, bodyStart, close);
                bodyEnd = scanner.previousSignificant(comma < 0 ? close : comma) + 1;
            }
            editor.anchorSource(bodyStart, bodyEnd - bodyStart, MappingTag.EXPRESSION);

            int separator = scanner.skipTrivia(bodyEnd);
            if (separator < close && scanner.charAt(separator) == ',') {
                editor.replace(bodyEnd, separator + 1, ")" + SourceScanner.newlinesOf(scanner.source().substring(bodyEnd, separator)));
                armStart = scanner.skipTrivia(separator + 1);
            } else if (separator >= close || scanner.charAt(bodyStart) == '{') {
                editor.insert(bodyEnd, ")");
                armStart = separator;
            } else {
                throw error(editor, separator, "expected ',' between match arms");
            }
        }
    }

    private static int findArrow(SourceScanner scanner, int from, int limit) {
        return scanner.findTopLevel(from, limit,
                i -> scanner.charAt(i) == '=' && i + 1 < limit && scanner.charAt(i + 1) == '>');
    }

    /**
     * The top-level comma ending an expression body. A comma only separates arms when the
     * text after it is empty or reads as a pattern followed by {@code =>} or a guard, so
     * commas between type arguments such as {@code new HashMap<String, Integer>()} stay
     * in the body.
     */
    private static int findArmSeparator(SourceScanner scanner, int from, int close) {
        int start = from;
        while (start < close) {
            int comma = scanner.findTopLevel(start, close, i -> scanner.charAt(i) == ',');
            if (comma < 0 || comma >= close || scanner.charAt(comma) != ',') {
                return -1;
            }
            if (startsArm(scanner, comma + 1, close)) {
                return comma;
            }
            start = comma + 1;
        }
        return -1;
    }

    private static boolean startsArm(SourceScanner scanner, int from, int close) {
        int patternStart = scanner.skipTrivia(from);
        if (patternStart >= close) {
            return true;
        }
        int stop = scanner.findTopLevel(patternStart, close,
                i -> (scanner.charAt(i) == '=' && i + 1 < close && scanner.charAt(i + 1) == '>') || scanner.isWordAt("if", i));
        if (stop <= patternStart || stop >= close || (scanner.charAt(stop) != '=' && !scanner.isWordAt("if", stop))) {
            return false;
        }
        for (int i = patternStart; i < stop; i++) {
            if (!scanner.isCode(i)) {
                continue;
            }
            char c = scanner.charAt(i);
            if (!SourceScanner.isIdentifierChar(c) && ".,()-".indexOf(c) < 0 && !Character.isWhitespace(c)) {
                return false;
            }
        }
        return true;
    }

    private static int findGuard(SourceScanner scanner, int from, int arrow) {
        int topLevel = scanner.findTopLevel(from, arrow, i -> scanner.isWordAt("if", i));
        return topLevel >= 0 && topLevel < arrow && scanner.isWordAt("if", topLevel) ? topLevel : -1;
    }

    private static boolean isStatementPosition(SourceScanner scanner, int keyword) {
        int prev = scanner.previousSignificant(keyword);
        if (prev < 0) {
            return true;
        }
        char c = scanner.charAt(prev);
        return c == ';' || c == '{' || c == '}';
    }

    private static List<int[]> splitTopLevel(SourceScanner scanner, int from, int to) {
        List<int[]> parts = new ArrayList<>();
        int start = from;
        while (start < to) {
            int comma = scanner.findTopLevel(start, to, i -> scanner.charAt(i) == ',');
            int end = comma < 0 ? to : comma;
            int partStart = scanner.skipTrivia(start);
            int partEnd = scanner.previousSignificant(end) + 1;
            if (partEnd > partStart) {
                parts.add(new int[] {partStart, partEnd});
            }
            if (comma < 0) {
                break;
            }
            start = comma + 1;
        }
        return parts;
    }

    private static SyntaxRewriteException error(SourceEditor editor, int index, String message) {
        Position at = editor.originalOf(index);
        return new SyntaxRewriteException(NAME, message, at.line(), at.column());
    }
}
