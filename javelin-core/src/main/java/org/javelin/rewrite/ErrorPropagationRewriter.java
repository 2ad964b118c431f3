package org.javelin.rewrite;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.javelin.SyntaxRewriteException;
import org.javelin.mapping.Mapping;
import org.javelin.mapping.MappingTag;
import org.javelin.mapping.Position;

/**
 * Expands the statement-level postfix {@code ?} operator on {@code Result} values:
 * <pre>
 * let cfg = readConfig(path)?;
 * </pre>
 * becomes, on the same line,
 * <pre>
 * let __try0 = readConfig(path); if (__try0.isErr()) { return __try0.propagate(); } let cfg = __try0.unwrap();
 * </pre>
 * The temporaries are {@code let} bindings, so this rewriter must run before the keyword pass.
 */
public class ErrorPropagationRewriter implements Rewriter {

    public static final String TEMP_PREFIX = "__try";

    static final String NAME = "error-propagation";

    private static final List<String> PARENTHESIZED_HEADS = List.of("if", "while", "for");
    private static final List<String> BARE_HEADS = List.of("else", "do");

    private static final Pattern TEMP_NAME = Pattern.compile("\\b" + TEMP_PREFIX + "(\\d{1,9})\\b");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RewriteResult rewrite(String source, List<Mapping> mappings) {
        SourceScanner scanner = new SourceScanner(source);
        SourceEditor editor = new SourceEditor(NAME, scanner, mappings);
        TempNames names = new TempNames(source);

        for (int i = 0; i < scanner.length(); i++) {
            if (scanner.charAt(i) != '?' || !scanner.isCode(i)) {
                continue;
            }
            int semicolon = scanner.skipTrivia(i + 1);
            if (semicolon >= scanner.length() || scanner.charAt(semicolon) != ';') {
                continue;
            }
            int operand = scanner.previousSignificant(i);
            if (operand < 0 || !(SourceScanner.isIdentifierChar(scanner.charAt(operand)) || scanner.charAt(operand) == ')' || scanner.charAt(operand) == ']')) {
                throw error(editor, i, "'?' must follow an expression");
            }
            int start = statementStart(scanner, i);
            int body = skipControlHeads(scanner, start, i);
            if (body > start) {
                // the expansion is several statements, keep them under the if/else/loop/case
                editor.insert(body, "{ ");
                rewriteStatement(editor, body, i, semicolon, names.next());
                editor.insert(semicolon + 1, " }");
            } else {
                rewriteStatement(editor, start, i, semicolon, names.next());
            }
            i = semicolon;
        }
        return editor.finish();
    }

    private void rewriteStatement(SourceEditor editor, int start, int question, int semicolon, String temp) {
        SourceScanner scanner = editor.scanner();
        String check = "; if (" + temp + ".isErr()) { return " + temp + ".propagate(); }";

        if (scanner.isWordAt("return", start)) {
            int exprStart = scanner.skipTrivia(start + "return".length());
            String head = "let " + temp + " = ";
            editor.replace(start, exprStart, head + SourceScanner.newlinesOf(scanner.source().substring(start, exprStart)))
                  .anchor(0, start, "return".length(), MappingTag.STATEMENT);
            anchorOperand(editor, exprStart, question);
            String tail = check + " return " + temp + ".unwrap();";
            editor.replace(question, semicolon + 1, tail + SourceScanner.newlinesOf(scanner.source().substring(question, semicolon)))
                  .anchor(2, question, 1, MappingTag.MARKER)
                  .anchor(check.length() + 1, start, "return".length(), MappingTag.TOKEN);
            return;
        }

        int assign = scanner.findTopLevel(start, question, i -> isAssignment(scanner, i));
        if (assign >= 0 && scanner.charAt(assign) == '=') {
            int exprStart = scanner.skipTrivia(assign + 1);
            String lhs = SourceScanner.normalizeSpace(scanner.source().substring(start, assign + 1));
            String head = "let " + temp + " = ";
            editor.replace(start, exprStart, head + SourceScanner.newlinesOf(scanner.source().substring(start, exprStart)))
                  .anchor(4, assign, 1, MappingTag.MARKER);
            anchorOperand(editor, exprStart, question);
            String tail = check + " " + lhs + " " + temp + ".unwrap();";
            editor.replace(question, semicolon + 1, tail + SourceScanner.newlinesOf(scanner.source().substring(question, semicolon)))
                  .anchor(2, question, 1, MappingTag.MARKER)
                  .anchor(check.length() + 1, start, lhs.length(), MappingTag.STATEMENT);
            return;
        }

        // bare statement, only the early return is needed
        editor.insert(start, "let " + temp + " = ").anchor(4, start, 1, MappingTag.MARKER);
        anchorOperand(editor, start, question);
        editor.replace(question, semicolon + 1, check + SourceScanner.newlinesOf(scanner.source().substring(question, semicolon)))
              .anchor(2, question, 1, MappingTag.MARKER);
    }

    private static void anchorOperand(SourceEditor editor, int exprStart, int question) {
        int exprEnd = editor.scanner().previousSignificant(question) + 1;
        if (exprEnd > exprStart) {
            editor.anchorSource(exprStart, exprEnd - exprStart, MappingTag.EXPRESSION);
        }
    }

    /**
     * First code offset of the statement containing {@code index}.
     */
    static int statementStart(SourceScanner scanner, int index) {
        int depth = 0;
        for (int i = index - 1; i >= 0; i--) {
            if (!scanner.isCode(i)) {
                continue;
            }
            char c = scanner.charAt(i);
            if (c == ')' || c == ']') {
                depth++;
            } else if (c == '}') {
                if (depth == 0) {
                    return scanner.skipTrivia(i + 1);
                }
                depth++;
            } else if (c == '(' || c == '[' || c == '{') {
                if (depth == 0) {
                    return scanner.skipTrivia(i + 1);
                }
                depth--;
            } else if (c == ';' && depth == 0) {
                return scanner.skipTrivia(i + 1);
            }
        }
        return scanner.skipTrivia(0);
    }

    /**
     * Offset of the statement proper once unbraced control heads in front of it, such as
     * {@code if (flag)}, {@code else}, {@code while (c)} or {@code case A ->}, are skipped.
     */
    static int skipControlHeads(SourceScanner scanner, int start, int limit) {
        int at = start;
        while (at < limit) {
            int next = skipControlHead(scanner, at, limit);
            if (next == at) {
                break;
            }
            at = next;
        }
        return at;
    }

    private static int skipControlHead(SourceScanner scanner, int at, int limit) {
        for (String keyword : PARENTHESIZED_HEADS) {
            if (scanner.isWordAt(keyword, at)) {
                int open = scanner.skipTrivia(at + keyword.length());
                if (open >= limit || scanner.charAt(open) != '(') {
                    return at;
                }
                int close = scanner.matchingClose(open);
                return close < 0 || close >= limit ? at : scanner.skipTrivia(close + 1);
            }
        }
        for (String keyword : BARE_HEADS) {
            if (scanner.isWordAt(keyword, at)) {
                return scanner.skipTrivia(at + keyword.length());
            }
        }
        if (scanner.isWordAt("case", at) || scanner.isWordAt("default", at)) {
            int label = scanner.findTopLevel(at, limit, i -> isLabelEnd(scanner, i, limit));
            if (label < 0 || label >= limit || !isLabelEnd(scanner, label, limit)) {
                return at;
            }
            return scanner.skipTrivia(label + (scanner.charAt(label) == ':' ? 1 : 2));
        }
        return at;
    }

    private static boolean isLabelEnd(SourceScanner scanner, int i, int limit) {
        char c = scanner.charAt(i);
        if (c == ':') {
            return (i + 1 >= limit || scanner.charAt(i + 1) != ':') && (i == 0 || scanner.charAt(i - 1) != ':');
        }
        return c == '-' && i + 1 < limit && scanner.charAt(i + 1) == '>';
    }

    private static boolean isAssignment(SourceScanner scanner, int i) {
        if (scanner.charAt(i) != '=') {
            return false;
        }
        if (i + 1 < scanner.length() && (scanner.charAt(i + 1) == '=' || scanner.charAt(i + 1) == '>')) {
            return false;
        }
        return i == 0 || "=!<>".indexOf(scanner.charAt(i - 1)) < 0 || isShiftAssignment(scanner, i);
    }

    private static boolean isShiftAssignment(SourceScanner scanner, int i) {
        return i >= 2 && (scanner.source().startsWith("<<", i - 2) || scanner.source().startsWith(">>", i - 2));
    }

    private static SyntaxRewriteException error(SourceEditor editor, int index, String message) {
        Position at = editor.originalOf(index);
        return new SyntaxRewriteException(NAME, message, at.line(), at.column());
    }

    /**
     * Hands out {@code __tryN} names that do not occur anywhere in the file.
     */
    private static final class TempNames {
        private final Set<Integer> taken = new HashSet<>();
        private int counter;

        TempNames(String source) {
            Matcher m = TEMP_NAME.matcher(source);
            while (m.find()) {
                taken.add(Integer.parseInt(m.group(1)));
            }
        }

        String next() {
            while (taken.contains(counter)) {
                counter++;
            }
            return TEMP_PREFIX + counter++;
        }
    }
}
