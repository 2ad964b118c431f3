package org.javelin.rewrite;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.IntPredicate;

/**
 * Lexical view of a source text that knows which characters belong to code and which to
 * comments or literals. Every keyword search done by a rewriter goes through this class so
 * that a {@code match} inside a string, a comment or a longer identifier is never rewritten.
 * <p>
 * Indices are 0-based offsets into the text; lines and columns are 1-based.
 */
public final class SourceScanner {

    private static final byte CODE = 0;
    private static final byte COMMENT = 1;
    private static final byte LITERAL = 2;

    private static final Set<String> OPERAND_KEYWORDS = Set.of(
            "return", "throw", "case", "yield", "else", "do", "assert", "new", "instanceof");

    private final String source;
    private final byte[] kinds;
    private final int[] lineStarts;

    public SourceScanner(String source) {
        this.source = source;
        this.kinds = classify(source);
        this.lineStarts = lineStarts(source);
    }

    public String source() {
        return source;
    }

    public int length() {
        return source.length();
    }

    public char charAt(int index) {
        return source.charAt(index);
    }

    public boolean isCode(int index) {
        return index >= 0 && index < kinds.length && kinds[index] == CODE;
    }

    public boolean isComment(int index) {
        return index >= 0 && index < kinds.length && kinds[index] == COMMENT;
    }

    public static boolean isIdentifierChar(char c) {
        return Character.isJavaIdentifierPart(c);
    }

    /**
     * Next offset at or after {@code from} where {@code word} occurs as a whole word in code.
     */
    public int findWord(String word, int from) {
        int i = source.indexOf(word, Math.max(from, 0));
        while (i >= 0) {
            if (isWordAt(word, i)) {
                return i;
            }
            i = source.indexOf(word, i + 1);
        }
        return -1;
    }

    public boolean isWordAt(String word, int index) {
        if (index < 0 || !source.startsWith(word, index)) {
            return false;
        }
        for (int k = index; k < index + word.length(); k++) {
            if (!isCode(k)) {
                return false;
            }
        }
        if (index > 0 && isIdentifierChar(source.charAt(index - 1))) {
            return false;
        }
        int end = index + word.length();
        return end >= source.length() || !isIdentifierChar(source.charAt(end));
    }

    /**
     * Skips whitespace and comments forward. Returns {@link #length()} at end of text.
     */
    public int skipTrivia(int index) {
        int i = index;
        while (i < source.length() && (isComment(i) || Character.isWhitespace(source.charAt(i)))) {
            i++;
        }
        return i;
    }

    /**
     * Offset of the last code character before {@code index} that is not whitespace, or -1.
     */
    public int previousSignificant(int index) {
        int i = Math.min(index, source.length()) - 1;
        while (i >= 0 && (isComment(i) || Character.isWhitespace(source.charAt(i)))) {
            i--;
        }
        return i;
    }

    /**
     * The identifier ending at {@code endInclusive}, or an empty string.
     */
    public String wordEndingAt(int endInclusive) {
        if (endInclusive < 0 || !isIdentifierChar(source.charAt(endInclusive))) {
            return "";
        }
        int start = endInclusive;
        while (start > 0 && isCode(start - 1) && isIdentifierChar(source.charAt(start - 1))) {
            start--;
        }
        return source.substring(start, endInclusive + 1);
    }

    public int identifierEnd(int index) {
        int i = index;
        if (i >= source.length() || !Character.isJavaIdentifierStart(source.charAt(i))) {
            return index;
        }
        while (i < source.length() && isIdentifierChar(source.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * Offset of the bracket closing the one at {@code openIndex}, or -1 when the text ends
     * first or a different closing bracket turns up.
     */
    public int matchingClose(int openIndex) {
        List<Character> expected = new ArrayList<>();
        for (int i = openIndex; i < source.length(); i++) {
            if (!isCode(i)) {
                continue;
            }
            char c = source.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                expected.add(closerOf(c));
            } else if (c == ')' || c == ']' || c == '}') {
                if (expected.isEmpty() || expected.remove(expected.size() - 1) != c) {
                    return -1;
                }
                if (expected.isEmpty()) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Offset of the bracket opening the one closed at {@code closeIndex}, or -1.
     */
    public int matchingOpen(int closeIndex) {
        List<Character> expected = new ArrayList<>();
        for (int i = closeIndex; i >= 0; i--) {
            if (!isCode(i)) {
                continue;
            }
            char c = source.charAt(i);
            if (c == ')' || c == ']' || c == '}') {
                expected.add(openerOf(c));
            } else if (c == '(' || c == '[' || c == '{') {
                if (expected.isEmpty() || expected.remove(expected.size() - 1) != c) {
                    return -1;
                }
                if (expected.isEmpty()) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Start of the primary expression that ends right before {@code before}: a chain of
     * names, literals, calls, index and member accesses such as {@code repo.find(id)[0]},
     * optionally preceded by {@code new}. Returns -1 when no such expression ends there.
     */
    public int operandStart(int before) {
        int i = previousSignificant(before);
        int start = -1;
        while (i >= 0) {
            char c = source.charAt(i);
            int segment;
            boolean group = false;
            if (!isCode(i)) {
                segment = i;
                while (segment > 0 && !isCode(segment - 1) && !isComment(segment - 1)) {
                    segment--;
                }
            } else if (c == ')' || c == ']') {
                segment = matchingOpen(i);
                if (segment < 0) {
                    return -1;
                }
                group = true;
            } else if (isIdentifierChar(c)) {
                segment = i;
                while (segment > 0 && isCode(segment - 1) && isIdentifierChar(source.charAt(segment - 1))) {
                    segment--;
                }
                if (OPERAND_KEYWORDS.contains(source.substring(segment, i + 1))) {
                    break;
                }
            } else {
                break;
            }
            start = segment;
            int prev = previousSignificant(segment);
            if (prev < 0) {
                break;
            }
            char p = source.charAt(prev);
            if (p == '.' && isCode(prev)) {
                i = previousSignificant(prev);
            } else if (group && isCode(prev) && (isIdentifierChar(p) || p == ')' || p == ']') &&
                       !OPERAND_KEYWORDS.contains(wordEndingAt(prev))) {
                i = prev;
            } else {
                if (!group && isWordAt("new", prev - 2)) {
                    start = prev - 2;
                }
                break;
            }
        }
        return start;
    }

    /**
     * End (exclusive) of the primary expression starting at the first code character at or
     * after {@code from}; see {@link #operandStart(int)}. A leading minus sign is accepted
     * before a number. Returns -1 when no such expression starts there.
     */
    public int operandEnd(int from) {
        int i = skipTrivia(from);
        if (i < source.length() && source.charAt(i) == '-' && i + 1 < source.length() && Character.isDigit(source.charAt(i + 1))) {
            i++;
        }
        if (isWordAt("new", i)) {
            i = typeEnd(skipTrivia(i + "new".length()));
            i = skipTrivia(i);
            if (i >= source.length() || (source.charAt(i) != '(' && source.charAt(i) != '[')) {
                return -1;
            }
        }
        return chainEnd(i);
    }

    /**
     * End (exclusive) of the member chain starting at {@code from}, or -1 if none starts there.
     */
    public int chainEnd(int from) {
        int i = from;
        int end = -1;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (!isCode(i) && !isComment(i)) {
                int j = i;
                while (j < source.length() && !isCode(j) && !isComment(j)) {
                    j++;
                }
                end = j;
            } else if (c == '(' || c == '[') {
                int close = matchingClose(i);
                if (close < 0) {
                    return -1;
                }
                end = close + 1;
            } else if (isIdentifierChar(c)) {
                int j = i;
                while (j < source.length() && isIdentifierChar(source.charAt(j))) {
                    j++;
                }
                end = j;
            } else {
                break;
            }
            int next = skipTrivia(end);
            if (next < source.length() && isCode(next) && source.charAt(next) == '.' &&
                (next + 1 >= source.length() || source.charAt(next + 1) != '.')) {
                i = skipTrivia(next + 1);
            } else if (next < source.length() && isCode(next) && (source.charAt(next) == '(' || source.charAt(next) == '[')) {
                i = next;
            } else {
                break;
            }
        }
        return end;
    }

    // a type name after new: dotted identifiers and type arguments
    private int typeEnd(int from) {
        int i = from;
        int angle = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '<') {
                angle++;
            } else if (c == '>' && angle > 0) {
                angle--;
            } else if (!(isIdentifierChar(c) || c == '.' || c == '?' || (angle > 0 && (c == ',' || Character.isWhitespace(c))))) {
                break;
            }
            i++;
        }
        return i;
    }

    /**
     * First offset in {@code [from, limit)} at bracket depth zero whose character satisfies
     * {@code target}. Returns -1 if none is found, or the offset of an unmatched closing
     * bracket if one ends the region first.
     */
    public int findTopLevel(int from, int limit, IntPredicate target) {
        int depth = 0;
        for (int i = from; i < limit; i++) {
            if (!isCode(i)) {
                continue;
            }
            char c = source.charAt(i);
            if (depth == 0 && target.test(i)) {
                return i;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
        }
        return -1;
    }

    public int lineOf(int index) {
        int lo = 0;
        int hi = lineStarts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lineStarts[mid] <= index) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo + 1;
    }

    public int columnOf(int index) {
        return index - lineStarts[lineOf(index) - 1] + 1;
    }

    public int lineStart(int line) {
        return lineStarts[line - 1];
    }

    /**
     * Offset of the line terminator of {@code line}, or {@link #length()} for the last line.
     */
    public int lineEnd(int line) {
        return line < lineStarts.length ? lineStarts[line] - 1 : source.length();
    }

    public int lineCount() {
        return lineStarts.length;
    }

    public static int countNewlines(CharSequence text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }

    public static String newlinesOf(CharSequence text) {
        return "\n".repeat(countNewlines(text));
    }

    /**
     * Collapses whitespace runs to single spaces and trims.
     */
    public static String normalizeSpace(String text) {
        return text.trim().replaceAll("\\s+", " ");
    }

    private static char closerOf(char open) {
        switch (open) {
            case '(':
                return ')';
            case '[':
                return ']';
            default:
                return '}';
        }
    }

    private static char openerOf(char close) {
        switch (close) {
            case ')':
                return '(';
            case ']':
                return '[';
            default:
                return '{';
        }
    }

    private static int[] lineStarts(String source) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    private static byte[] classify(String source) {
        byte[] kinds = new byte[source.length()];
        int i = 0;
        int n = source.length();
        while (i < n) {
            char c = source.charAt(i);
            if (c == '/' && i + 1 < n && source.charAt(i + 1) == '/') {
                int end = source.indexOf('\n', i);
                end = end < 0 ? n : end;
                fill(kinds, i, end, COMMENT);
                i = end;
            } else if (c == '/' && i + 1 < n && source.charAt(i + 1) == '*') {
                int end = source.indexOf("*/", i + 2);
                end = end < 0 ? n : end + 2;
                fill(kinds, i, end, COMMENT);
                i = end;
            } else if (source.startsWith("\"\"\"", i)) {
                int end = textBlockEnd(source, i + 3);
                fill(kinds, i, end, LITERAL);
                i = end;
            } else if (c == '"' || c == '\'') {
                int end = quotedEnd(source, i + 1, c);
                fill(kinds, i, end, LITERAL);
                i = end;
            } else {
                i++;
            }
        }
        return kinds;
    }

    private static int textBlockEnd(String source, int from) {
        int i = from;
        while (i < source.length()) {
            if (source.charAt(i) == '\\') {
                i += 2;
            } else if (source.startsWith("\"\"\"", i)) {
                return i + 3;
            } else {
                i++;
            }
        }
        return source.length();
    }

    private static int quotedEnd(String source, int from, char quote) {
        int i = from;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == quote) {
                return i + 1;
            } else if (c == '\n') {
                // unterminated literal, the parser reports it
                return i;
            } else {
                i++;
            }
        }
        return source.length();
    }

    private static void fill(byte[] kinds, int from, int to, byte kind) {
        for (int k = from; k < Math.min(to, kinds.length); k++) {
            kinds[k] = kind;
        }
    }
}
