package org.javelin.transpiler.match;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the pattern text carried by a {@code .arm("...")} call.
 * <pre>
 * pattern  := '_' | binding | variant
 * variant  := [Union '.'] Tag [ '(' field (',' field)* ')' ]
 * field    := '_' | binding
 * tuple    := '(' pattern (',' pattern)* ')'
 * </pre>
 * A binding starts with a lower case letter, a tag with an upper case one.
 */
public final class PatternParser {

    private PatternParser() {
    }

    /**
     * Parses an arm pattern for a match over {@code arity} scrutinees. A lone {@code _} or
     * binding covers every column.
     *
     * @throws IllegalArgumentException if the text is not a valid pattern of that arity
     */
    public static List<Pattern> parseArm(String text, int arity) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("empty pattern");
        }
        if (arity > 1) {
            if (isIdentifier(trimmed) && !isTag(trimmed)) {
                Pattern all = parseColumn(trimmed);
                List<Pattern> columns = new ArrayList<>();
                for (int i = 0; i < arity; i++) {
                    columns.add(all);
                }
                return columns;
            }
            if (!trimmed.startsWith("(") || !trimmed.endsWith(")") || closingParen(trimmed, 0) != trimmed.length() - 1) {
                throw new IllegalArgumentException("expected a tuple pattern of " + arity + " elements, got '" + trimmed + "'");
            }
            List<String> parts = splitTopLevel(trimmed.substring(1, trimmed.length() - 1));
            if (parts.size() != arity) {
                throw new IllegalArgumentException("tuple pattern '" + trimmed + "' has " + parts.size() + " elements, expected " + arity);
            }
            List<Pattern> columns = new ArrayList<>();
            for (String part : parts) {
                columns.add(parseColumn(part));
            }
            return columns;
        }
        String single = trimmed;
        while (single.startsWith("(") && closingParen(single, 0) == single.length() - 1) {
            single = single.substring(1, single.length() - 1).trim();
        }
        return List.of(parseColumn(single));
    }

    public static Pattern parseColumn(String text) {
        String trimmed = text.trim();
        if (trimmed.equals("_")) {
            return new Pattern.Wildcard();
        }
        int paren = trimmed.indexOf('(');
        String head = paren < 0 ? trimmed : trimmed.substring(0, paren).trim();
        if (head.isEmpty()) {
            throw new IllegalArgumentException("nested tuple patterns are not supported: '" + trimmed + "'");
        }
        String qualifier = null;
        String tag = head;
        int dot = head.lastIndexOf('.');
        if (dot >= 0) {
            qualifier = head.substring(0, dot).trim();
            tag = head.substring(dot + 1).trim();
            if (!isQualifiedName(qualifier)) {
                throw new IllegalArgumentException("invalid union qualifier '" + qualifier + "'");
            }
        }
        if (!isIdentifier(tag)) {
            throw new IllegalArgumentException("invalid pattern '" + trimmed + "'");
        }
        if (paren < 0) {
            if (qualifier == null && !isTag(tag)) {
                return new Pattern.Binding(tag);
            }
            return new Pattern.Variant(qualifier, tag, List.of(), false);
        }
        if (!isTag(tag)) {
            throw new IllegalArgumentException("variant name '" + tag + "' must start with an upper case letter");
        }
        if (closingParen(trimmed, paren) != trimmed.length() - 1) {
            throw new IllegalArgumentException("unbalanced parentheses in pattern '" + trimmed + "'");
        }
        String inner = trimmed.substring(paren + 1, trimmed.length() - 1).trim();
        List<Pattern> fields = new ArrayList<>();
        if (!inner.isEmpty()) {
            for (String part : splitTopLevel(inner)) {
                Pattern field = parseColumn(part);
                if (field instanceof Pattern.Variant) {
                    throw new IllegalArgumentException("nested variant pattern '" + part.trim() + "' is not supported, bind it and match again");
                }
                fields.add(field);
            }
        }
        return new Pattern.Variant(qualifier, tag, fields, true);
    }

    private static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        for (String part : parts) {
            if (part.isBlank()) {
                throw new IllegalArgumentException("empty element in pattern '" + text + "'");
            }
        }
        return parts;
    }

    private static int closingParen(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return i;
            }
        }
        return -1;
    }

    static boolean isTag(String name) {
        return !name.isEmpty() && Character.isUpperCase(name.charAt(0));
    }

    private static boolean isIdentifier(String name) {
        if (name.isEmpty() || !Character.isJavaIdentifierStart(name.charAt(0))) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            if (!Character.isJavaIdentifierPart(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isQualifiedName(String name) {
        for (String part : name.split("\\.", -1)) {
            if (!isIdentifier(part.trim())) {
                return false;
            }
        }
        return true;
    }
}
