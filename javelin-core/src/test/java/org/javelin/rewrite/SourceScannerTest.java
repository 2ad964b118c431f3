package org.javelin.rewrite;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SourceScannerTest {

    @Test
    void findWord_skipsCommentsStringsAndLongerIdentifiers() {
        String source = "// match here\n" +
                        "String s = \"match\"; /* match */ int matches = 0; char c = 'm';\n" +
                        "String t = \"\"\"\n  match\n  \"\"\";\n" +
                        "match";
        SourceScanner scanner = new SourceScanner(source);

        assertThat(scanner.findWord("match", 0)).isEqualTo(source.lastIndexOf("match"));
    }

    @Test
    void findWord_rejectsIdentifierPrefixes() {
        SourceScanner scanner = new SourceScanner("$match(x); rematch(y); match_all();");

        assertThat(scanner.findWord("match", 0)).isEqualTo(-1);
    }

    @Test
    void lineAndColumn_areOneBased() {
        SourceScanner scanner = new SourceScanner("ab\ncd\n\nef");

        assertThat(scanner.lineOf(0)).isEqualTo(1);
        assertThat(scanner.columnOf(1)).isEqualTo(2);
        assertThat(scanner.lineOf(3)).isEqualTo(2);
        assertThat(scanner.columnOf(3)).isEqualTo(1);
        assertThat(scanner.lineOf(7)).isEqualTo(4);
        assertThat(scanner.lineCount()).isEqualTo(4);
        assertThat(scanner.lineStart(2)).isEqualTo(3);
        assertThat(scanner.lineEnd(2)).isEqualTo(5);
        assertThat(scanner.lineEnd(4)).isEqualTo(9);
    }

    @Test
    void matchingClose_ignoresBracketsInLiterals() {
        String source = "(a, \")\", ')', f(b)) tail";
        SourceScanner scanner = new SourceScanner(source);

        assertThat(scanner.matchingClose(0)).isEqualTo(source.indexOf(" tail") - 1);
    }

    @Test
    void matchingClose_reportsMismatch() {
        SourceScanner scanner = new SourceScanner("{ f(a } ");

        assertThat(scanner.matchingClose(0)).isEqualTo(-1);
    }

    @Test
    void findTopLevel_stopsAtUnmatchedCloser() {
        String source = "a(b, c), d) e";
        SourceScanner scanner = new SourceScanner(source);

        assertThat(scanner.findTopLevel(0, source.length(), i -> source.charAt(i) == ',')).isEqualTo(7);
        assertThat(scanner.findTopLevel(8, source.length(), i -> source.charAt(i) == ';')).isEqualTo(10);
    }

    @Test
    void previousSignificant_skipsCommentsAndWhitespace() {
        String source = "x = 1; /* note */\n   y";
        SourceScanner scanner = new SourceScanner(source);

        assertThat(scanner.previousSignificant(source.indexOf('y'))).isEqualTo(source.indexOf(';'));
    }

    @Test
    void newlineHelpers() {
        assertThat(SourceScanner.countNewlines("a\nb\n\nc")).isEqualTo(3);
        assertThat(SourceScanner.newlinesOf(" \n x \n")).isEqualTo("\n\n");
        assertThat(SourceScanner.normalizeSpace("  Circle(  r,\n  _ ) ")).isEqualTo("Circle( r, _ )");
    }
}
