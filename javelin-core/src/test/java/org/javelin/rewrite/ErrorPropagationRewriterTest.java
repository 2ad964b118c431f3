package org.javelin.rewrite;

import java.util.List;

import org.javelin.SyntaxRewriteException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ErrorPropagationRewriterTest {

    private final ErrorPropagationRewriter rewriter = new ErrorPropagationRewriter();

    private String rewrite(String source) {
        return rewriter.rewrite(source, List.of()).source();
    }

    @Test
    void binding_unwrapsAfterEarlyReturn() {
        assertThat(rewrite("let cfg = readConfig(path)?;"))
            .isEqualTo("let __try0 = readConfig(path); if (__try0.isErr()) { return __try0.propagate(); } let cfg = __try0.unwrap();");
    }

    @Test
    void returnStatement_returnsUnwrappedValue() {
        assertThat(rewrite("return parse(text)?;"))
            .isEqualTo("let __try0 = parse(text); if (__try0.isErr()) { return __try0.propagate(); } return __try0.unwrap();");
    }

    @Test
    void bareStatement_onlyPropagates() {
        assertThat(rewrite("validate(input)?;"))
            .isEqualTo("let __try0 = validate(input); if (__try0.isErr()) { return __try0.propagate(); }");
    }

    @Test
    void unbracedIfBody_keepsTheCallUnderTheCondition() {
        assertThat(rewrite("if (flag) x = load()?;"))
            .isEqualTo("if (flag) { let __try0 = load(); if (__try0.isErr()) { return __try0.propagate(); } x = __try0.unwrap(); }");
    }

    @Test
    void ifElseBranches_areEachWrapped() {
        assertThat(rewrite("if (ok) return parse(t)?; else x = load()?;"))
            .isEqualTo("if (ok) { let __try0 = parse(t); if (__try0.isErr()) { return __try0.propagate(); } return __try0.unwrap(); }" +
                       " else { let __try1 = load(); if (__try1.isErr()) { return __try1.propagate(); } x = __try1.unwrap(); }");
    }

    @Test
    void loopAndCaseBodies_areWrapped() {
        assertThat(rewrite("while (more()) step()?;"))
            .isEqualTo("while (more()) { let __try0 = step(); if (__try0.isErr()) { return __try0.propagate(); } }");
        assertThat(rewrite("case A -> total = add(total)?;"))
            .isEqualTo("case A -> { let __try0 = add(total); if (__try0.isErr()) { return __try0.propagate(); } total = __try0.unwrap(); }");
    }

    @Test
    void temporaries_avoidNamesAlreadyInTheFile() {
        String rewritten = rewrite("int __try0 = 1;\nlet a = f()?;\nlet b = g()?;");

        assertThat(rewritten).contains("let __try1 = f();").contains("let __try2 = g();");
    }

    @Test
    void ternaryAndStrings_areUntouched() {
        String source = "int x = ready ? 1 : 2; String s = \"what?;\";";

        assertThat(rewrite(source)).isEqualTo(source);
    }

    @Test
    void lineCount_isPreserved() {
        String rewritten = rewrite("void run() {\n  let v = load(\n      name)?;\n}");

        assertThat(rewritten.split("\n", -1)).hasSize(4);
    }

    @Test
    void danglingQuestionMark_isRejected() {
        assertThatThrownBy(() -> rewrite("x = ?;"))
            .isInstanceOf(SyntaxRewriteException.class)
            .hasMessageContaining("'?' must follow an expression");
    }
}
