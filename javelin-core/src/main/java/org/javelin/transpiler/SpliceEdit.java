package org.javelin.transpiler;

import java.util.ArrayList;
import java.util.List;

import com.github.javaparser.Range;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.stmt.Statement;

/**
 * A region of the rewritten source, given by the range of the node that used to occupy it,
 * to be replaced by the printed {@code replacement} preceded by the {@code before}
 * statements.
 */
final class SpliceEdit {

    private final Range range;
    private Node replacement;
    private final List<Statement> before = new ArrayList<>();

    SpliceEdit(Range range, Node replacement) {
        this.range = range;
        this.replacement = replacement;
    }

    Range range() {
        return range;
    }

    Node replacement() {
        return replacement;
    }

    void retarget(Node replacement) {
        this.replacement = replacement;
    }

    List<Statement> before() {
        return before;
    }

    boolean contains(SpliceEdit other) {
        return range.contains(other.range);
    }
}
