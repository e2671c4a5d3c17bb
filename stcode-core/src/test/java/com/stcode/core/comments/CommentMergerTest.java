package com.stcode.core.comments;

import com.stcode.core.ast.Expressions.SymbolicVariable;
import com.stcode.core.ast.Literals.IntegerLiteral;
import com.stcode.core.ast.Meta;
import com.stcode.core.ast.StatementList;
import com.stcode.core.ast.Statements.AssignmentStatement;
import com.stcode.core.ast.Statements.ElseClause;
import com.stcode.core.ast.Statements.IfStatement;
import com.stcode.core.ast.Statements.ReturnStatement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CommentMerger}.
 */
class CommentMergerTest {

    private final CommentMerger merger = new CommentMerger();

    private static AssignmentStatement assignment(int line) {
        return new AssignmentStatement(List.of(SymbolicVariable.of("x")), IntegerLiteral.decimal("1"),
            new Meta(line, line, 0, 0));
    }

    private static SourceComment comment(String text, int line) {
        return new SourceComment(CommentKind.COMMENT, text, line, 0);
    }

    @Test
    void merge_nestedClauses_walksChildrenInSourceOrder() {
        AssignmentStatement thenBranch = assignment(2);
        AssignmentStatement elseBranch = assignment(5);
        ElseClause elseClause = new ElseClause(new StatementList(List.of(elseBranch)), new Meta(4, 5, 0, 0));
        IfStatement statement = new IfStatement(SymbolicVariable.of("bReady"),
            new StatementList(List.of(thenBranch)), List.of(), elseClause, new Meta(1, 6, 0, 0));

        List<SourceComment> left = merger.merge(statement,
            List.of(comment("// then", 2), comment("// before else", 3), comment("// else body", 5)));

        assertThat(left).isEmpty();
        assertThat(statement.meta().comments()).isEmpty();
        assertThat(thenBranch.meta().comments()).containsExactly("// then");
        assertThat(elseClause.meta().comments()).containsExactly("// before else");
        assertThat(elseBranch.meta().comments()).containsExactly("// else body");
    }

    @Test
    void merge_commentsBeforeNodes_attachToFirstFollowingNode() {
        AssignmentStatement first = assignment(2);
        AssignmentStatement second = assignment(5);
        StatementList statements = new StatementList(List.of(first, second));

        List<SourceComment> left = merger.merge(statements,
            List.of(comment("// a", 1), comment("// b", 3), comment("// c", 4)));

        assertThat(left).isEmpty();
        assertThat(first.meta().comments()).containsExactly("// a");
        assertThat(second.meta().comments()).containsExactly("// b", "// c");
    }

    @Test
    void merge_commentOnSameLine_attachesToThatNode() {
        AssignmentStatement statement = assignment(3);

        merger.merge(statement, List.of(comment("// same line", 3)));

        assertThat(statement.meta().comments()).containsExactly("// same line");
    }

    @Test
    void merge_commentsAfterLastNode_areReturned() {
        ReturnStatement statement = new ReturnStatement(new Meta(1, 1, 0, 6));

        List<SourceComment> left = merger.merge(statement, List.of(comment("// tail", 2)));

        assertThat(left).extracting(SourceComment::text).containsExactly("// tail");
        assertThat(statement.meta().commentsAttached()).isFalse();
    }

    @Test
    void merge_sameTreeTwice_failsOnAttachedNode() {
        AssignmentStatement statement = assignment(2);
        merger.merge(statement, List.of(comment("// once", 1)));

        assertThatThrownBy(() -> merger.merge(statement, List.of(comment("// twice", 1))))
            .isInstanceOf(IllegalStateException.class);
    }
}
