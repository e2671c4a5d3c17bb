package com.stcode.core.ast;

import com.stcode.core.ast.Statements.CaseStatement;
import com.stcode.core.ast.Statements.EmptyStatement;
import com.stcode.core.ast.Statements.ForStatement;
import com.stcode.core.ast.Statements.IfStatement;
import com.stcode.core.ast.Statements.RepeatStatement;
import com.stcode.core.ast.Statements.WhileStatement;
import com.stcode.core.render.RenderContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered statements of a body or branch, rendered one per line.
 *
 * <p>Block statements take an optional {@code ;} after their closing keyword. When an
 * {@link EmptyStatement} follows one, the block is closed with {@code ;} so that the
 * empty statement survives a re-parse.
 */
public record StatementList(List<Statement> statements) implements AstNode {

    public StatementList {
        statements = List.copyOf(statements);
    }

    @Override
    public List<AstNode> children() {
        return List.copyOf(statements);
    }

    @Override
    public String render(RenderContext context) {
        List<String> lines = new ArrayList<>(statements.size());
        for (int i = 0; i < statements.size(); i++) {
            Statement statement = statements.get(i);
            String text = statement.render(context);
            boolean emptyNext = i + 1 < statements.size() && statements.get(i + 1) instanceof EmptyStatement;
            if (emptyNext && isBlock(statement)) {
                text += ";";
            }
            lines.add(text);
        }
        return String.join("\n", lines);
    }

    private static boolean isBlock(Statement statement) {
        return statement instanceof IfStatement
            || statement instanceof CaseStatement
            || statement instanceof ForStatement
            || statement instanceof WhileStatement
            || statement instanceof RepeatStatement;
    }
}
