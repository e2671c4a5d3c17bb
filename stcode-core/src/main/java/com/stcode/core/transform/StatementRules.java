package com.stcode.core.transform;

import com.stcode.core.ast.AstNode;
import com.stcode.core.ast.Expression;
import com.stcode.core.ast.Expressions.FunctionCall;
import com.stcode.core.ast.Statement;
import com.stcode.core.ast.StatementList;
import com.stcode.core.ast.Statements.AssignmentStatement;
import com.stcode.core.ast.Statements.CaseElement;
import com.stcode.core.ast.Statements.CaseStatement;
import com.stcode.core.ast.Statements.ElseClause;
import com.stcode.core.ast.Statements.ElseIfClause;
import com.stcode.core.ast.Statements.EmptyStatement;
import com.stcode.core.ast.Statements.ExitStatement;
import com.stcode.core.ast.Statements.ForStatement;
import com.stcode.core.ast.Statements.FunctionCallStatement;
import com.stcode.core.ast.Statements.IfStatement;
import com.stcode.core.ast.Statements.MethodStatement;
import com.stcode.core.ast.Statements.NoOpStatement;
import com.stcode.core.ast.Statements.ReferenceAssignmentStatement;
import com.stcode.core.ast.Statements.RepeatStatement;
import com.stcode.core.ast.Statements.ResetStatement;
import com.stcode.core.ast.Statements.ReturnStatement;
import com.stcode.core.ast.Statements.SetStatement;
import com.stcode.core.ast.Statements.WhileStatement;
import com.stcode.core.ast.Subrange;

import java.util.ArrayList;
import java.util.List;

/**
 * Handlers for statements and statement lists.
 */
final class StatementRules {

    private StatementRules() {
    }

    static void register(HandlerRegistry registry) {
        registry
            .passThrough("statement", "case_list_element")
            .register("statement_list", c -> new StatementList(c.all(Statement.class)))
            .register("assignment_statement", StatementRules::assignment)
            .register("set_statement", c -> {
                List<Expression> operands = c.exactly(Expression.class, 2);
                return new SetStatement(operands.get(0), operands.get(1), c.meta());
            })
            .register("reset_statement", c -> {
                List<Expression> operands = c.exactly(Expression.class, 2);
                return new ResetStatement(operands.get(0), operands.get(1), c.meta());
            })
            .register("reference_assignment_statement", c -> {
                List<Expression> operands = c.exactly(Expression.class, 2);
                return new ReferenceAssignmentStatement(operands.get(0), operands.get(1), c.meta());
            })
            .register("method_statement", c -> new MethodStatement(c.node(Expression.class), c.meta()))
            .register("function_call_statement", c -> new FunctionCallStatement(
                c.node(FunctionCall.class), c.meta()))
            .register("no_op_statement", c -> new NoOpStatement(c.node(Expression.class), c.meta()))
            .register("empty_statement", c -> new EmptyStatement(c.meta()))
            .register("exit_statement", c -> new ExitStatement(c.meta()))
            .register("return_statement", c -> new ReturnStatement(c.meta()))
            .register("if_statement", StatementRules::ifStatement)
            .register("else_if_clause", c -> new ElseIfClause(
                c.node(Expression.class), c.optional(StatementList.class), c.meta()))
            .register("else_clause", c -> new ElseClause(c.optional(StatementList.class), c.meta()))
            .register("case_statement", StatementRules::caseStatement)
            .register("case_element", StatementRules::caseElement)
            .register("for_statement", StatementRules::forStatement)
            .register("while_statement", c -> new WhileStatement(
                c.node(Expression.class), c.optional(StatementList.class), c.meta()))
            .register("repeat_statement", c -> new RepeatStatement(
                c.optional(StatementList.class), c.node(Expression.class), c.meta()));
    }

    /**
     * Every expression but the last is an assignment target.
     */
    private static AssignmentStatement assignment(Children c) {
        List<Expression> expressions = c.all(Expression.class);
        if (expressions.size() < 2) {
            throw c.failure("assignment needs a target and a value");
        }
        int last = expressions.size() - 1;
        return new AssignmentStatement(expressions.subList(0, last), expressions.get(last), c.meta());
    }

    private static IfStatement ifStatement(Children c) {
        List<AstNode> clauses = new ArrayList<>();
        for (Object item : c.items()) {
            if (item instanceof ElseIfClause || item instanceof ElseClause) {
                clauses.add((AstNode) item);
            }
        }
        return new IfStatement(c.node(Expression.class), c.optional(StatementList.class),
            c.all(ElseIfClause.class), trailingElse(clauses), c.meta());
    }

    private static CaseStatement caseStatement(Children c) {
        List<AstNode> clauses = new ArrayList<>();
        for (Object item : c.items()) {
            if (item instanceof CaseElement || item instanceof ElseClause) {
                clauses.add((AstNode) item);
            }
        }
        return new CaseStatement(c.node(Expression.class), c.all(CaseElement.class), trailingElse(clauses),
            c.meta());
    }

    /**
     * The else clause is present only when the clause list is non-empty and ends with one.
     */
    static ElseClause trailingElse(List<? extends AstNode> clauses) {
        if (!clauses.isEmpty() && clauses.get(clauses.size() - 1) instanceof ElseClause) {
            return (ElseClause) clauses.get(clauses.size() - 1);
        }
        return null;
    }

    private static CaseElement caseElement(Children c) {
        List<AstNode> matches = new ArrayList<>();
        for (Object item : c.items()) {
            if (item instanceof Expression || item instanceof Subrange) {
                matches.add((AstNode) item);
            }
        }
        return new CaseElement(matches, c.optional(StatementList.class), c.meta());
    }

    private static ForStatement forStatement(Children c) {
        List<Expression> bounds = c.all(Expression.class);
        if (bounds.size() != 2 && bounds.size() != 3) {
            throw c.failure("expected start, end and optional step");
        }
        return new ForStatement(c.tokenText("IDENTIFIER"), bounds.get(0), bounds.get(1),
            bounds.size() == 3 ? bounds.get(2) : null, c.optional(StatementList.class), c.meta());
    }
}
