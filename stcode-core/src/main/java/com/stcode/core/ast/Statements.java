package com.stcode.core.ast;

import com.stcode.core.ast.Expressions.FunctionCall;
import com.stcode.core.render.Render;
import com.stcode.core.render.RenderContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Statement nodes.
 *
 * <p>Simple statements end with {@code ;}. Control statements close with their
 * {@code END_*} keyword and no semicolon. A {@code null} statement list stands for an
 * empty branch and renders no body line.
 */
public final class Statements {

    private Statements() {
        // Utility class - no instantiation
    }

    private static Meta orNone(Meta meta) {
        return Objects.requireNonNullElseGet(meta, Meta::none);
    }

    private static void body(List<String> lines, StatementList statements, RenderContext context) {
        if (statements != null) {
            lines.add(Render.indent(statements.render(context), context));
        }
    }

    private static String simple(Meta meta, String text) {
        return Render.commented(meta.comments(), text + ";");
    }

    /**
     * <pre>
     * IF cond THEN
     *     ...
     * ELSIF other THEN
     *     ...
     * ELSE
     *     ...
     * END_IF
     * </pre>
     */
    public record IfStatement(
        Expression condition,
        StatementList statements,
        List<ElseIfClause> elseIfs,
        ElseClause elseClause,
        Meta meta
    ) implements Statement {
        public IfStatement {
            Objects.requireNonNull(condition, "condition must not be null");
            elseIfs = elseIfs == null ? List.of() : List.copyOf(elseIfs);
            meta = orNone(meta);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.builder().add(condition, statements).addAll(elseIfs).add(elseClause).build();
        }

        @Override
        public String render(RenderContext context) {
            List<String> lines = new ArrayList<>();
            lines.add("IF " + condition.render(context) + " THEN");
            body(lines, statements, context);
            for (ElseIfClause elseIf : elseIfs) {
                lines.add(elseIf.render(context));
            }
            if (elseClause != null) {
                lines.add(elseClause.render(context));
            }
            lines.add("END_IF");
            return Render.commented(meta.comments(), String.join("\n", lines));
        }
    }

    public record ElseIfClause(Expression condition, StatementList statements, Meta meta) implements CommentConsumer {
        public ElseIfClause {
            Objects.requireNonNull(condition, "condition must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(condition, statements);
        }

        @Override
        public String render(RenderContext context) {
            List<String> lines = new ArrayList<>();
            lines.add("ELSIF " + condition.render(context) + " THEN");
            body(lines, statements, context);
            return Render.commented(meta.comments(), String.join("\n", lines));
        }
    }

    public record ElseClause(StatementList statements, Meta meta) implements CommentConsumer {
        public ElseClause {
            meta = orNone(meta);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(statements);
        }

        @Override
        public String render(RenderContext context) {
            List<String> lines = new ArrayList<>();
            lines.add("ELSE");
            body(lines, statements, context);
            return Render.commented(meta.comments(), String.join("\n", lines));
        }
    }

    public record CaseStatement(
        Expression expression,
        List<CaseElement> cases,
        ElseClause elseClause,
        Meta meta
    ) implements Statement {
        public CaseStatement {
            Objects.requireNonNull(expression, "expression must not be null");
            cases = List.copyOf(cases);
            meta = orNone(meta);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.builder().add(expression).addAll(cases).add(elseClause).build();
        }

        @Override
        public String render(RenderContext context) {
            List<String> lines = new ArrayList<>();
            lines.add("CASE " + expression.render(context) + " OF");
            for (CaseElement element : cases) {
                lines.add(Render.indent(element.render(context), context));
            }
            if (elseClause != null) {
                lines.add(Render.indent(elseClause.render(context), context));
            }
            lines.add("END_CASE");
            return Render.commented(meta.comments(), String.join("\n", lines));
        }
    }

    /**
     * Case branch.
     *
     * @param matches selector values: {@link Expression} or {@link Subrange} nodes
     */
    public record CaseElement(List<AstNode> matches, StatementList statements, Meta meta) implements CommentConsumer {
        public CaseElement {
            matches = List.copyOf(matches);
            if (matches.isEmpty()) {
                throw new IllegalArgumentException("matches must not be empty");
            }
            meta = orNone(meta);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.builder().addAll(matches).add(statements).build();
        }

        @Override
        public String render(RenderContext context) {
            List<String> lines = new ArrayList<>();
            lines.add(Render.join(matches, ", ", (AstNode m) -> m.render(context)) + ":");
            body(lines, statements, context);
            return Render.commented(meta.comments(), String.join("\n", lines));
        }
    }

    /**
     * @param step {@code BY} increment, {@code null} when omitted
     */
    public record ForStatement(
        String control,
        Expression from,
        Expression to,
        Expression step,
        StatementList statements,
        Meta meta
    ) implements Statement {
        public ForStatement {
            Objects.requireNonNull(control, "control must not be null");
            Objects.requireNonNull(from, "from must not be null");
            Objects.requireNonNull(to, "to must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(from, to, step, statements);
        }

        @Override
        public String render(RenderContext context) {
            String header = "FOR " + control + " := " + from.render(context) + " TO " + to.render(context);
            if (step != null) {
                header += " BY " + step.render(context);
            }
            List<String> lines = new ArrayList<>();
            lines.add(header + " DO");
            body(lines, statements, context);
            lines.add("END_FOR");
            return Render.commented(meta.comments(), String.join("\n", lines));
        }
    }

    public record WhileStatement(Expression condition, StatementList statements, Meta meta) implements Statement {
        public WhileStatement {
            Objects.requireNonNull(condition, "condition must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(condition, statements);
        }

        @Override
        public String render(RenderContext context) {
            List<String> lines = new ArrayList<>();
            lines.add("WHILE " + condition.render(context) + " DO");
            body(lines, statements, context);
            lines.add("END_WHILE");
            return Render.commented(meta.comments(), String.join("\n", lines));
        }
    }

    public record RepeatStatement(StatementList statements, Expression condition, Meta meta) implements Statement {
        public RepeatStatement {
            Objects.requireNonNull(condition, "condition must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(statements, condition);
        }

        @Override
        public String render(RenderContext context) {
            List<String> lines = new ArrayList<>();
            lines.add("REPEAT");
            body(lines, statements, context);
            lines.add("UNTIL " + condition.render(context));
            lines.add("END_REPEAT");
            return Render.commented(meta.comments(), String.join("\n", lines));
        }
    }

    /**
     * {@code a := b := expression;} with one or more targets.
     */
    public record AssignmentStatement(List<Expression> variables, Expression expression, Meta meta)
        implements Statement {
        public AssignmentStatement {
            variables = List.copyOf(variables);
            if (variables.isEmpty()) {
                throw new IllegalArgumentException("variables must not be empty");
            }
            Objects.requireNonNull(expression, "expression must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.builder().addAll(variables).add(expression).build();
        }

        @Override
        public String render(RenderContext context) {
            String targets = Render.join(variables, " := ", (Expression v) -> v.render(context));
            return simple(meta, targets + " := " + expression.render(context));
        }
    }

    public record SetStatement(Expression variable, Expression expression, Meta meta) implements Statement {
        public SetStatement {
            Objects.requireNonNull(variable, "variable must not be null");
            Objects.requireNonNull(expression, "expression must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(variable, expression);
        }

        @Override
        public String render(RenderContext context) {
            return simple(meta, variable.render(context) + " S= " + expression.render(context));
        }
    }

    public record ResetStatement(Expression variable, Expression expression, Meta meta) implements Statement {
        public ResetStatement {
            Objects.requireNonNull(variable, "variable must not be null");
            Objects.requireNonNull(expression, "expression must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(variable, expression);
        }

        @Override
        public String render(RenderContext context) {
            return simple(meta, variable.render(context) + " R= " + expression.render(context));
        }
    }

    public record ReferenceAssignmentStatement(Expression variable, Expression expression, Meta meta)
        implements Statement {
        public ReferenceAssignmentStatement {
            Objects.requireNonNull(variable, "variable must not be null");
            Objects.requireNonNull(expression, "expression must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(variable, expression);
        }

        @Override
        public String render(RenderContext context) {
            return simple(meta, variable.render(context) + " REF= " + expression.render(context));
        }
    }

    /**
     * Parameterless call {@code fbAxis.Reset();}.
     */
    public record MethodStatement(Expression method, Meta meta) implements Statement {
        public MethodStatement {
            Objects.requireNonNull(method, "method must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(method);
        }

        @Override
        public String render(RenderContext context) {
            return simple(meta, method.render(context) + "()");
        }
    }

    public record FunctionCallStatement(FunctionCall call, Meta meta) implements Statement {
        public FunctionCallStatement {
            Objects.requireNonNull(call, "call must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(call);
        }

        @Override
        public String render(RenderContext context) {
            return simple(meta, call.render(context));
        }
    }

    /**
     * Bare variable statement {@code fbTimer;}.
     */
    public record NoOpStatement(Expression variable, Meta meta) implements Statement {
        public NoOpStatement {
            Objects.requireNonNull(variable, "variable must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(variable);
        }

        @Override
        public String render(RenderContext context) {
            return simple(meta, variable.render(context));
        }
    }

    /**
     * Lone {@code ;}, as in {@code 4: ;} inside a {@code CASE}.
     */
    public record EmptyStatement(Meta meta) implements Statement {
        public EmptyStatement {
            meta = orNone(meta);
        }

        @Override
        public String render(RenderContext context) {
            return simple(meta, "");
        }
    }

    public record ExitStatement(Meta meta) implements Statement {
        public ExitStatement {
            meta = orNone(meta);
        }

        @Override
        public String render(RenderContext context) {
            return simple(meta, "EXIT");
        }
    }

    public record ReturnStatement(Meta meta) implements Statement {
        public ReturnStatement {
            meta = orNone(meta);
        }

        @Override
        public String render(RenderContext context) {
            return simple(meta, "RETURN");
        }
    }
}
