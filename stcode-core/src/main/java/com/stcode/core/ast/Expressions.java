package com.stcode.core.ast;

import com.stcode.core.render.Render;
import com.stcode.core.render.RenderContext;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Expression nodes: variables, operators and calls.
 */
public final class Expressions {

    private Expressions() {
        // Utility class - no instantiation
    }

    /**
     * Plain variable reference, optionally dereferenced ({@code pValue^}).
     */
    public record SymbolicVariable(String name, boolean dereferenced) implements Expression {
        public SymbolicVariable {
            Objects.requireNonNull(name, "name must not be null");
        }

        public static SymbolicVariable of(String name) {
            return new SymbolicVariable(name, false);
        }

        @Override
        public String render(RenderContext context) {
            return dereferenced ? name + "^" : name;
        }
    }

    /**
     * Array subscript ({@code [i, j]}) inside a multi-element variable.
     */
    public record SubscriptList(List<Expression> subscripts, boolean dereferenced) implements AstNode {
        public SubscriptList {
            subscripts = List.copyOf(subscripts);
            if (subscripts.isEmpty()) {
                throw new IllegalArgumentException("subscripts must not be empty");
            }
        }

        @Override
        public List<AstNode> children() {
            return List.copyOf(subscripts);
        }

        @Override
        public String render(RenderContext context) {
            String text = "[" + Render.join(subscripts, ", ", (Expression e) -> e.render(context)) + "]";
            return dereferenced ? text + "^" : text;
        }
    }

    /**
     * Member access ({@code .field}) or bit access ({@code .3}).
     */
    public record FieldSelector(String field, boolean dereferenced) implements AstNode {
        public FieldSelector {
            Objects.requireNonNull(field, "field must not be null");
        }

        @Override
        public String render(RenderContext context) {
            return "." + field + (dereferenced ? "^" : "");
        }
    }

    /**
     * Variable followed by a chain of subscripts and field selectors, such as
     * {@code stAxis.aPos[1]^.fValue}.
     *
     * @param variable head of the chain
     * @param elements {@link SubscriptList} and {@link FieldSelector} nodes in source order
     */
    public record MultiElementVariable(SymbolicVariable variable, List<AstNode> elements) implements Expression {
        public MultiElementVariable {
            Objects.requireNonNull(variable, "variable must not be null");
            elements = List.copyOf(elements);
            for (AstNode element : elements) {
                if (!(element instanceof SubscriptList) && !(element instanceof FieldSelector)) {
                    throw new IllegalArgumentException("Unexpected variable element: " + element);
                }
            }
        }

        @Override
        public List<AstNode> children() {
            return Nodes.builder().add(variable).addAll(elements).build();
        }

        @Override
        public String render(RenderContext context) {
            return variable.render(context) + Render.join(elements, "", (AstNode e) -> e.render(context));
        }
    }

    /**
     * Directly represented variable mapped to a hardware address, such as {@code %IX0.1}.
     *
     * @param locationPrefix input, output or memory area
     * @param sizePrefix access width, {@link SizePrefix#BIT} when the source omits it
     * @param location leading address number
     * @param bits further dotted address parts
     */
    public record DirectVariable(
        LocationPrefix locationPrefix,
        SizePrefix sizePrefix,
        String location,
        List<String> bits
    ) implements Expression {
        public DirectVariable {
            Objects.requireNonNull(locationPrefix, "locationPrefix must not be null");
            Objects.requireNonNull(location, "location must not be null");
            sizePrefix = sizePrefix == null ? SizePrefix.BIT : sizePrefix;
            bits = bits == null ? List.of() : List.copyOf(bits);
        }

        @Override
        public String render(RenderContext context) {
            StringBuilder text = new StringBuilder("%")
                .append(locationPrefix.code())
                .append(sizePrefix.code())
                .append(location);
            for (String bit : bits) {
                text.append('.').append(bit);
            }
            return text.toString();
        }
    }

    /**
     * Prefix operator: {@code -}, {@code +} or {@code NOT}.
     */
    public record UnaryOperation(String operator, Expression expression) implements Expression {
        public UnaryOperation {
            operator = Objects.requireNonNull(operator, "operator must not be null").toUpperCase(Locale.ROOT);
            Objects.requireNonNull(expression, "expression must not be null");
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(expression);
        }

        @Override
        public String render(RenderContext context) {
            String operand = expression.render(context);
            return "NOT".equals(operator) ? "NOT " + operand : operator + operand;
        }
    }

    /**
     * Infix operation. Chains of equal precedence nest to the left:
     * {@code a + b + c} is {@code BinaryOperation(BinaryOperation(a, +, b), +, c)}.
     */
    public record BinaryOperation(Expression left, String operator, Expression right) implements Expression {
        public BinaryOperation {
            Objects.requireNonNull(left, "left must not be null");
            operator = Objects.requireNonNull(operator, "operator must not be null").toUpperCase(Locale.ROOT);
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(left, right);
        }

        @Override
        public String render(RenderContext context) {
            return left.render(context) + " " + operator + " " + right.render(context);
        }
    }

    public record ParenthesizedExpression(Expression expression) implements Expression {
        public ParenthesizedExpression {
            Objects.requireNonNull(expression, "expression must not be null");
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(expression);
        }

        @Override
        public String render(RenderContext context) {
            return "(" + expression.render(context) + ")";
        }
    }

    /**
     * Function or function block call used as an expression.
     *
     * @param name called variable, a {@link SymbolicVariable} or {@link MultiElementVariable}
     * @param parameters {@link ParameterAssignment} and {@link OutputParameterAssignment} nodes
     */
    public record FunctionCall(Expression name, List<AstNode> parameters) implements Expression {
        public FunctionCall {
            Objects.requireNonNull(name, "name must not be null");
            parameters = parameters == null ? List.of() : List.copyOf(parameters);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.builder().add(name).addAll(parameters).build();
        }

        @Override
        public String render(RenderContext context) {
            return name.render(context) + "(" + renderParameters(parameters, context) + ")";
        }
    }

    static String renderParameters(List<AstNode> parameters, RenderContext context) {
        return Render.join(parameters, ", ", (AstNode p) -> p.render(context));
    }

    /**
     * Input argument, either named ({@code nValue := 1}) or positional ({@code name} is {@code null}).
     */
    public record ParameterAssignment(String name, Expression value) implements AstNode {
        public ParameterAssignment {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(value);
        }

        @Override
        public String render(RenderContext context) {
            return Render.joinIf(name, " := ", value.render(context));
        }
    }

    /**
     * Output binding {@code [NOT] name => variable}.
     */
    public record OutputParameterAssignment(String name, Expression value, boolean inverted) implements AstNode {
        public OutputParameterAssignment {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(value);
        }

        @Override
        public String render(RenderContext context) {
            return (inverted ? "NOT " : "") + name + " => " + value.render(context);
        }
    }
}
