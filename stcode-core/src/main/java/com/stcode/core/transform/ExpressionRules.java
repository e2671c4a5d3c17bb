package com.stcode.core.transform;

import com.stcode.core.ast.AstNode;
import com.stcode.core.ast.Expression;
import com.stcode.core.ast.Expressions.BinaryOperation;
import com.stcode.core.ast.Expressions.DirectVariable;
import com.stcode.core.ast.Expressions.FieldSelector;
import com.stcode.core.ast.Expressions.FunctionCall;
import com.stcode.core.ast.Expressions.MultiElementVariable;
import com.stcode.core.ast.Expressions.OutputParameterAssignment;
import com.stcode.core.ast.Expressions.ParameterAssignment;
import com.stcode.core.ast.Expressions.ParenthesizedExpression;
import com.stcode.core.ast.Expressions.SubscriptList;
import com.stcode.core.ast.Expressions.SymbolicVariable;
import com.stcode.core.ast.Expressions.UnaryOperation;
import com.stcode.core.ast.LocationPrefix;
import com.stcode.core.ast.SizePrefix;
import com.stcode.core.ast.TypeSpecs.EnumeratedValue;
import com.stcode.core.engine.Token;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Handlers for expressions, variables and call parameters.
 *
 * <p>Each precedence level of the grammar delivers a flat {@code operand (operator operand)*}
 * list, folded here into left-nested {@link BinaryOperation}s.
 */
final class ExpressionRules {

    private static final Pattern DIRECT_VARIABLE =
        Pattern.compile("%([IQM])([XBWDL])?(\\d+)((?:\\.\\d+)*)", Pattern.CASE_INSENSITIVE);

    private ExpressionRules() {
    }

    static void register(HandlerRegistry registry) {
        for (String level : List.of("expression", "xor_expression", "and_expression", "equality_expression",
            "comparison_expression", "add_expression", "expression_term", "power_expression")) {
            registry.register(level, ExpressionRules::foldLeft);
        }
        registry
            .passThrough("primary_expression", "symbolic_variable")
            .register("unary_expression", ExpressionRules::unary)
            .register("parenthesized_expression", c -> new ParenthesizedExpression(c.node(Expression.class)))
            .register("function_call", ExpressionRules::functionCall)
            .register("param_assignment", ExpressionRules::parameter)
            .register("output_parameter_assignment", c -> new OutputParameterAssignment(
                c.tokenText("IDENTIFIER"), c.node(Expression.class), c.hasToken("NOT")))
            .register("variable_name", c -> new SymbolicVariable(c.tokenText("IDENTIFIER"), c.hasToken("CARET")))
            .register("multi_element_variable", ExpressionRules::multiElementVariable)
            .register("subscript_list", c -> new SubscriptList(c.all(Expression.class), c.hasToken("CARET")))
            .register("field_selector", ExpressionRules::fieldSelector)
            .register("direct_variable", c -> directVariable(c, c.tokenText("DIRECT_VARIABLE")))
            .register("qualified_enum_value", ExpressionRules::qualifiedEnumValue);
    }

    /**
     * Folds {@code a op b op c} into {@code ((a op b) op c)}.
     */
    static Expression foldLeft(Children c) {
        Expression result = c.get(0, Expression.class);
        for (int i = 1; i < c.size(); i += 2) {
            Token operator = c.get(i, Token.class);
            Expression right = c.get(i + 1, Expression.class);
            result = new BinaryOperation(result, operator.text(), right);
        }
        return result;
    }

    private static Expression unary(Children c) {
        if (c.size() == 1) {
            return c.get(0, Expression.class);
        }
        return new UnaryOperation(c.get(0, Token.class).text(), c.get(1, Expression.class));
    }

    private static FunctionCall functionCall(Children c) {
        Expression name = c.get(0, Expression.class);
        return new FunctionCall(name, parameters(c));
    }

    /**
     * @return input and output parameter assignments in source order
     */
    static List<AstNode> parameters(Children c) {
        List<AstNode> parameters = new ArrayList<>();
        for (Object item : c.items()) {
            if (item instanceof ParameterAssignment || item instanceof OutputParameterAssignment) {
                parameters.add((AstNode) item);
            }
        }
        return parameters;
    }

    private static ParameterAssignment parameter(Children c) {
        Expression value = c.node(Expression.class);
        if (c.hasToken("ASSIGN")) {
            return new ParameterAssignment(c.tokenText("IDENTIFIER"), value);
        }
        return new ParameterAssignment(null, value);
    }

    private static MultiElementVariable multiElementVariable(Children c) {
        SymbolicVariable head = c.get(0, SymbolicVariable.class);
        List<AstNode> elements = new ArrayList<>();
        for (int i = 1; i < c.size(); i++) {
            elements.add(c.get(i, AstNode.class));
        }
        return new MultiElementVariable(head, elements);
    }

    private static FieldSelector fieldSelector(Children c) {
        Token field = c.optionalToken("IDENTIFIER");
        if (field == null) {
            field = c.token("INTEGER");
        }
        return new FieldSelector(field.text(), c.hasToken("CARET"));
    }

    static DirectVariable directVariable(Children c, String text) {
        Matcher matcher = DIRECT_VARIABLE.matcher(text);
        if (!matcher.matches()) {
            throw c.failure("malformed direct variable " + text);
        }
        LocationPrefix location = LocationPrefix.fromCode(matcher.group(1).charAt(0));
        SizePrefix size = matcher.group(2) == null ? SizePrefix.BIT : SizePrefix.fromCode(matcher.group(2).charAt(0));
        List<String> bits = matcher.group(4).isEmpty()
            ? List.of()
            : Arrays.asList(matcher.group(4).substring(1).split("\\."));
        return new DirectVariable(location, size, matcher.group(3), bits);
    }

    private static EnumeratedValue qualifiedEnumValue(Children c) {
        List<Token> names = c.tokens("IDENTIFIER");
        if (names.size() != 2) {
            throw c.failure("expected type and value name");
        }
        return new EnumeratedValue(names.get(0).text(), names.get(1).text(), null);
    }
}
