package com.stcode.core.transform;

import com.stcode.core.ast.AstNode;
import com.stcode.core.ast.Expression;
import com.stcode.core.ast.IncompleteLocation;
import com.stcode.core.ast.IndirectionType;
import com.stcode.core.ast.Literals.IntegerLiteral;
import com.stcode.core.ast.Subrange;
import com.stcode.core.ast.TypeSpecs.ArrayInitialElement;
import com.stcode.core.ast.TypeSpecs.ArrayInitialElementCount;
import com.stcode.core.ast.TypeSpecs.ArrayInitialization;
import com.stcode.core.ast.TypeSpecs.ArraySpecification;
import com.stcode.core.ast.TypeSpecs.ArrayTypeInitialization;
import com.stcode.core.ast.TypeSpecs.DataType;
import com.stcode.core.ast.TypeSpecs.EnumeratedSpecification;
import com.stcode.core.ast.TypeSpecs.EnumeratedTypeInitialization;
import com.stcode.core.ast.TypeSpecs.EnumeratedValue;
import com.stcode.core.ast.TypeSpecs.FullSubrange;
import com.stcode.core.ast.TypeSpecs.InitializedStructure;
import com.stcode.core.ast.TypeSpecs.Location;
import com.stcode.core.ast.TypeSpecs.PartialSubrange;
import com.stcode.core.ast.TypeSpecs.StringTypeInitialization;
import com.stcode.core.ast.TypeSpecs.StructureElementInitialization;
import com.stcode.core.ast.TypeSpecs.StructureInitialization;
import com.stcode.core.ast.TypeSpecs.SubrangeSpecification;
import com.stcode.core.ast.TypeSpecs.SubrangeTypeInitialization;
import com.stcode.core.ast.TypeSpecs.TypeInitialization;
import com.stcode.core.engine.Token;

import java.util.List;

/**
 * Handlers for type specifications, initial values and locations.
 */
final class TypeRules {

    private TypeRules() {
    }

    static void register(HandlerRegistry registry) {
        registry
            .passThrough("type_name", "spec_init")
            .register("string_length", c -> c.node(Expression.class))
            .register("indirection_type",
                c -> c.hasToken("POINTER") ? IndirectionType.POINTER : IndirectionType.REFERENCE)
            .register("non_generic_type_name", c -> new DataType(
                c.optional(IndirectionType.class), c.firstToken().text(), c.optional(Expression.class)))
            .register("simple_spec_init", c -> new TypeInitialization(
                c.optional(IndirectionType.class), c.firstToken().text(), c.optional(Expression.class)))
            .register("string_type_specification", TypeRules::stringType)
            .register("subrange", c -> {
                List<Expression> bounds = c.exactly(Expression.class, 2);
                return new PartialSubrange(bounds.get(0), bounds.get(1));
            })
            .register("full_subrange", c -> new FullSubrange())
            .register("subrange_specification", c -> new SubrangeSpecification(
                c.tokenText("IDENTIFIER"), c.node(Subrange.class)))
            .register("subrange_spec_init", c -> new SubrangeTypeInitialization(
                c.optional(IndirectionType.class), c.node(SubrangeSpecification.class), c.optional(Expression.class)))
            .register("enumerated_value", TypeRules::enumeratedValue)
            .register("enumerated_specification", c -> {
                Token baseType = c.optionalToken("IDENTIFIER");
                return new EnumeratedSpecification(c.all(EnumeratedValue.class),
                    baseType == null ? null : baseType.text());
            })
            .register("enumerated_spec_init", c -> new EnumeratedTypeInitialization(
                c.optional(IndirectionType.class), c.node(EnumeratedSpecification.class), c.optional(Expression.class)))
            .register("array_specification", c -> new ArraySpecification(
                c.all(Subrange.class), c.node(DataType.class)))
            .register("array_spec_init", c -> new ArrayTypeInitialization(
                c.optional(IndirectionType.class), c.node(ArraySpecification.class),
                c.optional(ArrayInitialization.class)))
            .register("array_initialization", c -> new ArrayInitialization(c.all(ArrayInitialElement.class)))
            .register("array_initial_element", c -> new ArrayInitialElement(c.get(0, AstNode.class)))
            .register("array_initial_element_count", TypeRules::arrayInitialElementCount)
            .register("structure_initialization", c -> new StructureInitialization(
                c.all(StructureElementInitialization.class)))
            .register("structure_element_initialization", c -> new StructureElementInitialization(
                c.tokenText("IDENTIFIER"), c.node(AstNode.class)))
            .register("initialized_structure", c -> new InitializedStructure(
                c.tokenText("IDENTIFIER"), c.node(StructureInitialization.class)))
            .register("location", c -> new Location(
                ExpressionRules.directVariable(c, c.tokenText("DIRECT_VARIABLE"))))
            .register("incomplete_location", c -> IncompleteLocation.fromCode(c.tokenText("INCOMPLETE_LOCATION")));
    }

    /**
     * Length and initial value are both expressions; {@code :=} tells which one is present.
     */
    private static StringTypeInitialization stringType(Children c) {
        List<Expression> expressions = c.all(Expression.class);
        boolean hasValue = c.hasToken("ASSIGN");
        int expected = hasValue ? 1 : 0;
        if (expressions.size() != expected && expressions.size() != expected + 1) {
            throw c.failure("unexpected number of expressions: " + expressions.size());
        }
        Expression length = expressions.size() > expected ? expressions.get(0) : null;
        Expression value = hasValue ? expressions.get(expressions.size() - 1) : null;
        return new StringTypeInitialization(c.firstToken().text(), length, value);
    }

    private static EnumeratedValue enumeratedValue(Children c) {
        List<Token> names = c.tokens("IDENTIFIER");
        Expression value = c.optional(Expression.class);
        if (c.hasToken("HASH")) {
            return new EnumeratedValue(names.get(0).text(), names.get(1).text(), value);
        }
        return new EnumeratedValue(null, names.get(0).text(), value);
    }

    private static ArrayInitialElementCount arrayInitialElementCount(Children c) {
        IntegerLiteral count = c.get(0, IntegerLiteral.class);
        List<AstNode> nodes = c.all(AstNode.class);
        return new ArrayInitialElementCount(count, nodes.size() > 1 ? nodes.get(1) : null);
    }
}
