package com.stcode.core.ast;

import com.stcode.core.ast.Expressions.DirectVariable;
import com.stcode.core.ast.Literals.IntegerLiteral;
import com.stcode.core.render.Render;
import com.stcode.core.render.RenderContext;

import java.util.List;
import java.util.Objects;

/**
 * Type specifications and initial values used by type and variable declarations.
 *
 * <p>Every {@code *TypeInitialization} renders as {@code [POINTER TO ]<specification>[ := <value>]}.
 */
public final class TypeSpecs {

    private TypeSpecs() {
        // Utility class - no instantiation
    }

    private static String indirect(IndirectionType indirection, String text) {
        return Render.joinIf(indirection == null ? null : indirection.keyword(), " ", text);
    }

    private static String initialized(String specification, AstNode value, RenderContext context) {
        return value == null ? specification : specification + " := " + value.render(context);
    }

    private static String stringLength(Expression length, RenderContext context) {
        return length == null ? "" : "(" + length.render(context) + ")";
    }

    /**
     * Type reference without initial value, such as {@code POINTER TO ST_Axis} or {@code STRING(80)}.
     *
     * @param indirection pointer or reference, {@code null} for a direct type
     * @param typeName referenced type
     * @param length string length, only for {@code STRING}/{@code WSTRING}
     */
    public record DataType(IndirectionType indirection, String typeName, Expression length) implements AstNode {
        public DataType {
            Objects.requireNonNull(typeName, "typeName must not be null");
        }

        public static DataType of(String typeName) {
            return new DataType(null, typeName, null);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(length);
        }

        @Override
        public String render(RenderContext context) {
            return indirect(indirection, typeName + stringLength(length, context));
        }
    }

    /**
     * Elementary or user type with optional initial value: {@code INT := 5}.
     */
    public record TypeInitialization(IndirectionType indirection, String typeName, Expression value)
        implements TypeInitializer {
        public TypeInitialization {
            Objects.requireNonNull(typeName, "typeName must not be null");
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(value);
        }

        @Override
        public String render(RenderContext context) {
            return initialized(indirect(indirection, typeName), value, context);
        }
    }

    /**
     * {@code STRING(80) := 'text'}.
     */
    public record StringTypeInitialization(String stringType, Expression length, Expression value)
        implements TypeInitializer {
        public StringTypeInitialization {
            Objects.requireNonNull(stringType, "stringType must not be null");
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(length, value);
        }

        @Override
        public String render(RenderContext context) {
            return initialized(stringType + stringLength(length, context), value, context);
        }
    }

    /**
     * Open array bound {@code *}.
     */
    public record FullSubrange() implements Subrange {
        @Override
        public String render(RenderContext context) {
            return "*";
        }
    }

    public record PartialSubrange(Expression start, Expression stop) implements Subrange {
        public PartialSubrange {
            Objects.requireNonNull(start, "start must not be null");
            Objects.requireNonNull(stop, "stop must not be null");
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(start, stop);
        }

        @Override
        public String render(RenderContext context) {
            return start.render(context) + ".." + stop.render(context);
        }
    }

    /**
     * {@code INT(0..100)}.
     */
    public record SubrangeSpecification(String typeName, Subrange subrange) implements AstNode {
        public SubrangeSpecification {
            Objects.requireNonNull(typeName, "typeName must not be null");
            Objects.requireNonNull(subrange, "subrange must not be null");
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(subrange);
        }

        @Override
        public String render(RenderContext context) {
            return typeName + "(" + subrange.render(context) + ")";
        }
    }

    public record SubrangeTypeInitialization(
        IndirectionType indirection,
        SubrangeSpecification specification,
        Expression value
    ) implements TypeInitializer {
        public SubrangeTypeInitialization {
            Objects.requireNonNull(specification, "specification must not be null");
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(specification, value);
        }

        @Override
        public String render(RenderContext context) {
            return initialized(indirect(indirection, specification.render(context)), value, context);
        }
    }

    /**
     * Enumeration member, either declared ({@code eIdle := 0}) or referenced with its
     * type qualifier ({@code E_State#eIdle}).
     */
    public record EnumeratedValue(String typeName, String name, Expression value) implements Expression {
        public EnumeratedValue {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(value);
        }

        @Override
        public String render(RenderContext context) {
            return initialized(Render.joinIf(typeName, "#", name), value, context);
        }
    }

    /**
     * {@code (eIdle, eBusy := 5) INT}; the trailing base type is optional.
     */
    public record EnumeratedSpecification(List<EnumeratedValue> values, String typeName) implements AstNode {
        public EnumeratedSpecification {
            values = List.copyOf(values);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.builder().addAll(values).build();
        }

        @Override
        public String render(RenderContext context) {
            String members = "(" + Render.join(values, ", ", (EnumeratedValue v) -> v.render(context)) + ")";
            return Render.joinIf(members, " ", typeName);
        }
    }

    public record EnumeratedTypeInitialization(
        IndirectionType indirection,
        EnumeratedSpecification specification,
        Expression value
    ) implements TypeInitializer {
        public EnumeratedTypeInitialization {
            Objects.requireNonNull(specification, "specification must not be null");
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(specification, value);
        }

        @Override
        public String render(RenderContext context) {
            return initialized(indirect(indirection, specification.render(context)), value, context);
        }
    }

    /**
     * {@code ARRAY[1..10, *] OF REAL}.
     */
    public record ArraySpecification(List<Subrange> subranges, DataType elementType) implements AstNode {
        public ArraySpecification {
            subranges = List.copyOf(subranges);
            Objects.requireNonNull(elementType, "elementType must not be null");
        }

        @Override
        public List<AstNode> children() {
            return Nodes.builder().addAll(subranges).add(elementType).build();
        }

        @Override
        public String render(RenderContext context) {
            return "ARRAY[" + Render.join(subranges, ", ", (Subrange s) -> s.render(context)) + "] OF "
                + elementType.render(context);
        }
    }

    /**
     * Single entry of an array initializer; wraps an expression, a structure
     * initializer or an {@link ArrayInitialElementCount}.
     */
    public record ArrayInitialElement(AstNode element) implements AstNode {
        public ArrayInitialElement {
            Objects.requireNonNull(element, "element must not be null");
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(element);
        }

        @Override
        public String render(RenderContext context) {
            return element.render(context);
        }
    }

    /**
     * Repeated initial value {@code 3(0)}; the element may be empty ({@code 3()}).
     */
    public record ArrayInitialElementCount(IntegerLiteral count, AstNode element) implements AstNode {
        public ArrayInitialElementCount {
            Objects.requireNonNull(count, "count must not be null");
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(count, element);
        }

        @Override
        public String render(RenderContext context) {
            return count.render(context) + "(" + (element == null ? "" : element.render(context)) + ")";
        }
    }

    public record ArrayInitialization(List<ArrayInitialElement> elements) implements AstNode {
        public ArrayInitialization {
            elements = List.copyOf(elements);
        }

        @Override
        public List<AstNode> children() {
            return List.copyOf(elements);
        }

        @Override
        public String render(RenderContext context) {
            return "[" + Render.join(elements, ", ", (ArrayInitialElement e) -> e.render(context)) + "]";
        }
    }

    public record ArrayTypeInitialization(
        IndirectionType indirection,
        ArraySpecification specification,
        ArrayInitialization value
    ) implements TypeInitializer {
        public ArrayTypeInitialization {
            Objects.requireNonNull(specification, "specification must not be null");
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(specification, value);
        }

        @Override
        public String render(RenderContext context) {
            return initialized(indirect(indirection, specification.render(context)), value, context);
        }
    }

    /**
     * {@code name := value}, where value is an expression, array or nested structure initializer.
     */
    public record StructureElementInitialization(String name, AstNode value) implements AstNode {
        public StructureElementInitialization {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(value);
        }

        @Override
        public String render(RenderContext context) {
            return name + " := " + value.render(context);
        }
    }

    public record StructureInitialization(List<StructureElementInitialization> elements) implements AstNode {
        public StructureInitialization {
            elements = List.copyOf(elements);
        }

        @Override
        public List<AstNode> children() {
            return List.copyOf(elements);
        }

        @Override
        public String render(RenderContext context) {
            return "(" + Render.join(elements, ", ", (StructureElementInitialization e) -> e.render(context)) + ")";
        }
    }

    /**
     * {@code ST_Axis := (fMax := 10.0)}.
     */
    public record InitializedStructure(String typeName, StructureInitialization init) implements TypeInitializer {
        public InitializedStructure {
            Objects.requireNonNull(typeName, "typeName must not be null");
            Objects.requireNonNull(init, "init must not be null");
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(init);
        }

        @Override
        public String render(RenderContext context) {
            return typeName + " := " + init.render(context);
        }
    }

    /**
     * {@code AT %IX0.0}.
     */
    public record Location(DirectVariable variable) implements AstNode {
        public Location {
            Objects.requireNonNull(variable, "variable must not be null");
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(variable);
        }

        @Override
        public String render(RenderContext context) {
            return "AT " + variable.render(context);
        }
    }
}
