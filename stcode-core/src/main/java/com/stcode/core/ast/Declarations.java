package com.stcode.core.ast;

import com.stcode.core.ast.TypeSpecs.ArrayTypeInitialization;
import com.stcode.core.ast.TypeSpecs.DataType;
import com.stcode.core.ast.TypeSpecs.EnumeratedTypeInitialization;
import com.stcode.core.ast.TypeSpecs.InitializedStructure;
import com.stcode.core.ast.TypeSpecs.Location;
import com.stcode.core.ast.TypeSpecs.StringTypeInitialization;
import com.stcode.core.ast.TypeSpecs.StructureInitialization;
import com.stcode.core.ast.TypeSpecs.SubrangeTypeInitialization;
import com.stcode.core.ast.TypeSpecs.TypeInitialization;
import com.stcode.core.render.Render;
import com.stcode.core.render.RenderContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Type declarations (inside {@code TYPE ... END_TYPE}) and variable declarations
 * (inside {@code VAR_* ... END_VAR} blocks).
 *
 * <p>Declarations render without their terminating {@code ;}; the enclosing block adds it.
 * All declarations are comment consumers and print attached comments above themselves.
 */
public final class Declarations {

    private Declarations() {
        // Utility class - no instantiation
    }

    private static Meta orNone(Meta meta) {
        return Objects.requireNonNullElseGet(meta, Meta::none);
    }

    private static String declared(String names, AstNode init, RenderContext context) {
        return names + " : " + init.render(context);
    }

    private static String extended(String name, Extends extendsType, RenderContext context) {
        return Render.joinIf(name, " ", extendsType == null ? null : extendsType.render(context));
    }

    public record Extends(String name) implements AstNode {
        public Extends {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String render(RenderContext context) {
            return "EXTENDS " + name;
        }
    }

    public record Implements(List<String> interfaces) implements AstNode {
        public Implements {
            interfaces = List.copyOf(interfaces);
            if (interfaces.isEmpty()) {
                throw new IllegalArgumentException("interfaces must not be empty");
            }
        }

        @Override
        public String render(RenderContext context) {
            return "IMPLEMENTS " + String.join(", ", interfaces);
        }
    }

    // ------------------------------------------------------------------ types

    /**
     * {@code T_Speed [EXTENDS T_Base] : REAL := 1.0}.
     */
    public record SimpleTypeDeclaration(String name, Extends extendsType, TypeInitialization init, Meta meta)
        implements TypeDeclaration {
        public SimpleTypeDeclaration {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(init, "init must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(extendsType, init);
        }

        @Override
        public String render(RenderContext context) {
            return Render.commented(meta.comments(), declared(extended(name, extendsType, context), init, context));
        }
    }

    public record StringTypeDeclaration(String name, StringTypeInitialization init, Meta meta)
        implements TypeDeclaration {
        public StringTypeDeclaration {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(init, "init must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(init);
        }

        @Override
        public String render(RenderContext context) {
            return Render.commented(meta.comments(), declared(name, init, context));
        }
    }

    public record SubrangeTypeDeclaration(String name, SubrangeTypeInitialization init, Meta meta)
        implements TypeDeclaration {
        public SubrangeTypeDeclaration {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(init, "init must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(init);
        }

        @Override
        public String render(RenderContext context) {
            return Render.commented(meta.comments(), declared(name, init, context));
        }
    }

    public record EnumeratedTypeDeclaration(String name, EnumeratedTypeInitialization init, Meta meta)
        implements TypeDeclaration {
        public EnumeratedTypeDeclaration {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(init, "init must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(init);
        }

        @Override
        public String render(RenderContext context) {
            return Render.commented(meta.comments(), declared(name, init, context));
        }
    }

    public record ArrayTypeDeclaration(String name, ArrayTypeInitialization init, Meta meta)
        implements TypeDeclaration {
        public ArrayTypeDeclaration {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(init, "init must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(init);
        }

        @Override
        public String render(RenderContext context) {
            return Render.commented(meta.comments(), declared(name, init, context));
        }
    }

    /**
     * <pre>
     * ST_Axis EXTENDS ST_Base : STRUCT
     *     fPosition : LREAL;
     * END_STRUCT
     * </pre>
     */
    public record StructureTypeDeclaration(
        String name,
        Extends extendsType,
        IndirectionType indirection,
        List<StructureElementDeclaration> declarations,
        Meta meta
    ) implements TypeDeclaration {
        public StructureTypeDeclaration {
            Objects.requireNonNull(name, "name must not be null");
            declarations = List.copyOf(declarations);
            meta = orNone(meta);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.builder().add(extendsType).addAll(declarations).build();
        }

        @Override
        public String render(RenderContext context) {
            String keyword = Render.joinIf(indirection == null ? null : indirection.keyword(), " ", "STRUCT");
            String header = extended(name, extendsType, context) + " : " + keyword;
            String body = Render.declarationBlock(header, declarations,
                (StructureElementDeclaration d) -> d.render(context), "END_STRUCT", context);
            return Render.commented(meta.comments(), body);
        }
    }

    /**
     * Member of a structure; {@code location} is set for {@code AT %I*} members.
     */
    public record StructureElementDeclaration(
        String name,
        IncompleteLocation location,
        TypeInitializer init,
        Meta meta
    ) implements CommentConsumer {
        public StructureElementDeclaration {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(init, "init must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(init);
        }

        @Override
        public String render(RenderContext context) {
            String target = location == null ? name : name + " " + location.render(context);
            return Render.commented(meta.comments(), declared(target, init, context));
        }
    }

    public record InitializedStructureTypeDeclaration(
        String name,
        Extends extendsType,
        InitializedStructure init,
        Meta meta
    ) implements TypeDeclaration {
        public InitializedStructureTypeDeclaration {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(init, "init must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(extendsType, init);
        }

        @Override
        public String render(RenderContext context) {
            return Render.commented(meta.comments(), declared(extended(name, extendsType, context), init, context));
        }
    }

    // -------------------------------------------------------------- variables

    /**
     * Declared variable name, optionally with an incomplete location ({@code bIn AT %I*}).
     */
    public record VariableOne(String name, IncompleteLocation location) implements AstNode {
        public VariableOne {
            Objects.requireNonNull(name, "name must not be null");
        }

        public static VariableOne of(String name) {
            return new VariableOne(name, null);
        }

        @Override
        public String render(RenderContext context) {
            return location == null ? name : name + " " + location.render(context);
        }
    }

    public record VariableList(List<VariableOne> variables) implements AstNode {
        public VariableList {
            variables = List.copyOf(variables);
            if (variables.isEmpty()) {
                throw new IllegalArgumentException("variables must not be empty");
            }
        }

        public static VariableList of(String... names) {
            List<VariableOne> variables = new ArrayList<>();
            for (String name : names) {
                variables.add(VariableOne.of(name));
            }
            return new VariableList(variables);
        }

        public List<String> names() {
            return variables.stream().map(VariableOne::name).toList();
        }

        @Override
        public List<AstNode> children() {
            return List.copyOf(variables);
        }

        @Override
        public String render(RenderContext context) {
            return Render.join(variables, ", ", (VariableOne v) -> v.render(context));
        }
    }

    /**
     * {@code nCount, nLimit : INT := 10}, also used for subrange and enumerated variables.
     */
    public record VariableOneInitDeclaration(VariableList variables, TypeInitializer init, Meta meta)
        implements VariableDeclaration {
        public VariableOneInitDeclaration {
            Objects.requireNonNull(variables, "variables must not be null");
            Objects.requireNonNull(init, "init must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<String> variableNames() {
            return variables.names();
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(variables, init);
        }

        @Override
        public String render(RenderContext context) {
            return Render.commented(meta.comments(), declared(variables.render(context), init, context));
        }
    }

    public record ArrayVariableInitDeclaration(VariableList variables, ArrayTypeInitialization init, Meta meta)
        implements VariableDeclaration {
        public ArrayVariableInitDeclaration {
            Objects.requireNonNull(variables, "variables must not be null");
            Objects.requireNonNull(init, "init must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<String> variableNames() {
            return variables.names();
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(variables, init);
        }

        @Override
        public String render(RenderContext context) {
            return Render.commented(meta.comments(), declared(variables.render(context), init, context));
        }
    }

    public record StringVariableInitDeclaration(VariableList variables, StringTypeInitialization init, Meta meta)
        implements VariableDeclaration {
        public StringVariableInitDeclaration {
            Objects.requireNonNull(variables, "variables must not be null");
            Objects.requireNonNull(init, "init must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<String> variableNames() {
            return variables.names();
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(variables, init);
        }

        @Override
        public String render(RenderContext context) {
            return Render.commented(meta.comments(), declared(variables.render(context), init, context));
        }
    }

    /**
     * Edge-triggered input {@code bStart : BOOL R_EDGE}.
     *
     * @param edge {@code R_EDGE} or {@code F_EDGE}
     */
    public record EdgeDeclaration(VariableList variables, String typeName, String edge, Meta meta)
        implements VariableDeclaration {
        public EdgeDeclaration {
            Objects.requireNonNull(variables, "variables must not be null");
            Objects.requireNonNull(typeName, "typeName must not be null");
            Objects.requireNonNull(edge, "edge must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<String> variableNames() {
            return variables.names();
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(variables);
        }

        @Override
        public String render(RenderContext context) {
            return Render.commented(meta.comments(), variables.render(context) + " : " + typeName + " " + edge);
        }
    }

    /**
     * Function block instances with a structure initializer: {@code fbTimer : TON := (PT := T#1S)}.
     */
    public record FunctionBlockNameDeclaration(
        VariableList variables,
        String typeName,
        StructureInitialization init,
        Meta meta
    ) implements VariableDeclaration {
        public FunctionBlockNameDeclaration {
            Objects.requireNonNull(variables, "variables must not be null");
            Objects.requireNonNull(typeName, "typeName must not be null");
            Objects.requireNonNull(init, "init must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<String> variableNames() {
            return variables.names();
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(variables, init);
        }

        @Override
        public String render(RenderContext context) {
            return Render.commented(meta.comments(),
                variables.render(context) + " : " + typeName + " := " + init.render(context));
        }
    }

    /**
     * Function block type with constructor arguments: {@code FB_Axis(nId := 1)}.
     */
    public record FunctionBlockInvocation(String name, List<AstNode> parameters) implements AstNode {
        public FunctionBlockInvocation {
            Objects.requireNonNull(name, "name must not be null");
            parameters = parameters == null ? List.of() : List.copyOf(parameters);
        }

        @Override
        public List<AstNode> children() {
            return List.copyOf(parameters);
        }

        @Override
        public String render(RenderContext context) {
            return name + "(" + Expressions.renderParameters(parameters, context) + ")";
        }
    }

    public record FunctionBlockInvocationDeclaration(
        VariableList variables,
        FunctionBlockInvocation invocation,
        Meta meta
    ) implements VariableDeclaration {
        public FunctionBlockInvocationDeclaration {
            Objects.requireNonNull(variables, "variables must not be null");
            Objects.requireNonNull(invocation, "invocation must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<String> variableNames() {
            return variables.names();
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(variables, invocation);
        }

        @Override
        public String render(RenderContext context) {
            return Render.commented(meta.comments(), declared(variables.render(context), invocation, context));
        }
    }

    /**
     * Left-hand side of a global declaration.
     *
     * @param names declared names, empty for an anonymous located variable
     * @param location a {@link Location}, an {@link IncompleteLocation} or {@code null}
     */
    public record GlobalVariableSpec(List<String> names, AstNode location) implements AstNode {
        public GlobalVariableSpec {
            names = List.copyOf(names);
            if (location != null && !(location instanceof Location) && !(location instanceof IncompleteLocation)) {
                throw new IllegalArgumentException("Unexpected global variable location: " + location);
            }
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(location);
        }

        @Override
        public String render(RenderContext context) {
            String declared = names.isEmpty() ? null : String.join(", ", names);
            return Render.joinIf(declared, " ", location == null ? null : location.render(context));
        }
    }

    /**
     * @param init a {@link TypeInitializer} or a {@link FunctionBlockInvocation}
     */
    public record GlobalVariableDeclaration(GlobalVariableSpec spec, AstNode init, Meta meta)
        implements VariableDeclaration {
        public GlobalVariableDeclaration {
            Objects.requireNonNull(spec, "spec must not be null");
            Objects.requireNonNull(init, "init must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<String> variableNames() {
            return spec.names();
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(spec, init);
        }

        @Override
        public String render(RenderContext context) {
            return Render.commented(meta.comments(), declared(spec.render(context), init, context));
        }
    }

    /**
     * {@code bSensor AT %IX0.0 : BOOL}; the name is {@code null} for anonymous located variables.
     */
    public record LocatedVariableDeclaration(String name, Location location, TypeInitializer init, Meta meta)
        implements VariableDeclaration {
        public LocatedVariableDeclaration {
            Objects.requireNonNull(location, "location must not be null");
            Objects.requireNonNull(init, "init must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<String> variableNames() {
            return name == null ? List.of() : List.of(name);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(location, init);
        }

        @Override
        public String render(RenderContext context) {
            String target = Render.joinIf(name, " ", location.render(context));
            return Render.commented(meta.comments(), declared(target, init, context));
        }
    }

    /**
     * @param specification a {@link DataType}, array, subrange or enumerated specification
     */
    public record ExternalVariableDeclaration(String name, AstNode specification, Meta meta)
        implements VariableDeclaration {
        public ExternalVariableDeclaration {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(specification, "specification must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<String> variableNames() {
            return List.of(name);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(specification);
        }

        @Override
        public String render(RenderContext context) {
            return Render.commented(meta.comments(), declared(name, specification, context));
        }
    }

    /**
     * {@code VAR_ACCESS} path: {@code aSpeed : fbAxis.fSpeed : REAL READ_ONLY}.
     *
     * @param direction {@code READ_WRITE}, {@code READ_ONLY} or {@code null}
     */
    public record AccessDeclaration(String name, Expression variable, DataType type, String direction, Meta meta)
        implements VariableDeclaration {
        public AccessDeclaration {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(variable, "variable must not be null");
            Objects.requireNonNull(type, "type must not be null");
            meta = orNone(meta);
        }

        @Override
        public List<String> variableNames() {
            return List.of(name);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(variable, type);
        }

        @Override
        public String render(RenderContext context) {
            String text = name + " : " + variable.render(context) + " : " + type.render(context);
            return Render.commented(meta.comments(), Render.joinIf(text, " ", direction));
        }
    }
}
