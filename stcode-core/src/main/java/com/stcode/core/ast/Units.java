package com.stcode.core.ast;

import com.stcode.core.ast.Declarations.Extends;
import com.stcode.core.ast.Declarations.Implements;
import com.stcode.core.ast.TypeSpecs.DataType;
import com.stcode.core.render.Render;
import com.stcode.core.render.RenderContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Program organization units and the other top-level source items.
 *
 * <p>Units render a header line, their declaration blocks and body indented by one
 * level, and the closing keyword.
 */
public final class Units {

    private Units() {
        // Utility class - no instantiation
    }

    private static String unit(String header, List<VariableDeclarationBlock> declarations,
                               FunctionBlockBody body, String footer, Meta meta, RenderContext context) {
        List<String> lines = new ArrayList<>();
        lines.add(header);
        for (VariableDeclarationBlock block : declarations) {
            lines.add(Render.indent(block.render(context), context));
        }
        if (body != null) {
            lines.add(Render.indent(body.render(context), context));
        }
        lines.add(footer);
        return Render.commented(meta.comments(), String.join("\n", lines));
    }

    private static String returning(String header, DataType returnType, RenderContext context) {
        return returnType == null ? header : header + " : " + returnType.render(context);
    }

    /**
     * Statements of a unit. Consumes comments that precede the first statement.
     */
    public record FunctionBlockBody(StatementList statements, Meta meta) implements CommentConsumer {
        public FunctionBlockBody {
            Objects.requireNonNull(statements, "statements must not be null");
            meta = Objects.requireNonNullElseGet(meta, Meta::none);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(statements);
        }

        @Override
        public String render(RenderContext context) {
            return Render.commented(meta.comments(), statements.render(context));
        }
    }

    public record Function(
        String name,
        DataType returnType,
        List<VariableDeclarationBlock> declarations,
        FunctionBlockBody body,
        Meta meta
    ) implements DeclarationBearing {
        public Function {
            Objects.requireNonNull(name, "name must not be null");
            declarations = List.copyOf(declarations);
            meta = Objects.requireNonNullElseGet(meta, Meta::none);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.builder().add(returnType).addAll(declarations).add(body).build();
        }

        @Override
        public String render(RenderContext context) {
            String header = returning("FUNCTION " + name, returnType, context);
            return unit(header, declarations, body, "END_FUNCTION", meta, context);
        }
    }

    /**
     * <pre>
     * FUNCTION_BLOCK ABSTRACT FB_Axis EXTENDS FB_Base IMPLEMENTS I_Axis
     * </pre>
     */
    public record FunctionBlock(
        String name,
        Set<AccessSpecifier> access,
        Extends extendsType,
        Implements implementsInterfaces,
        List<VariableDeclarationBlock> declarations,
        FunctionBlockBody body,
        Meta meta
    ) implements DeclarationBearing {
        public FunctionBlock {
            Objects.requireNonNull(name, "name must not be null");
            access = AccessSpecifier.setOf(access);
            declarations = List.copyOf(declarations);
            meta = Objects.requireNonNullElseGet(meta, Meta::none);
        }

        public boolean isAbstract() {
            return access.contains(AccessSpecifier.ABSTRACT);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.builder().add(extendsType, implementsInterfaces).addAll(declarations).add(body).build();
        }

        @Override
        public String render(RenderContext context) {
            String header = Render.joinIf("FUNCTION_BLOCK", " ", AccessSpecifier.keywords(access)) + " " + name;
            if (extendsType != null) {
                header += " " + extendsType.render(context);
            }
            if (implementsInterfaces != null) {
                header += " " + implementsInterfaces.render(context);
            }
            return unit(header, declarations, body, "END_FUNCTION_BLOCK", meta, context);
        }
    }

    public record Program(
        String name,
        List<VariableDeclarationBlock> declarations,
        FunctionBlockBody body,
        Meta meta
    ) implements DeclarationBearing {
        public Program {
            Objects.requireNonNull(name, "name must not be null");
            declarations = List.copyOf(declarations);
            meta = Objects.requireNonNullElseGet(meta, Meta::none);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.builder().addAll(declarations).add(body).build();
        }

        @Override
        public String render(RenderContext context) {
            return unit("PROGRAM " + name, declarations, body, "END_PROGRAM", meta, context);
        }
    }

    public record Method(
        Set<AccessSpecifier> access,
        String name,
        DataType returnType,
        List<VariableDeclarationBlock> declarations,
        FunctionBlockBody body,
        Meta meta
    ) implements DeclarationBearing {
        public Method {
            access = AccessSpecifier.setOf(access);
            Objects.requireNonNull(name, "name must not be null");
            declarations = List.copyOf(declarations);
            meta = Objects.requireNonNullElseGet(meta, Meta::none);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.builder().add(returnType).addAll(declarations).add(body).build();
        }

        @Override
        public String render(RenderContext context) {
            String header = Render.joinIf("METHOD", " ", AccessSpecifier.keywords(access)) + " " + name;
            return unit(returning(header, returnType, context), declarations, body, "END_METHOD", meta, context);
        }
    }

    public record NamedAction(String name, FunctionBlockBody body, Meta meta) implements SourceCodeItem {
        public NamedAction {
            Objects.requireNonNull(name, "name must not be null");
            meta = Objects.requireNonNullElseGet(meta, Meta::none);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(body);
        }

        @Override
        public String render(RenderContext context) {
            return unit("ACTION " + name + ":", List.of(), body, "END_ACTION", meta, context);
        }
    }

    public record EntryAction(FunctionBlockBody body, Meta meta) implements SourceCodeItem {
        public EntryAction {
            meta = Objects.requireNonNullElseGet(meta, Meta::none);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(body);
        }

        @Override
        public String render(RenderContext context) {
            return unit("ENTRY_ACTION", List.of(), body, "END_ACTION", meta, context);
        }
    }

    public record ExitAction(FunctionBlockBody body, Meta meta) implements SourceCodeItem {
        public ExitAction {
            meta = Objects.requireNonNullElseGet(meta, Meta::none);
        }

        @Override
        public List<AstNode> children() {
            return Nodes.of(body);
        }

        @Override
        public String render(RenderContext context) {
            return unit("EXIT_ACTION", List.of(), body, "END_ACTION", meta, context);
        }
    }

    /**
     * {@code TYPE ... END_TYPE}. Structures close with {@code END_STRUCT} and take no {@code ;}.
     */
    public record DataTypeDeclaration(List<TypeDeclaration> declarations, Meta meta) implements SourceCodeItem {
        public DataTypeDeclaration {
            declarations = List.copyOf(declarations);
            meta = Objects.requireNonNullElseGet(meta, Meta::none);
        }

        @Override
        public List<AstNode> children() {
            return List.copyOf(declarations);
        }

        @Override
        public String render(RenderContext context) {
            List<String> lines = new ArrayList<>();
            lines.add("TYPE");
            for (TypeDeclaration declaration : declarations) {
                String text = declaration.render(context);
                if (!(declaration instanceof Declarations.StructureTypeDeclaration)) {
                    text += ";";
                }
                lines.add(Render.indent(text, context));
            }
            lines.add("END_TYPE");
            return Render.commented(meta.comments(), String.join("\n", lines));
        }
    }
}
