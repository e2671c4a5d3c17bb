package com.stcode.core.ast;

import com.stcode.core.ast.Declarations.AccessDeclaration;
import com.stcode.core.ast.Declarations.ExternalVariableDeclaration;
import com.stcode.core.ast.Declarations.GlobalVariableDeclaration;
import com.stcode.core.render.Render;
import com.stcode.core.render.RenderContext;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * {@code VAR_*} ... {@code END_VAR} blocks, one record per block kind.
 *
 * <p>Each block renders its keyword and qualifiers on the header line, one indented
 * {@code declaration;} line per item and a closing {@code END_VAR}.
 */
public final class DeclarationBlocks {

    private DeclarationBlocks() {
        // Utility class - no instantiation
    }

    private static String block(String keyword, Set<VariableAttribute> attributes,
                                List<? extends VariableDeclaration> items, Meta meta, RenderContext context) {
        String header = Render.joinIf(keyword, " ", VariableAttribute.keywords(attributes));
        String text = Render.declarationBlock(header, items,
            (VariableDeclaration item) -> item.render(context), "END_VAR", context);
        return Render.commented(meta.comments(), text);
    }

    /**
     * Plain {@code VAR} block of a function block or program.
     */
    public record VariableDeclarations(Set<VariableAttribute> attributes, List<VariableDeclaration> items, Meta meta)
        implements VariableDeclarationBlock {
        public VariableDeclarations {
            attributes = VariableAttribute.setOf(attributes);
            items = List.copyOf(items);
            meta = Objects.requireNonNullElseGet(meta, Meta::none);
        }

        @Override
        public DeclarationBlockKind kind() {
            return DeclarationBlockKind.VAR;
        }

        @Override
        public List<AstNode> children() {
            return List.copyOf(items);
        }

        @Override
        public String render(RenderContext context) {
            return block("VAR", attributes, items, meta, context);
        }
    }

    /**
     * {@code VAR} block holding at least one {@code AT %...} declaration; may mix in
     * ordinary declarations.
     */
    public record LocatedVariableDeclarations(
        Set<VariableAttribute> attributes,
        List<VariableDeclaration> items,
        Meta meta
    ) implements VariableDeclarationBlock {
        public LocatedVariableDeclarations {
            attributes = VariableAttribute.setOf(attributes);
            items = List.copyOf(items);
            meta = Objects.requireNonNullElseGet(meta, Meta::none);
        }

        @Override
        public DeclarationBlockKind kind() {
            return DeclarationBlockKind.LOCATED;
        }

        @Override
        public List<AstNode> children() {
            return List.copyOf(items);
        }

        @Override
        public String render(RenderContext context) {
            return block("VAR", attributes, items, meta, context);
        }
    }

    public record TemporaryVariableDeclarations(List<VariableDeclaration> items, Meta meta)
        implements VariableDeclarationBlock {
        public TemporaryVariableDeclarations {
            items = List.copyOf(items);
            meta = Objects.requireNonNullElseGet(meta, Meta::none);
        }

        @Override
        public DeclarationBlockKind kind() {
            return DeclarationBlockKind.VAR_TEMP;
        }

        @Override
        public List<AstNode> children() {
            return List.copyOf(items);
        }

        @Override
        public String render(RenderContext context) {
            return block("VAR_TEMP", Set.of(), items, meta, context);
        }
    }

    public record InputDeclarations(Set<VariableAttribute> attributes, List<VariableDeclaration> items, Meta meta)
        implements VariableDeclarationBlock {
        public InputDeclarations {
            attributes = VariableAttribute.setOf(attributes);
            items = List.copyOf(items);
            meta = Objects.requireNonNullElseGet(meta, Meta::none);
        }

        @Override
        public DeclarationBlockKind kind() {
            return DeclarationBlockKind.VAR_INPUT;
        }

        @Override
        public List<AstNode> children() {
            return List.copyOf(items);
        }

        @Override
        public String render(RenderContext context) {
            return block("VAR_INPUT", attributes, items, meta, context);
        }
    }

    public record OutputDeclarations(Set<VariableAttribute> attributes, List<VariableDeclaration> items, Meta meta)
        implements VariableDeclarationBlock {
        public OutputDeclarations {
            attributes = VariableAttribute.setOf(attributes);
            items = List.copyOf(items);
            meta = Objects.requireNonNullElseGet(meta, Meta::none);
        }

        @Override
        public DeclarationBlockKind kind() {
            return DeclarationBlockKind.VAR_OUTPUT;
        }

        @Override
        public List<AstNode> children() {
            return List.copyOf(items);
        }

        @Override
        public String render(RenderContext context) {
            return block("VAR_OUTPUT", attributes, items, meta, context);
        }
    }

    public record InputOutputDeclarations(List<VariableDeclaration> items, Meta meta)
        implements VariableDeclarationBlock {
        public InputOutputDeclarations {
            items = List.copyOf(items);
            meta = Objects.requireNonNullElseGet(meta, Meta::none);
        }

        @Override
        public DeclarationBlockKind kind() {
            return DeclarationBlockKind.VAR_IN_OUT;
        }

        @Override
        public List<AstNode> children() {
            return List.copyOf(items);
        }

        @Override
        public String render(RenderContext context) {
            return block("VAR_IN_OUT", Set.of(), items, meta, context);
        }
    }

    /**
     * {@code VAR_GLOBAL} block. Appears at the top level of a global variable list.
     */
    public record GlobalVariableDeclarations(
        Set<VariableAttribute> attributes,
        List<GlobalVariableDeclaration> items,
        Meta meta
    ) implements VariableDeclarationBlock, SourceCodeItem {
        public GlobalVariableDeclarations {
            attributes = VariableAttribute.setOf(attributes);
            items = List.copyOf(items);
            meta = Objects.requireNonNullElseGet(meta, Meta::none);
        }

        @Override
        public DeclarationBlockKind kind() {
            return DeclarationBlockKind.VAR_GLOBAL;
        }

        @Override
        public List<AstNode> children() {
            return List.copyOf(items);
        }

        @Override
        public String render(RenderContext context) {
            return block("VAR_GLOBAL", attributes, items, meta, context);
        }
    }

    public record ExternalVariableDeclarations(
        Set<VariableAttribute> attributes,
        List<ExternalVariableDeclaration> items,
        Meta meta
    ) implements VariableDeclarationBlock {
        public ExternalVariableDeclarations {
            attributes = VariableAttribute.setOf(attributes);
            items = List.copyOf(items);
            meta = Objects.requireNonNullElseGet(meta, Meta::none);
        }

        @Override
        public DeclarationBlockKind kind() {
            return DeclarationBlockKind.VAR_EXTERNAL;
        }

        @Override
        public List<AstNode> children() {
            return List.copyOf(items);
        }

        @Override
        public String render(RenderContext context) {
            return block("VAR_EXTERNAL", attributes, items, meta, context);
        }
    }

    public record AccessDeclarations(List<AccessDeclaration> items, Meta meta) implements VariableDeclarationBlock {
        public AccessDeclarations {
            items = List.copyOf(items);
            meta = Objects.requireNonNullElseGet(meta, Meta::none);
        }

        @Override
        public DeclarationBlockKind kind() {
            return DeclarationBlockKind.VAR_ACCESS;
        }

        @Override
        public List<AstNode> children() {
            return List.copyOf(items);
        }

        @Override
        public String render(RenderContext context) {
            return block("VAR_ACCESS", Set.of(), items, meta, context);
        }
    }

    public record InstanceVariableDeclarations(List<VariableDeclaration> items, Meta meta)
        implements VariableDeclarationBlock {
        public InstanceVariableDeclarations {
            items = List.copyOf(items);
            meta = Objects.requireNonNullElseGet(meta, Meta::none);
        }

        @Override
        public DeclarationBlockKind kind() {
            return DeclarationBlockKind.VAR_INST;
        }

        @Override
        public List<AstNode> children() {
            return List.copyOf(items);
        }

        @Override
        public String render(RenderContext context) {
            return block("VAR_INST", Set.of(), items, meta, context);
        }
    }

    /**
     * {@code VAR [CONSTANT]} block inside a function or method.
     */
    public record FunctionVariableDeclarations(boolean constant, List<VariableDeclaration> items, Meta meta)
        implements VariableDeclarationBlock {
        public FunctionVariableDeclarations {
            items = List.copyOf(items);
            meta = Objects.requireNonNullElseGet(meta, Meta::none);
        }

        @Override
        public DeclarationBlockKind kind() {
            return DeclarationBlockKind.FUNCTION_VAR;
        }

        @Override
        public List<AstNode> children() {
            return List.copyOf(items);
        }

        @Override
        public String render(RenderContext context) {
            Set<VariableAttribute> attributes = constant ? Set.of(VariableAttribute.CONSTANT) : Set.of();
            return block("VAR", attributes, items, meta, context);
        }
    }
}
