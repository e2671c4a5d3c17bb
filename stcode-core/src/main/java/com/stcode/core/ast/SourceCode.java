package com.stcode.core.ast;

import com.stcode.core.ast.DeclarationBlocks.GlobalVariableDeclarations;
import com.stcode.core.ast.Units.DataTypeDeclaration;
import com.stcode.core.ast.Units.Function;
import com.stcode.core.ast.Units.FunctionBlock;
import com.stcode.core.ast.Units.Method;
import com.stcode.core.ast.Units.NamedAction;
import com.stcode.core.ast.Units.Program;
import com.stcode.core.render.Render;
import com.stcode.core.render.RenderContext;

import java.util.List;
import java.util.Optional;

/**
 * Root of a parsed source text: its top-level items in source order.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SourceCode source = parser.parse(text, "FB_Axis.st").root();
 * for (FunctionBlock fb : source.functionBlocks()) {
 *     DeclarationIndex index = DeclarationIndex.of(fb);
 * }
 * }</pre>
 *
 * @param items top-level units, type declarations and global variable lists
 */
public record SourceCode(List<SourceCodeItem> items) implements AstNode {

    public SourceCode {
        items = List.copyOf(items);
    }

    public List<FunctionBlock> functionBlocks() {
        return itemsOf(FunctionBlock.class);
    }

    public List<Function> functions() {
        return itemsOf(Function.class);
    }

    public List<Program> programs() {
        return itemsOf(Program.class);
    }

    public List<Method> methods() {
        return itemsOf(Method.class);
    }

    public List<DataTypeDeclaration> dataTypes() {
        return itemsOf(DataTypeDeclaration.class);
    }

    public List<GlobalVariableDeclarations> globalVariableLists() {
        return itemsOf(GlobalVariableDeclarations.class);
    }

    /**
     * @return units that own declaration blocks, in source order
     */
    public List<DeclarationBearing> declarationBearingUnits() {
        return itemsOf(DeclarationBearing.class);
    }

    /**
     * Finds a named unit, action or declared data type. Names compare case-insensitively,
     * as identifiers do in Structured Text.
     *
     * @param name unit, action or type name
     * @return first matching item or type declaration
     */
    public Optional<CommentConsumer> find(String name) {
        for (SourceCodeItem item : items) {
            if (item instanceof DeclarationBearing && ((DeclarationBearing) item).name().equalsIgnoreCase(name)) {
                return Optional.of(item);
            }
            if (item instanceof NamedAction && ((NamedAction) item).name().equalsIgnoreCase(name)) {
                return Optional.of(item);
            }
            if (item instanceof DataTypeDeclaration) {
                for (TypeDeclaration type : ((DataTypeDeclaration) item).declarations()) {
                    if (type.name().equalsIgnoreCase(name)) {
                        return Optional.of(type);
                    }
                }
            }
        }
        return Optional.empty();
    }

    private <T> List<T> itemsOf(Class<T> type) {
        return items.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .toList();
    }

    @Override
    public List<AstNode> children() {
        return List.copyOf(items);
    }

    @Override
    public String render(RenderContext context) {
        String separator = context.blankLineBetweenItems() ? "\n\n" : "\n";
        return Render.join(items, separator, (SourceCodeItem item) -> item.render(context));
    }
}
