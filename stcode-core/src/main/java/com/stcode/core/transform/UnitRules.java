package com.stcode.core.transform;

import com.stcode.core.ast.AccessSpecifier;
import com.stcode.core.ast.Declarations.Extends;
import com.stcode.core.ast.Declarations.Implements;
import com.stcode.core.ast.SourceCode;
import com.stcode.core.ast.SourceCodeItem;
import com.stcode.core.ast.StatementList;
import com.stcode.core.ast.TypeDeclaration;
import com.stcode.core.ast.TypeSpecs.DataType;
import com.stcode.core.ast.Units.DataTypeDeclaration;
import com.stcode.core.ast.Units.EntryAction;
import com.stcode.core.ast.Units.ExitAction;
import com.stcode.core.ast.Units.Function;
import com.stcode.core.ast.Units.FunctionBlock;
import com.stcode.core.ast.Units.FunctionBlockBody;
import com.stcode.core.ast.Units.Method;
import com.stcode.core.ast.Units.NamedAction;
import com.stcode.core.ast.Units.Program;
import com.stcode.core.ast.VariableDeclarationBlock;

/**
 * Handlers for program organization units, actions, {@code TYPE} blocks and the source root.
 */
final class UnitRules {

    private UnitRules() {
    }

    static void register(HandlerRegistry registry) {
        registry
            .passThrough("source_item")
            .register("iec_source", c -> new SourceCode(c.all(SourceCodeItem.class)))
            .register("data_type_declaration", c -> new DataTypeDeclaration(
                c.all(TypeDeclaration.class), c.meta()))
            .register("access_specifier", c -> AccessSpecifier.valueOf(c.firstToken().type()))
            .register("function_block_body", c -> new FunctionBlockBody(c.node(StatementList.class), c.meta()))
            .register("function_block_type_declaration", c -> new FunctionBlock(
                c.tokenText("IDENTIFIER"),
                AccessSpecifier.setOf(c.all(AccessSpecifier.class)),
                c.optional(Extends.class),
                c.optional(Implements.class),
                c.all(VariableDeclarationBlock.class),
                c.optional(FunctionBlockBody.class),
                c.meta()))
            .register("function_declaration", c -> new Function(
                c.tokenText("IDENTIFIER"),
                c.optional(DataType.class),
                c.all(VariableDeclarationBlock.class),
                c.optional(FunctionBlockBody.class),
                c.meta()))
            .register("program_declaration", c -> new Program(
                c.tokenText("IDENTIFIER"),
                c.all(VariableDeclarationBlock.class),
                c.optional(FunctionBlockBody.class),
                c.meta()))
            .register("function_block_method_declaration", c -> new Method(
                AccessSpecifier.setOf(c.all(AccessSpecifier.class)),
                c.tokenText("IDENTIFIER"),
                c.optional(DataType.class),
                c.all(VariableDeclarationBlock.class),
                c.optional(FunctionBlockBody.class),
                c.meta()))
            .register("named_action", c -> new NamedAction(
                c.tokenText("IDENTIFIER"), c.optional(FunctionBlockBody.class), c.meta()))
            .register("entry_action", c -> new EntryAction(c.optional(FunctionBlockBody.class), c.meta()))
            .register("exit_action", c -> new ExitAction(c.optional(FunctionBlockBody.class), c.meta()));
    }
}
