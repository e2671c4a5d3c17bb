package com.stcode.core.transform;

import com.stcode.core.ast.AstNode;
import com.stcode.core.ast.DeclarationBlocks.AccessDeclarations;
import com.stcode.core.ast.DeclarationBlocks.ExternalVariableDeclarations;
import com.stcode.core.ast.DeclarationBlocks.FunctionVariableDeclarations;
import com.stcode.core.ast.DeclarationBlocks.GlobalVariableDeclarations;
import com.stcode.core.ast.DeclarationBlocks.InputDeclarations;
import com.stcode.core.ast.DeclarationBlocks.InputOutputDeclarations;
import com.stcode.core.ast.DeclarationBlocks.InstanceVariableDeclarations;
import com.stcode.core.ast.DeclarationBlocks.LocatedVariableDeclarations;
import com.stcode.core.ast.DeclarationBlocks.OutputDeclarations;
import com.stcode.core.ast.DeclarationBlocks.TemporaryVariableDeclarations;
import com.stcode.core.ast.DeclarationBlocks.VariableDeclarations;
import com.stcode.core.ast.Declarations.AccessDeclaration;
import com.stcode.core.ast.Declarations.ArrayTypeDeclaration;
import com.stcode.core.ast.Declarations.ArrayVariableInitDeclaration;
import com.stcode.core.ast.Declarations.EdgeDeclaration;
import com.stcode.core.ast.Declarations.EnumeratedTypeDeclaration;
import com.stcode.core.ast.Declarations.Extends;
import com.stcode.core.ast.Declarations.ExternalVariableDeclaration;
import com.stcode.core.ast.Declarations.FunctionBlockInvocation;
import com.stcode.core.ast.Declarations.FunctionBlockInvocationDeclaration;
import com.stcode.core.ast.Declarations.FunctionBlockNameDeclaration;
import com.stcode.core.ast.Declarations.GlobalVariableDeclaration;
import com.stcode.core.ast.Declarations.GlobalVariableSpec;
import com.stcode.core.ast.Declarations.Implements;
import com.stcode.core.ast.Declarations.InitializedStructureTypeDeclaration;
import com.stcode.core.ast.Declarations.LocatedVariableDeclaration;
import com.stcode.core.ast.Declarations.SimpleTypeDeclaration;
import com.stcode.core.ast.Declarations.StringTypeDeclaration;
import com.stcode.core.ast.Declarations.StringVariableInitDeclaration;
import com.stcode.core.ast.Declarations.StructureElementDeclaration;
import com.stcode.core.ast.Declarations.StructureTypeDeclaration;
import com.stcode.core.ast.Declarations.SubrangeTypeDeclaration;
import com.stcode.core.ast.Declarations.VariableList;
import com.stcode.core.ast.Declarations.VariableOne;
import com.stcode.core.ast.Declarations.VariableOneInitDeclaration;
import com.stcode.core.ast.Expression;
import com.stcode.core.ast.IncompleteLocation;
import com.stcode.core.ast.IndirectionType;
import com.stcode.core.ast.TypeInitializer;
import com.stcode.core.ast.TypeSpecs.ArrayTypeInitialization;
import com.stcode.core.ast.TypeSpecs.DataType;
import com.stcode.core.ast.TypeSpecs.EnumeratedTypeInitialization;
import com.stcode.core.ast.TypeSpecs.InitializedStructure;
import com.stcode.core.ast.TypeSpecs.Location;
import com.stcode.core.ast.TypeSpecs.StringTypeInitialization;
import com.stcode.core.ast.TypeSpecs.StructureInitialization;
import com.stcode.core.ast.TypeSpecs.SubrangeTypeInitialization;
import com.stcode.core.ast.TypeSpecs.TypeInitialization;
import com.stcode.core.ast.VariableAttribute;
import com.stcode.core.ast.VariableDeclaration;
import com.stcode.core.engine.Token;

import java.util.List;
import java.util.Set;

/**
 * Handlers for type declarations, variable declarations and {@code VAR_*} blocks.
 */
final class DeclarationRules {

    private DeclarationRules() {
    }

    static void register(HandlerRegistry registry) {
        registerTypes(registry);
        registerVariables(registry);
        registerBlocks(registry);
    }

    private static void registerTypes(HandlerRegistry registry) {
        registry
            .passThrough("type_declaration")
            .register("extends_clause", c -> new Extends(c.tokenText("IDENTIFIER")))
            .register("implements_clause", c -> new Implements(names(c.tokens("IDENTIFIER"))))
            .register("simple_type_declaration", c -> new SimpleTypeDeclaration(c.tokenText("IDENTIFIER"),
                c.optional(Extends.class), c.node(TypeInitialization.class), c.meta()))
            .register("string_type_declaration", c -> new StringTypeDeclaration(c.tokenText("IDENTIFIER"),
                c.node(StringTypeInitialization.class), c.meta()))
            .register("subrange_type_declaration", c -> new SubrangeTypeDeclaration(c.tokenText("IDENTIFIER"),
                c.node(SubrangeTypeInitialization.class), c.meta()))
            .register("enumerated_type_declaration", c -> new EnumeratedTypeDeclaration(c.tokenText("IDENTIFIER"),
                c.node(EnumeratedTypeInitialization.class), c.meta()))
            .register("array_type_declaration", c -> new ArrayTypeDeclaration(c.tokenText("IDENTIFIER"),
                c.node(ArrayTypeInitialization.class), c.meta()))
            .register("structure_type_declaration", c -> new StructureTypeDeclaration(c.tokenText("IDENTIFIER"),
                c.optional(Extends.class), c.optional(IndirectionType.class),
                c.all(StructureElementDeclaration.class), c.meta()))
            .register("structure_element_declaration", c -> new StructureElementDeclaration(
                c.tokenText("IDENTIFIER"), c.optional(IncompleteLocation.class), c.node(TypeInitializer.class),
                c.meta()))
            .register("initialized_structure_type_declaration", c -> new InitializedStructureTypeDeclaration(
                c.tokenText("IDENTIFIER"), c.optional(Extends.class), c.node(InitializedStructure.class),
                c.meta()));
    }

    private static void registerVariables(HandlerRegistry registry) {
        registry
            .passThrough("var_init_decl", "var_block_item", "input_declaration")
            .register("var1", c -> new VariableOne(c.tokenText("IDENTIFIER"), c.optional(IncompleteLocation.class)))
            .register("var1_list", c -> new VariableList(c.all(VariableOne.class)))
            .register("fb_decl_name_list", c -> new VariableList(
                c.tokens("IDENTIFIER").stream().map(t -> VariableOne.of(t.text())).toList()))
            .register("var1_init_decl", c -> new VariableOneInitDeclaration(c.node(VariableList.class),
                c.node(TypeInitializer.class), c.meta()))
            .register("array_var_init_decl", c -> new ArrayVariableInitDeclaration(c.node(VariableList.class),
                c.node(ArrayTypeInitialization.class), c.meta()))
            .register("string_var_declaration", c -> new StringVariableInitDeclaration(c.node(VariableList.class),
                c.node(StringTypeInitialization.class), c.meta()))
            .register("edge_declaration", DeclarationRules::edgeDeclaration)
            .register("fb_name_decl", c -> new FunctionBlockNameDeclaration(c.node(VariableList.class),
                c.tokenText("IDENTIFIER"), c.node(StructureInitialization.class), c.meta()))
            .register("fb_invocation", c -> new FunctionBlockInvocation(c.tokenText("IDENTIFIER"),
                ExpressionRules.parameters(c)))
            .register("fb_invocation_decl", c -> new FunctionBlockInvocationDeclaration(c.node(VariableList.class),
                c.node(FunctionBlockInvocation.class), c.meta()))
            .register("located_var_decl", DeclarationRules::locatedVariable)
            .register("global_var_spec", DeclarationRules::globalVariableSpec)
            .register("global_var_decl", DeclarationRules::globalVariable)
            .register("external_declaration", c -> new ExternalVariableDeclaration(c.tokenText("IDENTIFIER"),
                c.get(c.size() - 1, AstNode.class), c.meta()))
            .register("program_access_decl", DeclarationRules::accessDeclaration)
            .register("variable_attribute", c -> VariableAttribute.valueOf(c.firstToken().type()));
    }

    private static void registerBlocks(HandlerRegistry registry) {
        registry
            .passThrough("var_declaration_block", "function_var_block")
            .register("var_declarations", DeclarationRules::varDeclarations)
            .register("temp_var_decls", c -> new TemporaryVariableDeclarations(
                c.all(VariableDeclaration.class), c.meta()))
            .register("input_declarations", c -> new InputDeclarations(
                attributes(c), c.all(VariableDeclaration.class), c.meta()))
            .register("output_declarations", c -> new OutputDeclarations(
                attributes(c), c.all(VariableDeclaration.class), c.meta()))
            .register("input_output_declarations", c -> new InputOutputDeclarations(
                c.all(VariableDeclaration.class), c.meta()))
            .register("global_var_declarations", c -> new GlobalVariableDeclarations(
                attributes(c), c.all(GlobalVariableDeclaration.class), c.meta()))
            .register("external_var_declarations", c -> new ExternalVariableDeclarations(
                attributes(c), c.all(ExternalVariableDeclaration.class), c.meta()))
            .register("program_access_decls", c -> new AccessDeclarations(
                c.all(AccessDeclaration.class), c.meta()))
            .register("var_inst_declaration", c -> new InstanceVariableDeclarations(
                c.all(VariableDeclaration.class), c.meta()))
            .register("function_var_declarations", c -> new FunctionVariableDeclarations(
                c.hasToken("CONSTANT"), c.all(VariableDeclaration.class), c.meta()));
    }

    private static EdgeDeclaration edgeDeclaration(Children c) {
        Token edge = c.optionalToken("R_EDGE");
        if (edge == null) {
            edge = c.token("F_EDGE");
        }
        return new EdgeDeclaration(c.node(VariableList.class), c.tokenText("IDENTIFIER"),
            edge.type(), c.meta());
    }

    private static LocatedVariableDeclaration locatedVariable(Children c) {
        Token name = c.optionalToken("IDENTIFIER");
        return new LocatedVariableDeclaration(name == null ? null : name.text(), c.node(Location.class),
            c.node(TypeInitializer.class), c.meta());
    }

    private static GlobalVariableSpec globalVariableSpec(Children c) {
        AstNode location = c.optional(Location.class);
        if (location == null) {
            location = c.optional(IncompleteLocation.class);
        }
        return new GlobalVariableSpec(names(c.tokens("IDENTIFIER")), location);
    }

    /**
     * The initializer after the variable names is a type initializer or a function block invocation.
     */
    private static GlobalVariableDeclaration globalVariable(Children c) {
        GlobalVariableSpec spec = c.get(0, GlobalVariableSpec.class);
        AstNode init = c.get(c.size() - 1, AstNode.class);
        if (!(init instanceof TypeInitializer) && !(init instanceof FunctionBlockInvocation)) {
            throw c.failure("unexpected global variable initializer " + init.getClass().getSimpleName());
        }
        return new GlobalVariableDeclaration(spec, init, c.meta());
    }

    private static AccessDeclaration accessDeclaration(Children c) {
        Token direction = c.optionalToken("READ_WRITE");
        if (direction == null) {
            direction = c.optionalToken("READ_ONLY");
        }
        return new AccessDeclaration(c.tokenText("IDENTIFIER"), c.node(Expression.class), c.node(DataType.class),
            direction == null ? null : direction.type(), c.meta());
    }

    /**
     * A {@code VAR} block with any {@code AT %...} declaration is a located block.
     */
    private static AstNode varDeclarations(Children c) {
        Set<VariableAttribute> attributes = attributes(c);
        List<VariableDeclaration> items = c.all(VariableDeclaration.class);
        boolean located = items.stream().anyMatch(LocatedVariableDeclaration.class::isInstance);
        if (located) {
            return new LocatedVariableDeclarations(attributes, items, c.meta());
        }
        return new VariableDeclarations(attributes, items, c.meta());
    }

    private static Set<VariableAttribute> attributes(Children c) {
        return VariableAttribute.setOf(c.all(VariableAttribute.class));
    }

    static List<String> names(List<Token> tokens) {
        return tokens.stream().map(Token::text).toList();
    }
}
