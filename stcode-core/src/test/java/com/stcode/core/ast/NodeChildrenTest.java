package com.stcode.core.ast;

import com.stcode.core.ast.DeclarationBlocks.InputDeclarations;
import com.stcode.core.ast.Declarations.Extends;
import com.stcode.core.ast.Declarations.VariableList;
import com.stcode.core.ast.Declarations.VariableOne;
import com.stcode.core.ast.Declarations.VariableOneInitDeclaration;
import com.stcode.core.ast.Expressions.BinaryOperation;
import com.stcode.core.ast.Expressions.SymbolicVariable;
import com.stcode.core.ast.Literals.IntegerLiteral;
import com.stcode.core.ast.Statements.ElseClause;
import com.stcode.core.ast.Statements.IfStatement;
import com.stcode.core.ast.Statements.ReturnStatement;
import com.stcode.core.ast.TypeSpecs.TypeInitialization;
import com.stcode.core.ast.Units.FunctionBlock;
import com.stcode.core.ast.Units.FunctionBlockBody;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AstNode#children()}.
 */
class NodeChildrenTest {

    @Test
    void children_leaf_isEmpty() {
        assertThat(IntegerLiteral.decimal("1").children()).isEmpty();
        assertThat(new ReturnStatement(null).children()).isEmpty();
        assertThat(AccessSpecifier.PUBLIC.children()).isEmpty();
    }

    @Test
    void children_binaryOperation_leftThenRight() {
        SymbolicVariable left = SymbolicVariable.of("a");
        IntegerLiteral right = IntegerLiteral.decimal("2");

        assertThat(new BinaryOperation(left, "+", right).children()).containsExactly(left, right);
    }

    @Test
    void children_ifStatement_skipsAbsentParts() {
        SymbolicVariable condition = SymbolicVariable.of("bReady");
        ElseClause elseClause = new ElseClause(null, null);

        IfStatement statement = new IfStatement(condition, null, List.of(), elseClause, null);

        assertThat(statement.children()).containsExactly(condition, elseClause);
    }

    @Test
    void children_functionBlock_followsSourceOrder() {
        Extends base = new Extends("FB_Base");
        VariableOneInitDeclaration declaration = new VariableOneInitDeclaration(
            new VariableList(List.of(new VariableOne("nSpeed", null))),
            new TypeInitialization(null, "INT", null), null);
        InputDeclarations inputs = new InputDeclarations(null, List.of(declaration), null);
        FunctionBlockBody body = new FunctionBlockBody(new StatementList(List.of()), null);

        FunctionBlock functionBlock = new FunctionBlock("FB_Motor", null, base, null, List.of(inputs), body, null);

        assertThat(functionBlock.children()).containsExactly(base, inputs, body);
        assertThat(inputs.children()).containsExactly(declaration);
        assertThat(declaration.children()).containsExactly(declaration.variables(), declaration.init());
    }

    @Test
    void children_genericNode_keepsOnlyTypedParts() {
        SymbolicVariable variable = SymbolicVariable.of("x");

        GenericNode node = new GenericNode("custom_rule", List.of("KEYWORD", variable, ";"));

        assertThat(node.children()).containsExactly(variable);
        assertThat(node.render()).isEqualTo("KEYWORD x ;");
    }
}
