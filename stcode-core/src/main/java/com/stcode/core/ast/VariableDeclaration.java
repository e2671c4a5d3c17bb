package com.stcode.core.ast;

import java.util.List;

/**
 * Single declaration line inside a variable declaration block.
 */
public interface VariableDeclaration extends CommentConsumer {

    /**
     * Names introduced by this declaration, in source order.
     *
     * <p>A located declaration without a name ({@code AT %IX0.0 : BOOL}) introduces none.
     *
     * @return declared variable names
     */
    List<String> variableNames();
}
