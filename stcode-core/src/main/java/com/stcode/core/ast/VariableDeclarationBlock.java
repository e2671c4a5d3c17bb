package com.stcode.core.ast;

import java.util.List;

/**
 * {@code VAR_*} ... {@code END_VAR} block.
 */
public interface VariableDeclarationBlock extends CommentConsumer {

    /**
     * @return which kind of block this is
     */
    DeclarationBlockKind kind();

    /**
     * @return declarations in source order
     */
    List<? extends VariableDeclaration> items();
}
