package com.stcode.core.ast;

/**
 * User-defined type inside a {@code TYPE ... END_TYPE} block.
 */
public interface TypeDeclaration extends CommentConsumer {

    /**
     * @return declared type name
     */
    String name();
}
