package com.stcode.core.ast;

/**
 * Executable statement inside a unit body. Statements render their own terminator.
 */
public interface Statement extends CommentConsumer {
}
