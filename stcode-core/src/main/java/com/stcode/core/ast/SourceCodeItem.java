package com.stcode.core.ast;

/**
 * Top-level item of a source file: a unit, a data type block or a global variable list.
 */
public interface SourceCodeItem extends CommentConsumer {
}
