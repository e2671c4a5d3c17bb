package com.stcode.core.ast;

/**
 * Value-producing node: literals, variables, operations and calls.
 */
public interface Expression extends AstNode {
}
