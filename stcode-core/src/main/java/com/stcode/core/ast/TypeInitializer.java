package com.stcode.core.ast;

/**
 * Right-hand side of a declaration: a type specification with an optional initial value.
 */
public interface TypeInitializer extends AstNode {
}
