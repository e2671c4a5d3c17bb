package com.stcode.core.ast;

/**
 * Array dimension or subrange bound: either {@code *} or {@code start..stop}.
 */
public interface Subrange extends AstNode {
}
