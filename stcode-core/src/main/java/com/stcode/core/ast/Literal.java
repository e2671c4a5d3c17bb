package com.stcode.core.ast;

/**
 * Constant value written directly in the source.
 */
public interface Literal extends Expression {
}
