package com.stcode.core.index;

import com.stcode.core.ast.DeclarationBlockKind;
import com.stcode.core.ast.VariableDeclaration;

import java.util.Objects;

/**
 * A single variable name with the block it was declared in.
 *
 * @param name declared name
 * @param kind kind of the enclosing block
 * @param declaration declaration that introduced the name
 */
public record DeclaredVariable(String name, DeclarationBlockKind kind, VariableDeclaration declaration) {

    public DeclaredVariable {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(declaration, "declaration must not be null");
    }
}
