package com.stcode.core.ast;

import java.util.List;

/**
 * Unit that owns variable declaration blocks: functions, function blocks, programs and methods.
 */
public interface DeclarationBearing extends SourceCodeItem {

    /**
     * @return unit name
     */
    String name();

    /**
     * @return declaration blocks in source order
     */
    List<VariableDeclarationBlock> declarations();
}
