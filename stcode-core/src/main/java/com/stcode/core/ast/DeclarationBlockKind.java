package com.stcode.core.ast;

/**
 * Kind of a variable declaration block, used to group variables by role.
 */
public enum DeclarationBlockKind {
    VAR("VAR"),
    VAR_TEMP("VAR_TEMP"),
    VAR_INPUT("VAR_INPUT"),
    VAR_OUTPUT("VAR_OUTPUT"),
    VAR_IN_OUT("VAR_IN_OUT"),
    VAR_GLOBAL("VAR_GLOBAL"),
    VAR_EXTERNAL("VAR_EXTERNAL"),
    /** {@code VAR} block holding at least one {@code AT %...} declaration. */
    LOCATED("VAR"),
    VAR_ACCESS("VAR_ACCESS"),
    VAR_INST("VAR_INST"),
    /** {@code VAR [CONSTANT]} inside a function or method. */
    FUNCTION_VAR("VAR");

    private final String keyword;

    DeclarationBlockKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * @return opening keyword of the block
     */
    public String keyword() {
        return keyword;
    }
}
