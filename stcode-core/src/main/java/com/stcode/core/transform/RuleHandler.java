package com.stcode.core.transform;

/**
 * Builds the typed value of one grammar rule from its already transformed children.
 *
 * <p>Most handlers return an AST node; a few return helper values (a token, an enum
 * constant) that only their parent rule consumes.
 */
@FunctionalInterface
public interface RuleHandler {

    /**
     * @param children transformed children of the rule
     * @return value for the parent rule to consume
     * @throws ConstructionException if the children do not have the expected shape
     */
    Object handle(Children children);
}
