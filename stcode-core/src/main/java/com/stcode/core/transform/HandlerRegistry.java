package com.stcode.core.transform;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Rule name to {@link RuleHandler} table.
 *
 * <p>Built once; registering a rule twice fails immediately so that two handlers can
 * never silently compete for a production.
 */
public final class HandlerRegistry {

    private final Map<String, RuleHandler> handlers = new HashMap<>();

    /**
     * @return registry holding the handlers for every rule of the Structured Text grammar
     */
    public static HandlerRegistry standard() {
        HandlerRegistry registry = new HandlerRegistry();
        LiteralRules.register(registry);
        ExpressionRules.register(registry);
        TypeRules.register(registry);
        DeclarationRules.register(registry);
        UnitRules.register(registry);
        StatementRules.register(registry);
        return registry;
    }

    /**
     * @throws IllegalStateException if the rule already has a handler
     */
    public HandlerRegistry register(String rule, RuleHandler handler) {
        if (handlers.putIfAbsent(rule, handler) != null) {
            throw new IllegalStateException("Duplicate handler for rule: " + rule);
        }
        return this;
    }

    /**
     * Registers a handler for a rule that only selects one of its alternatives.
     */
    public HandlerRegistry passThrough(String... rules) {
        for (String rule : rules) {
            register(rule, Children::sole);
        }
        return this;
    }

    /**
     * @return handler for the rule, or {@code null}
     */
    public RuleHandler find(String rule) {
        return handlers.get(rule);
    }

    public Set<String> rules() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}
