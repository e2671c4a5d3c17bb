package com.stcode.core.transform;

import com.stcode.core.ast.Meta;
import com.stcode.core.engine.GenericTree;
import com.stcode.core.engine.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed view over the transformed children of one rule.
 *
 * <p>Items are tokens and the values returned by child handlers, in source order.
 * Required accessors throw {@link ConstructionException} naming the rule and child count
 * when the shape does not match, so handlers never catch exceptions to test for shapes.
 */
public final class Children {

    private final String filename;
    private final GenericTree tree;
    private final List<Object> items;

    public Children(String filename, GenericTree tree, List<Object> items) {
        this.filename = filename;
        this.tree = tree;
        this.items = List.copyOf(items);
    }

    public String rule() {
        return tree.rule();
    }

    public String filename() {
        return filename;
    }

    public List<Object> items() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public Object get(int index) {
        if (index < 0 || index >= items.size()) {
            throw failure("no child at position " + index);
        }
        return items.get(index);
    }

    /**
     * @return the child at {@code index}, which must be of the given type
     */
    public <T> T get(int index, Class<T> type) {
        Object item = get(index);
        if (!type.isInstance(item)) {
            throw failure("expected " + type.getSimpleName() + " at position " + index + " but got " + describe(item));
        }
        return type.cast(item);
    }

    /**
     * @return the only child, for rules that just select an alternative
     */
    public Object sole() {
        if (items.size() != 1) {
            throw failure("expected exactly one child");
        }
        return items.get(0);
    }

    /**
     * @return first child of the given type
     */
    public <T> T node(Class<T> type) {
        T found = optional(type);
        if (found == null) {
            throw failure("missing " + type.getSimpleName());
        }
        return found;
    }

    /**
     * @return first child of the given type, or {@code null}
     */
    public <T> T optional(Class<T> type) {
        for (Object item : items) {
            if (type.isInstance(item)) {
                return type.cast(item);
            }
        }
        return null;
    }

    public <T> List<T> all(Class<T> type) {
        List<T> found = new ArrayList<>();
        for (Object item : items) {
            if (type.isInstance(item)) {
                found.add(type.cast(item));
            }
        }
        return found;
    }

    /**
     * @return all children of the given type, which must number exactly {@code count}
     */
    public <T> List<T> exactly(Class<T> type, int count) {
        List<T> found = all(type);
        if (found.size() != count) {
            throw failure("expected " + count + " " + type.getSimpleName() + " but found " + found.size());
        }
        return found;
    }

    public boolean hasToken(String type) {
        return optionalToken(type) != null;
    }

    public Token token(String type) {
        Token token = optionalToken(type);
        if (token == null) {
            throw failure("missing token " + type);
        }
        return token;
    }

    public Token optionalToken(String type) {
        for (Object item : items) {
            if (item instanceof Token && ((Token) item).is(type)) {
                return (Token) item;
            }
        }
        return null;
    }

    public String tokenText(String type) {
        return token(type).text();
    }

    public List<Token> tokens(String type) {
        List<Token> found = new ArrayList<>();
        for (Object item : items) {
            if (item instanceof Token && ((Token) item).is(type)) {
                found.add((Token) item);
            }
        }
        return found;
    }

    /**
     * @return first token among the direct children
     */
    public Token firstToken() {
        Token token = optional(Token.class);
        if (token == null) {
            throw failure("no token among children");
        }
        return token;
    }

    /**
     * @return source position of this rule for a comment consumer
     */
    public Meta meta() {
        return new Meta(tree.line(), tree.endLine(), tree.startIndex(), tree.stopIndex());
    }

    public ConstructionException failure(String detail) {
        return new ConstructionException(filename, tree.rule(), items.size(), detail);
    }

    private static String describe(Object item) {
        return item == null ? "null" : item.getClass().getSimpleName();
    }
}
