package com.stcode.core.index;

import com.stcode.core.ast.DeclarationBearing;
import com.stcode.core.ast.DeclarationBlockKind;
import com.stcode.core.ast.SourceCode;
import com.stcode.core.ast.VariableDeclaration;
import com.stcode.core.ast.VariableDeclarationBlock;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Variables of one unit, by name and by block kind.
 *
 * <p>This is what documentation and tooling read from the AST: which inputs, outputs
 * and locals a function block has, and where each one was declared.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DeclarationIndex index = DeclarationIndex.of(functionBlock);
 * List<DeclaredVariable> inputs = index.variables(DeclarationBlockKind.VAR_INPUT);
 * }</pre>
 */
public final class DeclarationIndex {

    private final String unitName;
    private final Map<String, DeclaredVariable> byName;
    private final Map<DeclarationBlockKind, List<DeclaredVariable>> byKind;

    private DeclarationIndex(String unitName, Map<String, DeclaredVariable> byName,
                             Map<DeclarationBlockKind, List<DeclaredVariable>> byKind) {
        this.unitName = unitName;
        this.byName = byName;
        this.byKind = byKind;
    }

    public static DeclarationIndex of(DeclarationBearing unit) {
        Map<String, DeclaredVariable> byName = new LinkedHashMap<>();
        Map<DeclarationBlockKind, List<DeclaredVariable>> byKind = new EnumMap<>(DeclarationBlockKind.class);
        for (VariableDeclarationBlock block : unit.declarations()) {
            for (VariableDeclaration declaration : block.items()) {
                for (String name : declaration.variableNames()) {
                    DeclaredVariable variable = new DeclaredVariable(name, block.kind(), declaration);
                    byName.putIfAbsent(name, variable);
                    byKind.computeIfAbsent(block.kind(), kind -> new ArrayList<>()).add(variable);
                }
            }
        }
        byKind.replaceAll((kind, variables) -> List.copyOf(variables));
        return new DeclarationIndex(unit.name(), Collections.unmodifiableMap(byName),
            Collections.unmodifiableMap(byKind));
    }

    /**
     * @return index of every declaration-bearing unit, keyed by unit name in source order
     */
    public static Map<String, DeclarationIndex> forSource(SourceCode source) {
        Map<String, DeclarationIndex> indexes = new LinkedHashMap<>();
        for (DeclarationBearing unit : source.declarationBearingUnits()) {
            indexes.put(unit.name(), of(unit));
        }
        return Collections.unmodifiableMap(indexes);
    }

    public String unitName() {
        return unitName;
    }

    /**
     * @return variables in declaration order; the first declaration of a repeated name wins
     */
    public Map<String, DeclaredVariable> variablesByName() {
        return byName;
    }

    public Map<DeclarationBlockKind, List<DeclaredVariable>> variablesByKind() {
        return byKind;
    }

    public List<DeclaredVariable> variables(DeclarationBlockKind kind) {
        return byKind.getOrDefault(kind, List.of());
    }

    /**
     * Looks a variable up ignoring case, as Structured Text identifiers are case-insensitive.
     */
    public Optional<DeclaredVariable> find(String name) {
        DeclaredVariable exact = byName.get(name);
        if (exact != null) {
            return Optional.of(exact);
        }
        String wanted = name.toUpperCase(Locale.ROOT);
        return byName.values().stream()
            .filter(variable -> variable.name().toUpperCase(Locale.ROOT).equals(wanted))
            .findFirst();
    }

    public int size() {
        return byName.size();
    }
}
