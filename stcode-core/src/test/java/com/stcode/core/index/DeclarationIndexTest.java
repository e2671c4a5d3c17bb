package com.stcode.core.index;

import com.stcode.core.ast.DeclarationBlockKind;
import com.stcode.core.ast.SourceCode;
import com.stcode.core.parse.SourceCodeParser;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DeclarationIndexTest {

    private static final String SOURCE = String.join("\n",
        "FUNCTION_BLOCK FB_Valve",
        "VAR_INPUT",
        "    bOpen, bClose : BOOL;",
        "END_VAR",
        "VAR_OUTPUT",
        "    bIsOpen : BOOL;",
        "END_VAR",
        "VAR",
        "    nCycles : UDINT;",
        "    bOpen : INT;",
        "END_VAR",
        "END_FUNCTION_BLOCK",
        "",
        "FUNCTION F_Double : INT",
        "VAR_INPUT",
        "    nIn : INT;",
        "END_VAR",
        "F_Double := nIn * 2;",
        "END_FUNCTION",
        "");

    private final SourceCode source = new SourceCodeParser().parse(SOURCE, "valve.st").root();

    @Test
    void forSource_indexesEveryUnitInOrder() {
        Map<String, DeclarationIndex> indexes = DeclarationIndex.forSource(source);

        assertThat(indexes).containsOnlyKeys("FB_Valve", "F_Double");
        assertThat(indexes.keySet()).containsExactly("FB_Valve", "F_Double");
        assertThat(indexes.get("F_Double").variables(DeclarationBlockKind.VAR_INPUT))
            .extracting(DeclaredVariable::name).containsExactly("nIn");
    }

    @Test
    void variables_groupsByBlockKind() {
        DeclarationIndex index = DeclarationIndex.forSource(source).get("FB_Valve");

        assertThat(index.unitName()).isEqualTo("FB_Valve");
        assertThat(index.variables(DeclarationBlockKind.VAR_INPUT))
            .extracting(DeclaredVariable::name).containsExactly("bOpen", "bClose");
        assertThat(index.variables(DeclarationBlockKind.VAR_OUTPUT))
            .extracting(DeclaredVariable::name).containsExactly("bIsOpen");
        assertThat(index.variables(DeclarationBlockKind.VAR_IN_OUT)).isEmpty();
        assertThat(index.variablesByKind()).containsOnlyKeys(
            DeclarationBlockKind.VAR_INPUT, DeclarationBlockKind.VAR_OUTPUT, DeclarationBlockKind.VAR);
    }

    @Test
    void variablesByName_repeatedName_firstDeclarationWins() {
        DeclarationIndex index = DeclarationIndex.forSource(source).get("FB_Valve");

        assertThat(index.size()).isEqualTo(4);
        assertThat(index.variablesByName().keySet()).containsExactly("bOpen", "bClose", "bIsOpen", "nCycles");
        assertThat(index.variablesByName().get("bOpen").kind()).isEqualTo(DeclarationBlockKind.VAR_INPUT);
        assertThat(index.variables(DeclarationBlockKind.VAR))
            .extracting(DeclaredVariable::name).containsExactly("nCycles", "bOpen");
    }

    @Test
    void find_ignoresCase() {
        DeclarationIndex index = DeclarationIndex.forSource(source).get("FB_Valve");

        assertThat(index.find("NCYCLES")).hasValueSatisfying(variable -> {
            assertThat(variable.name()).isEqualTo("nCycles");
            assertThat(variable.kind()).isEqualTo(DeclarationBlockKind.VAR);
        });
        assertThat(index.find("missing")).isEmpty();
    }
}
