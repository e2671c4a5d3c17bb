package com.stcode.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests for the layering of the parsing pipeline.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>The AST and rendering helpers know nothing about parsing</li>
 *   <li>Only the engine touches the ANTLR runtime</li>
 *   <li>Handlers build nodes from engine-neutral trees</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.stcode.core");
    }

    /**
     * Rendering helpers are shared by all nodes and must not depend on them.
     */
    @Test
    void render_shouldNotDependOnAst() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.render..")
            .should().dependOnClassesThat().resideInAPackage("..core.ast..");

        rule.check(classes);
    }

    /**
     * Nodes can be built and rendered without any parser on the class path.
     */
    @Test
    void ast_shouldOnlyDependOnRender() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.ast..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.engine..", "..core.transform..", "..core.comments..", "..core.parse..",
                "..core.batch..", "..core.config..", "org.antlr..");

        rule.check(classes);
    }

    @Test
    void transform_shouldNotDependOnAntlr() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.transform..")
            .should().dependOnClassesThat().resideInAPackage("org.antlr..");

        rule.check(classes);
    }

    @Test
    void engine_shouldNotDependOnTransform() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.engine..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.transform..", "..core.ast..");

        rule.check(classes);
    }

    @Test
    void comments_shouldNotDependOnParsing() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.comments..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.engine..", "..core.transform..", "..core.parse..");

        rule.check(classes);
    }

    /**
     * Batch results, parse results and indexes are immutable value types.
     */
    @Test
    void resultTypes_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAnyPackage("..core.batch..", "..core.parse..")
            .and().areTopLevelClasses()
            .and().haveSimpleNameNotEndingWith("Parser")
            .should().beRecords();

        rule.check(classes);
    }
}
