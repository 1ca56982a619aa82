package com.flowbridge.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate the layering of the compiler.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are immutable records or enums</li>
 *   <li>The model depends on no compiler stage</li>
 *   <li>Compiler stages do not depend on emitters, renderers or the validator</li>
 *   <li>Emitters are reached only through their SPI</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.flowbridge.core");
    }

    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beAssignableTo(Record.class);

        rule.check(classes);
    }

    /**
     * The model is shared by every stage; it must not pull any of them in.
     */
    @Test
    void models_shouldNotDependOnStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.parser..", "..core.palette..", "..core.routing..", "..core.wiring..",
                "..core.assembly..", "..core.compiler..", "..core.emit..", "..core.renderer..");

        rule.check(classes);
    }

    @Test
    void compilerStages_shouldNotDependOnOutputSide() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..core.parser..", "..core.analysis..", "..core.routing..",
                "..core.wiring..", "..core.assembly..", "..core.compiler..", "..core.prompt..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.emit..", "..core.renderer..", "..core.validate..");

        rule.check(classes);
    }

    @Test
    void emitterImplementations_shouldOnlyBeUsedThroughSpi() {
        ArchRule rule = noClasses()
            .that().resideOutsideOfPackage("..core.emit.impl..")
            .should().dependOnClassesThat().resideInAPackage("..core.emit.impl..");

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnDomain() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.util..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.model..", "..core.palette..");

        rule.check(classes);
    }
}
