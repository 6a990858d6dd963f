package com.stackdoc.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * ArchUnit tests for the package layering of the core module.
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.stackdoc.core");
    }

    /**
     * Element model types are immutable records (or enums).
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void loader_shouldNotDependOnGeneration() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..loader..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..generator..", "..pipeline..", "..renderer..", "..model..");

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage("..generator..", "..pipeline..", "..renderer..");

        rule.check(classes);
    }

    /**
     * Utilities are leaf code with no project dependencies.
     */
    @Test
    void utilClasses_shouldNotDependOnOtherPackages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..loader..", "..model..", "..generator..", "..pipeline..", "..renderer..", "..config..");

        rule.check(classes);
    }

    @Test
    void generator_shouldNotDependOnPipelineOrRenderers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..generator..")
            .should().dependOnClassesThat().resideInAnyPackage("..pipeline..", "..renderer..");

        rule.check(classes);
    }
}
