package com.rosarchitect.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * ArchUnit tests to validate the layering of the recovery pipeline.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are immutable records without pipeline dependencies</li>
 *   <li>Each pipeline stage depends only on the stages before it</li>
 *   <li>Utilities stay free of domain dependencies</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.rosarchitect.core");
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..core.model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnPipelineStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.launch..", "..core.evaluator..", "..core.nodemodel..", "..core.assembler..",
                "..core.query..", "..core.render..", "..core.config..");

        rule.check(classes);
    }

    /**
     * Verifies the launch layer knows nothing about node models or the assembled graph.
     */
    @Test
    void launchAndEvaluator_shouldNotDependOnLaterStages() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..core.launch..", "..core.substitution..", "..core.evaluator..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.nodemodel..", "..core.assembler..", "..core.query..", "..core.render..");

        rule.check(classes);
    }

    @Test
    void nodeModels_shouldNotDependOnAssemblyOrOutput() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.nodemodel..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.evaluator..", "..core.assembler..", "..core.query..", "..core.render..");

        rule.check(classes);
    }

    @Test
    void renderers_shouldOnlyReadTheModel() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.render..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.launch..", "..core.evaluator..", "..core.nodemodel..", "..core.assembler..");

        rule.check(classes);
    }

    /**
     * Verifies utility classes stay low-level and reusable.
     */
    @Test
    void utilClasses_shouldNotDependOnDomain() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.util..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.model..", "..core.launch..", "..core.evaluator..", "..core.nodemodel..");

        rule.check(classes);
    }
}
