package com.causescore;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: common and domain at the bottom, api on top, scoring free of storage and HTTP concerns.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.causescore");
    }

    @Test
    void domain_must_not_depend_on_feature_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.causescore.domain..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.causescore.ingestion..", "com.causescore.config..", "com.causescore.api..",
                        "com.causescore.catalog..", "com.causescore.scoring..", "com.causescore.evaluation..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.causescore.common..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.causescore.domain..", "com.causescore.ingestion..", "com.causescore.config..",
                        "com.causescore.api..", "com.causescore.catalog..", "com.causescore.scoring..",
                        "com.causescore.evaluation..");
        rule.check(classes);
    }

    @Test
    void ingestion_must_not_depend_on_scoring_evaluation_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.causescore.ingestion..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.causescore.scoring..", "com.causescore.evaluation..", "com.causescore.api..");
        rule.check(classes);
    }

    @Test
    void scoring_must_not_depend_on_ingestion_evaluation_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.causescore.scoring..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.causescore.ingestion..", "com.causescore.evaluation..", "com.causescore.api..");
        rule.check(classes);
    }

    @Test
    void catalog_must_not_depend_on_ingestion_scoring_evaluation_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.causescore.catalog..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.causescore.ingestion..", "com.causescore.scoring..", "com.causescore.evaluation..",
                        "com.causescore.api..");
        rule.check(classes);
    }

    @Test
    void adapters_must_not_depend_on_job_triggers() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.causescore.ingestion.adapter..")
                .should().dependOnClassesThat().resideInAPackage("com.causescore.ingestion.job..");
        rule.check(classes);
    }

    @Test
    void api_should_not_import_repository_classes() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.causescore.api..")
                .should().dependOnClassesThat().haveSimpleNameEndingWith("Repository");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.causescore.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
