package com.vidnyan.guard.architecture;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Layering of the hexagonal packages: domain at the centre, ports in
 * application, adapters outside.
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
                .withImportOption(new ImportOption.DoNotIncludeTests())
                .importPackages("com.vidnyan.guard");
    }

    @Test
    void domain_ShouldNotDependOnOuterLayersOrSpring() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..guard.domain..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "..guard.application..", "..guard.adapter..", "..guard.config..", "org.springframework..");

        rule.check(classes);
    }

    @Test
    void application_ShouldNotDependOnAdapters() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..guard.application..")
                .should().dependOnClassesThat().resideInAnyPackage("..guard.adapter..", "..guard.config..");

        rule.check(classes);
    }

    @Test
    void outboundAdapters_ShouldNotDependOnInboundAdapters() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..guard.adapter.out..")
                .should().dependOnClassesThat().resideInAPackage("..guard.adapter.in..");

        rule.check(classes);
    }
}
