package io.duomap.arch;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

class ArchitectureTest {

    @Test
    void coreShouldNotDependOnOtherLayers() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.duomap.core..")
                .should().dependOnClassesThat()
                .resideInAnyPackage(
                        "io.duomap.schema..",
                        "io.duomap.validation..",
                        "io.duomap.storage..",
                        "io.duomap.runtime..",
                        "io.duomap.transfer..");
        rule.check(importedMainClasses());
    }

    @Test
    void schemaShouldNotDependOnRuntimeOrStorage() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.duomap.schema..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("io.duomap.runtime..", "io.duomap.storage..", "io.duomap.validation..");
        rule.check(importedMainClasses());
    }

    @Test
    void storageShouldNotDependOnRuntime() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.duomap.storage..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("io.duomap.runtime..", "io.duomap.transfer..", "io.duomap.validation..");
        rule.check(importedMainClasses());
    }

    @Test
    void runtimeShouldNotDependOnTransfer() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.duomap.runtime..")
                .should().dependOnClassesThat().resideInAPackage("io.duomap.transfer..");
        rule.check(importedMainClasses());
    }

    @Test
    void onlyRuntimeShouldUseByteBuddy() {
        ArchRule rule = noClasses()
                .that().resideOutsideOfPackage("io.duomap.runtime..")
                .should().dependOnClassesThat().resideInAPackage("net.bytebuddy..");
        rule.check(importedMainClasses());
    }

    @Test
    void onlyValidationShouldUseJackson() {
        ArchRule rule = noClasses()
                .that().resideOutsideOfPackage("io.duomap.validation..")
                .should().dependOnClassesThat().resideInAPackage("com.fasterxml.jackson..");
        rule.check(importedMainClasses());
    }

    @Test
    void mainCodeShouldNotDependOnTestPackages() {
        ArchRule rule = noClasses()
                .should().dependOnClassesThat().resideInAPackage("..testutil..");
        rule.check(importedMainClasses());
    }

    private static JavaClasses importedMainClasses() {
        return new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("io.duomap..");
    }
}
