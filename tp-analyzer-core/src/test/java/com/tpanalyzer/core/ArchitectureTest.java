package com.tpanalyzer.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests for package layering.
 *
 * <p>Parsing feeds analysis, analysis feeds generation, generation feeds rendering;
 * no layer reaches back up.
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.tpanalyzer.core");
    }

    /**
     * Verifies all domain models in the model package are records or enums.
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
    void lineParsers_shouldExtendAbstractLineParser() {
        ArchRule rule = classes()
            .that().resideInAPackage("..parser..")
            .and().haveSimpleNameEndingWith("Parser")
            .and().doNotHaveSimpleName("AbstractLineParser")
            .should().beAssignableTo("com.tpanalyzer.core.parser.AbstractLineParser");

        rule.check(classes);
    }

    @Test
    void parser_shouldNotDependOnAnalysis() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..parser..")
            .should().dependOnClassesThat().resideInAnyPackage("..analysis..", "..generator..", "..renderer..");

        rule.check(classes);
    }

    /**
     * Verifies generators and renderers consume the analysis result only.
     */
    @Test
    void outputLayers_shouldNotDependOnAnalysis() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..generator..", "..renderer..")
            .should().dependOnClassesThat().resideInAnyPackage("..analysis..", "..parser..");

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..parser..", "..analysis..", "..generator..", "..renderer..", "..config..");

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnAnalysis() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage("..analysis..", "..parser..");

        rule.check(classes);
    }

    @Test
    void core_shouldNotDependOnCli() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("com.tpanalyzer.core..")
            .should().dependOnClassesThat().resideInAPackage("com.tpanalyzer.cli..");

        rule.check(classes);
    }
}
