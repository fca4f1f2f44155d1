package dev.linkscout.architecture;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

@AnalyzeClasses(packages = "dev.linkscout", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

    // The crawl engine knows nothing about how results are rendered or exported
    @ArchTest
    static final ArchRule crawl_should_not_depend_on_outputs =
        noClasses().that().resideInAPackage("..crawl..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..export..", "..report..", "..cli.."
            );

    // Output packages never reach back into the command-line runner
    @ArchTest
    static final ArchRule outputs_should_not_depend_on_cli =
        noClasses().that().resideInAnyPackage("..export..", "..report..")
            .should().dependOnClassesThat().resideInAPackage("..cli..");

    @ArchTest
    static final ArchRule export_and_report_are_independent =
        noClasses().that().resideInAPackage("..export..")
            .should().dependOnClassesThat().resideInAPackage("..report..");

    // Config package should not depend on feature packages
    @ArchTest
    static final ArchRule config_should_not_depend_on_features =
        noClasses().that().resideInAPackage("..config..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..crawl..", "..export..", "..report..", "..cli.."
            );

    // Workers report through CrawlState, never through System.out
    @ArchTest
    static final ArchRule only_reporting_prints_to_console =
        noClasses().that().resideOutsideOfPackage("..report..")
            .should().accessField(System.class, "out");

    // No cyclic dependencies between top-level packages
    @ArchTest
    static final ArchRule no_package_cycles =
        slices().matching("dev.linkscout.(*)..").should().beFreeOfCycles();
}
