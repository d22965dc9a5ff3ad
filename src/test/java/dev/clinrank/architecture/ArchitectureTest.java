package dev.clinrank.architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(packages = "dev.clinrank", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

  // Stages and corpus access know nothing about file orchestration or the command line.
  @ArchTest
  static final ArchRule funnel_should_not_depend_on_orchestration =
      noClasses()
          .that()
          .resideInAnyPackage("..funnel..", "..corpus..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..pipeline..", "..cli..", "..eval..");

  @ArchTest
  static final ArchRule corpus_should_not_depend_on_funnel =
      noClasses()
          .that()
          .resideInAPackage("..corpus..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("..funnel..");

  @ArchTest
  static final ArchRule config_should_not_depend_on_adapters =
      noClasses()
          .that()
          .resideInAPackage("..config..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..pipeline..", "..cli..");

  @ArchTest
  static final ArchRule eval_should_not_depend_on_cli =
      noClasses()
          .that()
          .resideInAPackage("..eval..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("..cli..");

  @ArchTest
  static final ArchRule no_package_cycles =
      slices().matching("dev.clinrank.(*)..").should().beFreeOfCycles();
}
