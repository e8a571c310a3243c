package com.kuruswap;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Keeps package boundaries: core components never reach up into the conversation or HTTP layers.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.kuruswap");
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.kuruswap.common..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.kuruswap.domain..", "com.kuruswap.config..", "com.kuruswap.ledger..", "com.kuruswap.chain..",
                        "com.kuruswap.market..", "com.kuruswap.quote..", "com.kuruswap.swap..", "com.kuruswap.wallet..",
                        "com.kuruswap.session..", "com.kuruswap.api..");
        rule.check(classes);
    }

    @Test
    void domain_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.kuruswap.domain..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.kuruswap.config..", "com.kuruswap.ledger..", "com.kuruswap.chain..", "com.kuruswap.market..",
                        "com.kuruswap.quote..", "com.kuruswap.swap..", "com.kuruswap.wallet..", "com.kuruswap.session..",
                        "com.kuruswap.api..");
        rule.check(classes);
    }

    @Test
    void chain_and_market_must_not_depend_on_ledger_or_upper_layers() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("com.kuruswap.chain..", "com.kuruswap.market..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.kuruswap.ledger..", "com.kuruswap.domain..", "com.kuruswap.quote..", "com.kuruswap.swap..",
                        "com.kuruswap.wallet..", "com.kuruswap.session..", "com.kuruswap.api..");
        rule.check(classes);
    }

    @Test
    void quote_must_not_touch_ledger() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.kuruswap.quote..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.kuruswap.ledger..", "com.kuruswap.domain..", "com.kuruswap.swap..", "com.kuruswap.session..",
                        "com.kuruswap.api..");
        rule.check(classes);
    }

    @Test
    void core_must_not_depend_on_session_or_api() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("com.kuruswap.ledger..", "com.kuruswap.swap..", "com.kuruswap.wallet..")
                .should().dependOnClassesThat().resideInAnyPackage("com.kuruswap.session..", "com.kuruswap.api..");
        rule.check(classes);
    }

    @Test
    void api_should_not_import_repository_classes() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.kuruswap.api..")
                .should().dependOnClassesThat().haveSimpleNameEndingWith("Repository");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.kuruswap.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
