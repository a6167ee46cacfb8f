package io.routecontract.core;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/**
 * Architecture guardrails for the core module.
 *
 * <p>Contracts are attached to interceptors as data, never discovered
 * reflectively, and the core stays independent of any HTTP server.
 */
@AnalyzeClasses(
        packages = "io.routecontract.core",
        importOptions = {ImportOption.DoNotIncludeTests.class})
class CoreArchitectureTest {

    @ArchTest
    static final ArchRule noReflectionUsage = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("java.lang.reflect..")
            .because("contract annotations are explicit values, not reflective metadata");

    @ArchTest
    static final ArchRule noServerDependencies = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.javalin..", "jakarta.servlet..", "org.eclipse.jetty..")
            .because("the core is transport-neutral; server bindings live in adapter modules");

    @ArchTest
    static final ArchRule schemaDoesNotDependOnRouting = noClasses()
            .that()
            .resideInAPackage("io.routecontract.core.schema..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.routecontract.core.route..", "io.routecontract.core.interceptor..")
            .because("schemas are plain data shared by every layer");

    @ArchTest
    static final ArchRule interceptorsAreFinal = classes()
            .that()
            .resideInAPackage("io.routecontract.core.interceptor..")
            .and()
            .haveSimpleNameEndingWith("Interceptor")
            .and()
            .areNotInterfaces()
            .should()
            .haveOnlyFinalFields()
            .because("interceptors are shared across concurrent exchanges");
}
