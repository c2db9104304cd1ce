package shorted;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Hexagonal Architecture Rules")
class HexagonalArchitectureTest {

    private static JavaClasses importedClasses;

    @BeforeAll
    static void setUp() {
        importedClasses = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("shorted");
    }

    @Nested
    @DisplayName("Core Layer Rules")
    class CoreLayerRules {

        @Test
        @DisplayName("Core should not depend on adapters")
        void coreShouldNotDependOnAdapter() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("shorted.core..")
                    .should().dependOnClassesThat().resideInAPackage("shorted.adapter..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Core should not depend on system")
        void coreShouldNotDependOnSystem() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("shorted.core..")
                    .should().dependOnClassesThat().resideInAPackage("shorted.system..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Core should not depend on adapter configuration")
        void coreShouldNotDependOnAdapterConfig() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("shorted.core..")
                    .should().dependOnClassesThat().resideInAPackage("shorted.config..");

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("Adapter Layer Rules")
    class AdapterLayerRules {

        @Test
        @DisplayName("Adapters should not depend on system")
        void adapterShouldNotDependOnSystem() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("shorted.adapter..")
                    .should().dependOnClassesThat().resideInAPackage("shorted.system..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Store providers should only see the store port")
        void spiShouldOnlyDependOnPorts() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("shorted.spi..")
                    .should().dependOnClassesThat().resideInAnyPackage("shorted.adapter..", "shorted.core.service..");

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("Port Interface Rules")
    class PortInterfaceRules {

        @Test
        @DisplayName("Outbound ports should only contain interfaces")
        void outboundPortsShouldBeInterfaces() {
            ArchRule rule = classes()
                    .that().resideInAPackage("shorted.core.port.out..")
                    .should().beInterfaces();

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Inbound ports should only contain interfaces")
        void inboundPortsShouldBeInterfaces() {
            ArchRule rule = classes()
                    .that().resideInAPackage("shorted.core.port.in..")
                    .should().beInterfaces();

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("Model Rules")
    class ModelRules {

        @Test
        @DisplayName("Models should not depend on services")
        void modelsShouldNotDependOnServices() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("shorted.core.model..")
                    .should().dependOnClassesThat().resideInAPackage("shorted.core.service..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Models should not depend on ports")
        void modelsShouldNotDependOnPorts() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("shorted.core.model..")
                    .should().dependOnClassesThat().resideInAPackage("shorted.core.port..");

            rule.check(importedClasses);
        }
    }
}
