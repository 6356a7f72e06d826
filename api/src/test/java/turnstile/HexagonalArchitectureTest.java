package turnstile;

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
                .importPackages("turnstile");
    }

    @Nested
    @DisplayName("Core Layer Rules")
    class CoreLayerRules {

        @Test
        @DisplayName("Core should not depend on adapter")
        void coreShouldNotDependOnAdapter() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("turnstile.core..")
                    .should().dependOnClassesThat().resideInAPackage("turnstile.adapter..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Core should not depend on the SPI")
        void coreShouldNotDependOnSpi() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("turnstile.core..")
                    .should().dependOnClassesThat().resideInAPackage("turnstile.spi..");

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("SPI Rules")
    class SpiRules {

        @Test
        @DisplayName("SPI should not depend on adapter")
        void spiShouldNotDependOnAdapter() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("turnstile.spi..")
                    .should().dependOnClassesThat().resideInAPackage("turnstile.adapter..");

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
                    .that().resideInAPackage("turnstile.core.port.out..")
                    .should().beInterfaces();

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Inbound ports should only contain interfaces")
        void inboundPortsShouldBeInterfaces() {
            ArchRule rule = classes()
                    .that().resideInAPackage("turnstile.core.port.in..")
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
                    .that().resideInAPackage("turnstile.core.model..")
                    .should().dependOnClassesThat().resideInAPackage("turnstile.core.service..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Models should not depend on ports")
        void modelsShouldNotDependOnPorts() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("turnstile.core.model..")
                    .should().dependOnClassesThat().resideInAPackage("turnstile.core.port..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Models should not depend on config mappings")
        void modelsShouldNotDependOnConfig() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("turnstile.core.model..")
                    .should().dependOnClassesThat().resideInAPackage("turnstile.core.config..");

            rule.check(importedClasses);
        }
    }
}
