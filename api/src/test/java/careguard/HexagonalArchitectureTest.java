package careguard;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import com.tngtech.archunit.lang.syntax.ArchRuleDefinition;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

@DisplayName("Hexagonal Architecture Rules")
class HexagonalArchitectureTest {

    private static JavaClasses importedClasses;

    @BeforeAll
    static void setUp() {
        importedClasses = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("careguard");
    }

    @Nested
    @DisplayName("Core Layer Rules")
    class CoreLayerRules {

        @Test
        @DisplayName("Core should not depend on adapter")
        void coreShouldNotDependOnAdapter() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("careguard.core..")
                    .should().dependOnClassesThat().resideInAPackage("careguard.adapter..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Core should not depend on the alert SPI")
        void coreShouldNotDependOnSpi() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("careguard.core..")
                    .should().dependOnClassesThat().resideInAPackage("careguard.spi..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Core should not depend on HTTP or Redis libraries")
        void coreShouldNotDependOnInfrastructure() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("careguard.core..")
                    .should().dependOnClassesThat().resideInAnyPackage(
                            "io.quarkus.redis..", "io.vertx..", "jakarta.ws.rs..", "io.quarkiverse.resteasy.problem..");

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("SPI Rules")
    class SpiRules {

        @Test
        @DisplayName("SPI should not depend on adapter or services")
        void spiShouldStayIndependent() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("careguard.spi..")
                    .should().dependOnClassesThat().resideInAnyPackage(
                            "careguard.adapter..", "careguard.core.service..", "careguard.core.port..");

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("Port Interface Rules")
    class PortInterfaceRules {

        @Test
        @DisplayName("Outbound ports should only contain interfaces")
        void outboundPortsShouldBeInterfaces() {
            ArchRule rule = ArchRuleDefinition.classes()
                    .that().resideInAPackage("careguard.core.port.out..")
                    .and().areTopLevelClasses()
                    .and().areNotAssignableTo(RuntimeException.class)
                    .should().beInterfaces();

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Inbound ports should only contain interfaces")
        void inboundPortsShouldBeInterfaces() {
            ArchRule rule = ArchRuleDefinition.classes()
                    .that().resideInAPackage("careguard.core.port.in..")
                    .and().areTopLevelClasses()
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
                    .that().resideInAPackage("careguard.core.model..")
                    .should().dependOnClassesThat().resideInAPackage("careguard.core.service..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Models should not depend on ports")
        void modelsShouldNotDependOnPorts() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("careguard.core.model..")
                    .should().dependOnClassesThat().resideInAPackage("careguard.core.port..");

            rule.check(importedClasses);
        }
    }
}
