package crocoforcing.factory;

import crocoforcing.config.ForcingConfig;
import crocoforcing.config.ForcingConfigurationException;
import crocoforcing.config.VariableSettings;
import crocoforcing.domain.grid.GridPointType;
import crocoforcing.domain.source.ValidRange;
import crocoforcing.domain.source.VariableCatalog;
import crocoforcing.domain.source.VariableDescriptor;
import crocoforcing.domain.source.VariableKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VariableCatalogFactoryTest {

    @Test
    @DisplayName("El catálogo sólo contiene variables habilitadas, con sus offsets y rangos")
    void fromConfig_shouldResolveEnabledVariables() {
        // ARRANGE
        ForcingConfig config = ForcingConfig.getTestingConfig()
                .toBuilder()
                .variable(VariableKind.U, VariableSettings.enabledDefault())
                .variable(VariableKind.DIC, VariableSettings.builder().enabled(true).factor(1e-3).build())
                .validRange(VariableKind.SALT, new ValidRange(2, 39))
                .build();

        // ACT
        VariableCatalog catalog = VariableCatalogFactory.fromConfig(config);

        // ASSERT
        assertTrue(catalog.contains(VariableKind.TEMP));
        assertTrue(catalog.contains(VariableKind.U));
        // biogeoquímica desactivada
        assertFalse(catalog.contains(VariableKind.DIC));
        assertEquals(new ValidRange(2, 39), catalog.descriptorOf(VariableKind.SALT).validRange());
        assertEquals(GridPointType.U, catalog.descriptorOf(VariableKind.U).gridPointType());
        assertThrows(ForcingConfigurationException.class, () -> catalog.descriptorOf(VariableKind.V));
    }

    @Test
    @DisplayName("Las biogeoquímicas conservan su propio reloj y aplican su factor")
    void fromConfig_biogeochemicalShouldKeepOwnClock() {
        ForcingConfig config = ForcingConfig.getTestingConfig()
                .withBiogeochemistry(true)
                .toBuilder()
                .variable(VariableKind.DIC, VariableSettings.builder().enabled(true).factor(1e-3).build())
                .build();

        VariableDescriptor dic = VariableCatalogFactory.fromConfig(config).descriptorOf(VariableKind.DIC);

        assertFalse(dic.followsMasterClock());
        assertEquals(2.0e-3, dic.apply(2.0), 1e-15);
        assertFalse(dic.isIdentityTransform());
    }
}
