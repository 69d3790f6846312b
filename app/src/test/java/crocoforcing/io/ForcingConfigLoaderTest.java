package crocoforcing.io;

import crocoforcing.config.ForcingConfig;
import crocoforcing.config.VerticalCoordinateConfig;
import crocoforcing.config.VerticalTransform;
import crocoforcing.domain.boundary.BoundarySide;
import crocoforcing.domain.boundary.OpenBoundarySet;
import crocoforcing.domain.source.ValidRange;
import crocoforcing.domain.source.VariableKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ForcingConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final ForcingConfigLoader loader = new ForcingConfigLoader();

    @Test
    @DisplayName("Carga la configuración de ejemplo con fechas yyyyMMdd y valores por defecto")
    void loadResource_shouldParseFixture() throws IOException {
        // --- Act ---
        ForcingConfig config = loader.loadResource("forcing-config.json");

        // --- Assert ---
        assertThat(config.referenceDate()).isEqualTo(LocalDate.of(2024, 3, 10));
        assertThat(config.timeOrigin()).isEqualTo(LocalDate.of(2000, 1, 1));
        assertThat(config.masterVariable()).isEqualTo(VariableKind.TEMP);
        assertThat(OpenBoundarySet.fromFlags(config.openBoundaries()).activeSides())
                .containsExactly(BoundarySide.SOUTH, BoundarySide.NORTH, BoundarySide.WEST);

        VerticalCoordinateConfig vertical = config.verticalCoordinate();
        assertThat(vertical.transform()).isEqualTo(VerticalTransform.NEW_2008);
        assertThat(vertical.levels()).isEqualTo(32);
        assertThat(vertical.dryingThreshold()).isEqualTo(VerticalCoordinateConfig.DEFAULT_DRYING_THRESHOLD);

        assertThat(config.settingsOf(VariableKind.ZETA).offset()).isEqualTo(0.2);
        assertThat(config.settingsOf(VariableKind.ZETA).timeShiftHours()).isEqualTo(-1.5);
        assertThat(config.settingsOf(VariableKind.TEMP).factor()).isEqualTo(1.0);
        assertThat(config.settingsOf(VariableKind.DIC).extendToCycle()).isTrue();
        assertThat(config.isEnabled(VariableKind.DIC)).isTrue();
        assertThat(config.validRanges()).containsEntry(VariableKind.SALT, new ValidRange(5.0, 40.0));
        assertThat(config.workerCount()).isEqualTo(4);
        assertThat(config.landFillValue()).isEqualTo(ForcingConfig.DEFAULT_LAND_FILL_VALUE);
    }

    @Test
    @DisplayName("Una familia de transformación desconocida hace fallar la carga")
    void load_shouldRejectUnknownTransform() throws IOException {
        Path file = tempDir.resolve("bad.json");
        Files.writeString(file, """
                {
                  "timeOrigin": "20000101",
                  "masterVariable": "temp",
                  "verticalCoordinate": { "transform": "new2020", "levels": 10 }
                }
                """);

        assertThrows(IOException.class, () -> loader.load(file));
    }

    @Test
    @DisplayName("Archivo inexistente -> IOException")
    void load_missingFileShouldThrow() {
        assertThrows(IOException.class, () -> loader.load(tempDir.resolve("no-existe.json")));
    }

    @Test
    @DisplayName("Recurso inexistente -> IOException")
    void loadResource_missingResourceShouldThrow() {
        assertThrows(IOException.class, () -> loader.loadResource("no-existe.json"));
    }
}
