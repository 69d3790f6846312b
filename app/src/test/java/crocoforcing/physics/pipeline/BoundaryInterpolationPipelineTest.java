package crocoforcing.physics.pipeline;

import crocoforcing.config.ForcingConfig;
import crocoforcing.config.VariableSettings;
import crocoforcing.domain.boundary.BoundarySide;
import crocoforcing.domain.boundary.BoundarySlice;
import crocoforcing.domain.boundary.ColumnStatus;
import crocoforcing.domain.boundary.GapFillResult;
import crocoforcing.domain.boundary.OpenBoundarySet;
import crocoforcing.domain.source.SourceField;
import crocoforcing.domain.source.VariableKind;
import crocoforcing.domain.time.MasterTimeAxis;
import crocoforcing.domain.time.ModelClock;
import crocoforcing.factory.BoundaryPipelineFactory;
import crocoforcing.factory.VariableCatalogFactory;
import crocoforcing.io.BoundarySliceWriter;
import crocoforcing.physics.i.IGapFiller;
import crocoforcing.physics.i.IHorizontalRegridder;
import crocoforcing.physics.i.IRegridOperator;
import crocoforcing.physics.i.ITemporalResampler;
import crocoforcing.physics.i.IVerticalInterpolator;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.OutOfRangeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@Slf4j
class BoundaryInterpolationPipelineTest {

    private static final LocalDateTime[] MASTER_TIMES = {
            LocalDateTime.of(2024, 3, 9, 12, 0),
            LocalDateTime.of(2024, 3, 10, 12, 0)
    };

    private static final LocalDateTime[] ZETA_TIMES = {
            LocalDateTime.of(2024, 3, 9, 0, 0),
            LocalDateTime.of(2024, 3, 9, 6, 0),
            LocalDateTime.of(2024, 3, 9, 12, 0),
            LocalDateTime.of(2024, 3, 9, 18, 0),
            LocalDateTime.of(2024, 3, 10, 0, 0)
    };

    private static ForcingConfig configWithZetaOffset() {
        return ForcingConfig.getTestingConfig()
                .toBuilder()
                .variable(VariableKind.ZETA, VariableSettings.builder().enabled(true).offset(0.1).build())
                .build();
    }

    @Test
    @DisplayName("Orquestación: bind -> relleno -> remuestreo, sin remapeo vertical en 2-D")
    void process_shouldCallComponentsInOrder() {
        // ARRANGE
        ForcingConfig config = ForcingConfig.getTestingConfig();
        ModelClock clock = new ModelClock(config.timeOrigin());
        IHorizontalRegridder regridder = mock(IHorizontalRegridder.class);
        IGapFiller gapFiller = mock(IGapFiller.class);
        IVerticalInterpolator vertical = mock(IVerticalInterpolator.class);
        ITemporalResampler resampler = mock(ITemporalResampler.class);

        IRegridOperator operator = field -> new double[]{0.1, 0.2, 0.3, 0.4};
        when(regridder.bind(any(), any(), any(), any())).thenReturn(operator);
        when(gapFiller.fill(any(), eq(VariableKind.ZETA)))
                .thenAnswer(inv -> new GapFillResult(((double[]) inv.getArgument(0)).clone(), 0, false));
        when(resampler.resample(any(), any())).thenAnswer(inv -> inv.getArgument(0));

        BoundaryInterpolationPipeline pipeline = BoundaryInterpolationPipeline.builder()
                .grid(BoundaryFixtures.grid(-1))
                .boundaries(OpenBoundarySet.fromFlags("1000"))
                .catalog(VariableCatalogFactory.fromConfig(config))
                .clock(clock)
                .masterAxis(MasterTimeAxis.fromTimestamps(clock, MASTER_TIMES))
                .masterVariable(VariableKind.TEMP)
                .regridder(regridder)
                .gapFiller(gapFiller)
                .verticalInterpolator(vertical)
                .temporalResampler(resampler)
                .workerCount(1)
                .build();

        SourceField zeta = BoundaryFixtures.surface(VariableKind.ZETA, ZETA_TIMES, new double[]{0, 0, 0, 0, 0});

        // ACT
        Map<BoundarySide, BoundarySlice> slices;
        try (pipeline) {
            slices = pipeline.process(zeta);
        }

        // ASSERT
        assertEquals(List.of(BoundarySide.SOUTH), List.copyOf(slices.keySet()));
        InOrder inOrder = inOrder(regridder, gapFiller, resampler);
        inOrder.verify(regridder).bind(any(), any(), any(), any());
        inOrder.verify(gapFiller, times(ZETA_TIMES.length)).fill(any(), eq(VariableKind.ZETA));
        inOrder.verify(resampler).resample(any(), any());
        verifyNoInteractions(vertical);
    }

    @Test
    @DisplayName("Extremo a extremo: 3-D remapeado con tierra, 2-D remuestreado con offset")
    void run_endToEndWithRealComponents() {
        // ARRANGE
        ForcingConfig config = configWithZetaOffset();
        SourceField temp = BoundaryFixtures.layered(VariableKind.TEMP, MASTER_TIMES);
        SourceField zeta = BoundaryFixtures.surface(VariableKind.ZETA, ZETA_TIMES, new double[]{0.0, 0.1, 0.2, 0.3, 0.4});

        // ACT
        PipelineReport report;
        try (BoundaryInterpolationPipeline pipeline = BoundaryPipelineFactory.create(config, BoundaryFixtures.grid(1), temp)) {
            report = pipeline.run(List.of(temp, zeta));
        }

        // ASSERT
        log.info("Informe: {}", report);
        assertFalse(report.hasFailures());

        BoundarySlice tempSouth = report.slicesOf(VariableKind.TEMP).get(BoundarySide.SOUTH);
        assertEquals(3, tempSouth.getLevelCount());
        assertEquals(2, tempSouth.timeCount());
        assertEquals(ColumnStatus.LAND, tempSouth.status(1));
        assertTrue(Double.isNaN(tempSouth.get(0, 0, 1)));
        for (int i : new int[]{0, 2, 3}) {
            assertEquals(ColumnStatus.COMPUTED, tempSouth.status(i));
            for (int k = 0; k < 3; k++) {
                double v = tempSouth.get(1, k, i);
                assertTrue(v >= 10.0 && v <= 14.0, "Temperatura fuera de [10, 14]: " + v);
            }
            assertTrue(tempSouth.get(0, 0, i) >= tempSouth.get(0, 2, i));
        }
        assertEquals(4, report.slicesOf(VariableKind.TEMP).size());
        assertEquals(3, report.slicesOf(VariableKind.TEMP).get(BoundarySide.EAST).getLength());

        // 2-D: la máscara no se aplica, eje maestro y offset 0.1
        BoundarySlice zetaSouth = report.slicesOf(VariableKind.ZETA).get(BoundarySide.SOUTH);
        assertEquals(1, zetaSouth.getLevelCount());
        assertEquals(ColumnStatus.COMPUTED, zetaSouth.status(1));
        assertArrayEquals(MasterTimeAxis.fromTimestamps(new ModelClock(config.timeOrigin()), MASTER_TIMES).days(),
                zetaSouth.time(), 1e-12);
        assertEquals(0.3, zetaSouth.get(0, 0, 1), 1e-9);
        assertEquals(0.5, zetaSouth.get(1, 0, 1), 1e-9);
    }

    @Test
    @DisplayName("El resultado con pool de hilos coincide con el secuencial")
    void run_parallelShouldMatchSequential() {
        ForcingConfig config = configWithZetaOffset();
        SourceField temp = BoundaryFixtures.layered(VariableKind.TEMP, MASTER_TIMES);

        BoundarySlice sequential;
        try (BoundaryInterpolationPipeline pipeline = BoundaryPipelineFactory.create(config, BoundaryFixtures.grid(2), temp)) {
            sequential = pipeline.process(temp).get(BoundarySide.NORTH);
        }
        BoundarySlice parallel;
        try (BoundaryInterpolationPipeline pipeline = BoundaryPipelineFactory.create(config.withWorkerCount(3), BoundaryFixtures.grid(2), temp)) {
            parallel = pipeline.process(temp).get(BoundarySide.NORTH);
        }

        for (int t = 0; t < sequential.timeCount(); t++)
            for (int k = 0; k < sequential.getLevelCount(); k++)
                for (int i = 0; i < sequential.getLength(); i++)
                    assertEquals(sequential.get(t, k, i), parallel.get(t, k, i), 0.0);
    }

    @Test
    @DisplayName("Un fallo de una variable se registra y no detiene a las demás")
    void run_shouldIsolateFailuresPerVariable() {
        // ARRANGE
        ForcingConfig config = ForcingConfig.getTestingConfig();
        SourceField temp = BoundaryFixtures.layered(VariableKind.TEMP, MASTER_TIMES);
        // U no está habilitada en la configuración de pruebas
        SourceField u = BoundaryFixtures.layered(VariableKind.U, MASTER_TIMES);
        // SALT con una malla de origen que no cubre el dominio
        double[][][][] saltData = new double[2][3][2][2];
        SourceField salt = new SourceField(VariableKind.SALT, MASTER_TIMES, BoundaryFixtures.SOURCE_DEPTH,
                new double[]{10, 11}, new double[]{10, 11}, saltData);

        // ACT
        PipelineReport report;
        try (BoundaryInterpolationPipeline pipeline = BoundaryPipelineFactory.create(config, BoundaryFixtures.grid(-1), temp)) {
            report = pipeline.run(List.of(u, temp, salt));
        }

        // ASSERT
        assertTrue(report.isSuccessful(VariableKind.TEMP));
        assertFalse(report.isSuccessful(VariableKind.U));
        assertFalse(report.isSuccessful(VariableKind.SALT));
        assertTrue(report.slicesOf(VariableKind.SALT).isEmpty());
        assertEquals(2, report.failures().size());
        assertEquals(VariableKind.U, report.failures().get(0).kind());
        assertInstanceOf(OutOfRangeException.class, report.failures().get(1).cause());
    }

    @Test
    @DisplayName("Origen sin muestras válidas: la variable se procesa y el informe cuenta líneas y perfiles degenerados")
    void run_shouldReportDegenerateLinesAndProfiles() {
        // ARRANGE
        ForcingConfig config = ForcingConfig.getTestingConfig().withOpenBoundaries("1000");
        SourceField temp = BoundaryFixtures.layered(VariableKind.TEMP, MASTER_TIMES);
        double[][][][] missing = new double[MASTER_TIMES.length][BoundaryFixtures.SOURCE_DEPTH.length]
                [BoundaryFixtures.SOURCE_LAT.length][BoundaryFixtures.SOURCE_LON.length];
        for (double[][][] step : missing)
            for (double[][] level : step)
                for (double[] row : level)
                    Arrays.fill(row, Double.NaN);
        SourceField salt = new SourceField(VariableKind.SALT, MASTER_TIMES, BoundaryFixtures.SOURCE_DEPTH,
                BoundaryFixtures.SOURCE_LAT, BoundaryFixtures.SOURCE_LON, missing);

        // ACT
        PipelineReport report;
        try (BoundaryInterpolationPipeline pipeline = BoundaryPipelineFactory.create(config, BoundaryFixtures.grid(1), temp)) {
            report = pipeline.run(List.of(temp, salt));
        }

        // ASSERT
        log.info("Informe: {}", report);
        assertFalse(report.hasFailures());
        assertEquals(List.of(VariableKind.TEMP, VariableKind.SALT), report.processedKinds());
        assertEquals(0, report.degenerateCount(VariableKind.TEMP));
        // 2 pasos x (3 niveles horizontales + 3 columnas de agua en el contorno sur)
        assertEquals(12, report.degenerateCount(VariableKind.SALT));
        BoundarySlice saltSouth = report.slicesOf(VariableKind.SALT).get(BoundarySide.SOUTH);
        assertEquals(ColumnStatus.COMPUTED, saltSouth.status(0));
        assertEquals(ColumnStatus.LAND, saltSouth.status(1));
        assertTrue(Double.isNaN(saltSouth.get(0, 0, 0)));
        assertEquals(0, report.degenerateCount(VariableKind.ZETA));
    }

    @Test
    @DisplayName("Cada corte se entrega al escritor; un error de escritura aísla la variable")
    void run_shouldDeliverSlicesToWriter() throws IOException {
        ForcingConfig config = ForcingConfig.getTestingConfig().withOpenBoundaries("0101");
        SourceField temp = BoundaryFixtures.layered(VariableKind.TEMP, MASTER_TIMES);
        SourceField zeta = BoundaryFixtures.surface(VariableKind.ZETA, MASTER_TIMES, new double[]{0.1, 0.2});
        BoundarySliceWriter writer = mock(BoundarySliceWriter.class);
        // El contorno este de ZETA se escribe; el oeste falla
        doThrow(new IOException("disco lleno")).when(writer)
                .write(argThat(d -> d.kind() == VariableKind.ZETA), argThat(slice -> slice.getSide() == BoundarySide.WEST));

        PipelineReport report;
        try (BoundaryInterpolationPipeline pipeline = BoundaryPipelineFactory.create(config, BoundaryFixtures.grid(-1), temp)) {
            report = pipeline.run(List.of(temp, zeta), writer);
        }

        verify(writer, times(2)).write(argThat(d -> d.kind() == VariableKind.TEMP), any());
        verify(writer, times(2)).write(argThat(d -> d.kind() == VariableKind.ZETA), any());
        assertTrue(report.isSuccessful(VariableKind.TEMP));
        assertFalse(report.isSuccessful(VariableKind.ZETA));
        assertTrue(report.slicesOf(VariableKind.ZETA).isEmpty());

        VariableFailure failure = report.failures().get(0);
        assertInstanceOf(IOException.class, failure.cause());
        assertTrue(failure.isPartiallyWritten());
        assertEquals(List.of(BoundarySide.EAST), failure.writtenSides());
    }

    @Test
    @DisplayName("Un fallo de cálculo no llega al escritor")
    void run_shouldNotWriteVariableThatFailedToInterpolate() throws IOException {
        ForcingConfig config = ForcingConfig.getTestingConfig();
        SourceField temp = BoundaryFixtures.layered(VariableKind.TEMP, MASTER_TIMES);
        SourceField salt = new SourceField(VariableKind.SALT, MASTER_TIMES, BoundaryFixtures.SOURCE_DEPTH,
                new double[]{10, 11}, new double[]{10, 11}, new double[2][3][2][2]);
        BoundarySliceWriter writer = mock(BoundarySliceWriter.class);

        PipelineReport report;
        try (BoundaryInterpolationPipeline pipeline = BoundaryPipelineFactory.create(config, BoundaryFixtures.grid(-1), temp)) {
            report = pipeline.run(List.of(salt), writer);
        }

        verifyNoInteractions(writer);
        assertFalse(report.failures().get(0).isPartiallyWritten());
    }
}
