package crocoforcing.factory;

import crocoforcing.config.ForcingConfig;
import crocoforcing.config.ForcingConfigurationException;
import crocoforcing.domain.boundary.OpenBoundarySet;
import crocoforcing.domain.grid.ModelGrid;
import crocoforcing.domain.source.SourceField;
import crocoforcing.domain.source.VariableCatalog;
import crocoforcing.domain.time.ForcingCycle;
import crocoforcing.domain.time.MasterTimeAxis;
import crocoforcing.domain.time.ModelClock;
import crocoforcing.physics.impl.BilinearHorizontalRegridder;
import crocoforcing.physics.impl.LinearTemporalResampler;
import crocoforcing.physics.impl.NearestValidGapFiller;
import crocoforcing.physics.impl.SCoordinateVerticalInterpolator;
import crocoforcing.physics.impl.SourceFieldPreparer;
import crocoforcing.physics.pipeline.BoundaryInterpolationPipeline;
import crocoforcing.physics.solver.VerticalCoordinateEngine;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Ensambla el pipeline de contorno con los componentes por defecto a partir de la configuración.
 */
@Slf4j
public final class BoundaryPipelineFactory {

    private BoundaryPipelineFactory() {
        // Prohibido construir esta clase utilidad
    }

    /**
     * @param config      Configuración del ciclo.
     * @param grid        Malla del modelo.
     * @param masterField Campo ya preparado de la variable maestra: su eje temporal define el eje maestro.
     */
    public static BoundaryInterpolationPipeline create(ForcingConfig config, ModelGrid grid, SourceField masterField) {
        if (masterField.getKind() != config.masterVariable()) {
            throw new ForcingConfigurationException("master",
                    String.format("Se esperaba %s como variable maestra, recibido %s.",
                            config.masterVariable().code(), masterField.getKind().code()));
        }
        ModelClock clock = new ModelClock(config.timeOrigin());
        MasterTimeAxis masterAxis = MasterTimeAxis.fromTimestamps(clock, masterField.getTimes());
        VariableCatalog catalog = VariableCatalogFactory.fromConfig(config);
        VerticalCoordinateEngine engine = new VerticalCoordinateEngine(config.verticalCoordinate());
        NearestValidGapFiller gapFiller = NearestValidGapFiller.fromCatalog(catalog);

        return BoundaryInterpolationPipeline.builder()
                .grid(grid)
                .boundaries(OpenBoundarySet.fromFlags(config.openBoundaries()))
                .catalog(catalog)
                .clock(clock)
                .masterAxis(masterAxis)
                .masterVariable(config.masterVariable())
                .regridder(new BilinearHorizontalRegridder())
                .gapFiller(gapFiller)
                .verticalInterpolator(new SCoordinateVerticalInterpolator(engine, gapFiller))
                .temporalResampler(new LinearTemporalResampler())
                .workerCount(config.workerCount())
                .build();
    }

    /**
     * Descarta las variables no habilitadas y aplica extensión al ciclo y desfase horario al resto.
     */
    public static List<SourceField> prepareFields(ForcingConfig config, List<SourceField> fields) {
        SourceFieldPreparer preparer = new SourceFieldPreparer(
                ForcingCycle.of(config.referenceDate(), config.daysBack(), config.daysAhead()));
        List<SourceField> prepared = new ArrayList<>(fields.size());
        for (SourceField field : fields) {
            if (!config.isEnabled(field.getKind())) {
                log.info("{}: variable no habilitada, se omite.", field.getKind().code());
                continue;
            }
            prepared.add(preparer.prepare(field, config.settingsOf(field.getKind())));
        }
        return prepared;
    }
}
