package crocoforcing.physics.pipeline;

import crocoforcing.domain.boundary.BoundarySide;
import crocoforcing.domain.boundary.BoundarySlice;
import crocoforcing.domain.boundary.ColumnStatus;
import crocoforcing.domain.boundary.OpenBoundarySet;
import crocoforcing.domain.grid.ModelGrid;
import crocoforcing.domain.source.SourceField;
import crocoforcing.domain.source.VariableCatalog;
import crocoforcing.domain.source.VariableDescriptor;
import crocoforcing.domain.source.VariableKind;
import crocoforcing.domain.time.MasterTimeAxis;
import crocoforcing.domain.time.ModelClock;
import crocoforcing.io.BoundarySliceWriter;
import crocoforcing.physics.i.IGapFiller;
import crocoforcing.physics.i.IHorizontalRegridder;
import crocoforcing.physics.i.IRegridOperator;
import crocoforcing.physics.i.ITemporalResampler;
import crocoforcing.physics.i.IVerticalInterpolator;
import crocoforcing.physics.impl.BoundaryTimeStepTask;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Orquestador del forzamiento de contorno.
 * <p>
 * Para cada variable y cada contorno abierto:
 * 1. Resuelve el descriptor y la familia de puntos de la malla.
 * 2. Liga un interpolador horizontal a la línea de contorno.
 * 3. Procesa cada paso de tiempo nativo (regrid, relleno, remapeo vertical) en una {@link BoundaryTimeStepTask}.
 * 4. Remuestrea al eje maestro cuando la variable lo requiere.
 * 5. Aplica offset/factor sólo a las celdas calculadas.
 * <p>
 * Los fallos de una variable se registran y no detienen al resto.
 */
@Slf4j
public class BoundaryInterpolationPipeline implements AutoCloseable {

    private final ModelGrid grid;
    private final OpenBoundarySet boundaries;
    private final VariableCatalog catalog;
    private final ModelClock clock;
    private final MasterTimeAxis masterAxis;
    private final VariableKind masterVariable;
    private final IHorizontalRegridder regridder;
    private final IGapFiller gapFiller;
    private final IVerticalInterpolator verticalInterpolator;
    private final ITemporalResampler temporalResampler;

    // Pool opcional: null = ejecución secuencial en el hilo llamador
    private final ExecutorService threadPool;

    @Builder
    public BoundaryInterpolationPipeline(ModelGrid grid, OpenBoundarySet boundaries, VariableCatalog catalog,
                                         ModelClock clock, MasterTimeAxis masterAxis, VariableKind masterVariable,
                                         IHorizontalRegridder regridder, IGapFiller gapFiller,
                                         IVerticalInterpolator verticalInterpolator,
                                         ITemporalResampler temporalResampler, int workerCount) {
        this.grid = grid;
        this.boundaries = boundaries;
        this.catalog = catalog;
        this.clock = clock;
        this.masterAxis = masterAxis;
        this.masterVariable = masterVariable;
        this.regridder = regridder;
        this.gapFiller = gapFiller;
        this.verticalInterpolator = verticalInterpolator;
        this.temporalResampler = temporalResampler;
        this.threadPool = workerCount > 1 ? Executors.newFixedThreadPool(workerCount) : null;
        log.info("BoundaryInterpolationPipeline inicializado. (Contornos: {}, Hilos: {}, Pasos maestros: {})",
                boundaries.activeSides(), Math.max(workerCount, 1), masterAxis.size());
        log.debug("Componentes: regrid={}, relleno={}, vertical={}, tiempo={}",
                regridder.getName(), gapFiller.getName(), verticalInterpolator.getName(), temporalResampler.getName());
    }

    /**
     * Procesa una variable sobre todos los contornos abiertos.
     *
     * @return Un corte por contorno abierto, en orden S, E, N, W.
     * @throws IllegalArgumentException si la variable no está configurada o los datos son inconsistentes.
     * @throws IllegalStateException    si el procesamiento paralelo se interrumpe o falla.
     */
    public Map<BoundarySide, BoundarySlice> process(SourceField field) {
        return interpolate(field).slices();
    }

    /**
     * Procesa todas las variables; los cortes quedan en el informe.
     */
    public PipelineReport run(List<SourceField> fields) {
        return run(fields, null);
    }

    /**
     * Procesa todas las variables y entrega sus cortes al escritor. Un fallo (configuración,
     * datos o escritura) se registra para esa variable y se continúa con la siguiente.
     * <p>
     * La escritura de una variable empieza sólo cuando todos sus contornos se han calculado.
     * Si el escritor falla a mitad, la variable queda fallida sin cortes en el informe y el
     * fallo indica qué contornos llegaron a escribirse.
     */
    public PipelineReport run(List<SourceField> fields, BoundarySliceWriter writer) {
        long startTime = System.currentTimeMillis();
        PipelineReport report = new PipelineReport();
        for (SourceField field : fields) {
            VariableKind kind = field.getKind();
            VariableOutcome outcome;
            try {
                outcome = interpolate(field);
            } catch (IllegalArgumentException | IllegalStateException e) {
                log.error("Fallo procesando la variable {}. Se continúa con el resto.", kind.code(), e);
                report.addFailure(VariableFailure.of(kind, e));
                continue;
            }

            if (writer != null) {
                List<BoundarySide> written = new ArrayList<>();
                try {
                    for (Map.Entry<BoundarySide, BoundarySlice> entry : outcome.slices().entrySet()) {
                        writer.write(outcome.descriptor(), entry.getValue());
                        written.add(entry.getKey());
                    }
                } catch (IOException | IllegalArgumentException | IllegalStateException e) {
                    log.error("Fallo escribiendo la variable {}. Contornos ya escritos: {}", kind.code(), written, e);
                    report.addFailure(VariableFailure.of(kind, e, written));
                    continue;
                }
            }
            report.addSlices(kind, outcome.slices(), outcome.degenerateCount());
            log.info("{}: {} contornos procesados.", kind.code(), outcome.slices().size());
        }
        report.setElapsedMillis(System.currentTimeMillis() - startTime);
        log.info("Pipeline completado: {}", report);
        return report;
    }

    private VariableOutcome interpolate(SourceField field) {
        VariableKind kind = field.getKind();
        VariableDescriptor descriptor = catalog.descriptorOf(kind);
        double[] nativeDays = clock.toDays(field.getTimes());
        boolean resample = needsResampling(descriptor, nativeDays);

        Map<BoundarySide, BoundarySlice> out = new EnumMap<>(BoundarySide.class);
        int degenerate = 0;
        for (BoundarySide side : boundaries.activeSides()) {
            BoundaryLineContext line = BoundaryLineContext.of(grid, descriptor.gridPointType(), side);
            IRegridOperator regrid = regridder.bind(field.getLatitude(), field.getLongitude(),
                    line.latitude(), line.longitude());

            InterpolatedLine interpolated = interpolateLine(field, nativeDays, line, regrid);
            degenerate += interpolated.degenerateCount();
            BoundarySlice slice = interpolated.slice();
            if (resample) {
                slice = temporalResampler.resample(slice, masterAxis);
            }
            if (!descriptor.isIdentityTransform()) {
                slice = slice.mapComputed(descriptor::apply);
            }
            if (slice.isAllLand()) {
                log.debug("{}: contorno {} completamente en tierra.", kind.code(), side.suffix());
            }
            log.debug("Corte terminado: {}", slice);
            out.put(side, slice);
        }
        return new VariableOutcome(descriptor, out, degenerate);
    }

    private boolean needsResampling(VariableDescriptor descriptor, double[] nativeDays) {
        if (descriptor.kind() == masterVariable) return false;
        if (!descriptor.followsMasterClock()) return false;
        return !masterAxis.matches(nativeDays);
    }

    private InterpolatedLine interpolateLine(SourceField field, double[] nativeDays,
                                             BoundaryLineContext line, IRegridOperator regrid) {
        int steps = field.timeCount();
        List<BoundaryTimeStepTask> tasks = new ArrayList<>(steps);
        for (int t = 0; t < steps; t++) {
            tasks.add(new BoundaryTimeStepTask(field, t, line, regrid, gapFiller, verticalInterpolator));
        }
        List<BoundaryTimeStepTask> done = execute(tasks, field.getKind());

        BoundaryTimeStepTask first = done.get(0);
        BoundarySlice slice = new BoundarySlice(field.getKind(), line.side(), nativeDays,
                first.getBlock().length, line.length());
        ColumnStatus[] status = first.getStatus();
        for (int i = 0; i < status.length; i++) {
            slice.markStatus(i, status[i]);
        }
        int degenerate = 0;
        for (int t = 0; t < steps; t++) {
            BoundaryTimeStepTask task = done.get(t);
            slice.setBlock(t, task.getBlock());
            degenerate += task.degenerateCount();
        }
        if (degenerate > 0) {
            log.warn("{}: {} líneas o perfiles del contorno {} sin ninguna muestra válida.",
                    field.getKind().code(), degenerate, line.side().suffix());
        }
        return new InterpolatedLine(slice, degenerate);
    }

    private List<BoundaryTimeStepTask> execute(List<BoundaryTimeStepTask> tasks, VariableKind kind) {
        if (threadPool == null) {
            for (BoundaryTimeStepTask task : tasks) {
                task.call();
            }
            return tasks;
        }

        List<Future<BoundaryTimeStepTask>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Procesamiento de " + kind.code() + " interrumpido.", e);
        }

        List<BoundaryTimeStepTask> done = new ArrayList<>(tasks.size());
        for (int t = 0; t < futures.size(); t++) {
            try {
                done.add(futures.get(t).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Procesamiento de " + kind.code() + " interrumpido.", e);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IllegalStateException("Error en " + kind.code() + " paso " + t, e.getCause());
            }
        }
        return done;
    }

    @Override
    public void close() {
        if (threadPool != null && !threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        log.info("BoundaryInterpolationPipeline cerrado.");
    }

    private record InterpolatedLine(BoundarySlice slice, int degenerateCount) {
    }

    private record VariableOutcome(VariableDescriptor descriptor, Map<BoundarySide, BoundarySlice> slices,
                                   int degenerateCount) {
    }
}
