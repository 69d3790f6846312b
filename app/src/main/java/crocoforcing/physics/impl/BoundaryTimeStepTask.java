package crocoforcing.physics.impl;

import crocoforcing.domain.boundary.ColumnStatus;
import crocoforcing.domain.boundary.GapFillResult;
import crocoforcing.domain.boundary.VerticalRemapResult;
import crocoforcing.domain.source.SourceField;
import crocoforcing.physics.i.IGapFiller;
import crocoforcing.physics.i.IRegridOperator;
import crocoforcing.physics.i.IVerticalInterpolator;
import crocoforcing.physics.pipeline.BoundaryLineContext;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.concurrent.Callable;

/**
 * Tarea que lleva un único paso de tiempo nativo de un campo de origen a una línea de contorno:
 * interpolación horizontal de cada nivel, relleno de huecos a lo largo de la línea y, en
 * variables 3-D, remapeo vertical a la coordenada s.
 * <p>
 * Sólo lee datos compartidos; el resultado queda en la propia tarea y lo fusiona el hilo llamador.
 */
@Getter
@RequiredArgsConstructor
public class BoundaryTimeStepTask implements Callable<BoundaryTimeStepTask> {

    // --- Entradas para la tarea ---
    private final SourceField field;
    private final int timeIndex;
    private final BoundaryLineContext line;
    private final IRegridOperator regrid;
    private final IGapFiller gapFiller;
    private final IVerticalInterpolator verticalInterpolator;

    // --- Resultados de la tarea ---
    private double[][] block;
    private ColumnStatus[] status;
    private int degenerateLines;
    private int degenerateProfiles;

    /**
     * Líneas horizontales y perfiles verticales de este paso que no tenían ninguna muestra válida.
     */
    public int degenerateCount() {
        return degenerateLines + degenerateProfiles;
    }

    @Override
    public BoundaryTimeStepTask call() {
        int depthCount = field.depthCount();
        double[][] lines = new double[depthCount][];
        for (int k = 0; k < depthCount; k++) {
            double[] regridded = regrid.apply(field.slice(timeIndex, k));
            GapFillResult filled = gapFiller.fill(regridded, field.getKind());
            if (filled.degenerate()) degenerateLines++;
            lines[k] = filled.values();
        }

        if (field.getKind().isVolumetric()) {
            VerticalRemapResult remapped = verticalInterpolator.remap(
                    line.bathymetry(), field.getDepth(), lines, line.mask(), field.getKind());
            this.block = remapped.values();
            this.status = remapped.status();
            this.degenerateProfiles = remapped.degenerateProfiles();
        } else {
            // Las variables 2-D no aplican la máscara: todos los índices se calculan
            this.block = lines;
            this.status = new ColumnStatus[line.length()];
            Arrays.fill(status, ColumnStatus.COMPUTED);
        }
        return this;
    }
}
