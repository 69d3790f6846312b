package crocoforcing.physics.impl;

import crocoforcing.config.ForcingConfigurationException;
import crocoforcing.domain.boundary.ColumnStatus;
import crocoforcing.domain.boundary.GapFillResult;
import crocoforcing.domain.boundary.VerticalRemapResult;
import crocoforcing.domain.grid.VerticalPointType;
import crocoforcing.domain.source.VariableKind;
import crocoforcing.physics.i.IGapFiller;
import crocoforcing.physics.i.IVerticalInterpolator;
import crocoforcing.physics.solver.ClampedLinearInterpolator;
import crocoforcing.physics.solver.VerticalCoordinateEngine;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;

/**
 * Interpolación vertical desde los niveles de profundidad del producto a la coordenada s.
 * <p>
 * Para cada índice del contorno:
 * <ol>
 * <li>Tierra: la columna se marca {@link ColumnStatus#LAND} y no se calcula.</li>
 * <li>Se rellena el perfil de origen con el {@link IGapFiller}.</li>
 * <li>Se obtienen las profundidades rho del modelo con ζ = 0 y la batimetría local.</li>
 * <li>Se interpola linealmente en -z (el origen es positivo hacia abajo, el modelo hacia arriba),
 *     acotando a los valores extremos fuera del rango de profundidades del producto.</li>
 * </ol>
 */
@Slf4j
public class SCoordinateVerticalInterpolator implements IVerticalInterpolator {

    private final VerticalCoordinateEngine engine;
    private final IGapFiller gapFiller;

    public SCoordinateVerticalInterpolator(VerticalCoordinateEngine engine, IGapFiller gapFiller) {
        this.engine = engine;
        this.gapFiller = gapFiller;
    }

    @Override
    public String getName() {
        return "SCoordinateLinear[" + engine.family().label() + "]";
    }

    @Override
    public VerticalRemapResult remap(double[] bathymetry, double[] sourceDepth, double[][] data, int[] mask, VariableKind kind) {
        int n = bathymetry.length;
        int z = sourceDepth.length;
        if (mask.length != n) {
            throw new ForcingConfigurationException("mask",
                    String.format("Máscara (%d) y batimetría (%d) de distinta longitud.", mask.length, n));
        }
        if (data.length != z) {
            throw new ForcingConfigurationException("depth",
                    String.format("%d niveles de datos para %d profundidades de origen.", data.length, z));
        }
        for (int k = 1; k < z; k++) {
            if (!(sourceDepth[k] > sourceDepth[k - 1])) {
                throw new ForcingConfigurationException("depth",
                        "El eje de profundidad de origen debe ser estrictamente creciente (positivo hacia abajo).");
            }
        }

        int levels = engine.levelCount(VerticalPointType.RHO);
        double[][] out = new double[levels][n];
        for (double[] row : out) Arrays.fill(row, Double.NaN);
        ColumnStatus[] status = new ColumnStatus[n];
        Arrays.fill(status, ColumnStatus.PENDING);

        double[] profile = new double[z];
        int degenerate = 0;
        for (int i = 0; i < n; i++) {
            if (mask[i] == 0) {
                status[i] = ColumnStatus.LAND;
                continue;
            }
            for (int k = 0; k < z; k++) {
                if (data[k].length != n) {
                    throw new ForcingConfigurationException("data", "Longitud de contorno inconsistente en el nivel " + k);
                }
                profile[k] = data[k][i];
            }
            GapFillResult filled = gapFiller.fill(profile, kind);
            if (filled.degenerate()) degenerate++;

            double[] zRho = engine.columnDepths(VerticalPointType.RHO, 0.0, bathymetry[i]);
            double[] query = new double[levels];
            for (int k = 0; k < levels; k++) query[k] = -zRho[k];

            double[] column = ClampedLinearInterpolator.interpolate(sourceDepth, filled.values(), query);
            for (int k = 0; k < levels; k++) out[k][i] = column[k];
            status[i] = ColumnStatus.COMPUTED;
        }
        if (degenerate > 0) {
            log.warn("{}: {} perfiles verticales sin ninguna muestra válida se han interpolado sin rellenar.",
                    kind.code(), degenerate);
        }
        return new VerticalRemapResult(out, status, degenerate);
    }
}
