package crocoforcing.physics.impl;

import crocoforcing.config.ForcingConfigurationException;
import crocoforcing.domain.boundary.BoundarySlice;
import crocoforcing.domain.time.MasterTimeAxis;
import crocoforcing.domain.time.ModelClock;
import crocoforcing.physics.i.ITemporalResampler;
import crocoforcing.physics.solver.ClampedLinearInterpolator;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;

/**
 * Interpolación lineal en el tiempo desde el eje nativo de una variable al eje maestro,
 * independiente para cada índice espacial y nivel.
 * <p>
 * Fuera del rango nativo se repite la muestra nativa más cercana: los ejes nativo y
 * maestro no tienen por qué empezar ni terminar a la vez.
 */
@Slf4j
public class LinearTemporalResampler implements ITemporalResampler {

    @Override
    public String getName() {
        return "LinearTime";
    }

    @Override
    public BoundarySlice resample(BoundarySlice slice, MasterTimeAxis master) {
        double[] nativeDays = slice.time();
        checkIncreasing(nativeDays);
        double[] masterDays = master.days();
        BoundarySlice out = slice.withEmptyTimeAxis(masterDays);
        for (int i = 0; i < slice.getLength(); i++) {
            if (!slice.isComputed(i)) continue;
            for (int k = 0; k < slice.getLevelCount(); k++) {
                double[] series = ClampedLinearInterpolator.interpolate(nativeDays, slice.series(k, i), masterDays);
                for (int t = 0; t < masterDays.length; t++) {
                    out.set(t, k, i, series[t]);
                }
            }
        }
        log.debug("{}: remuestreo temporal {} -> {} pasos", slice, nativeDays.length, masterDays.length);
        return out;
    }

    /**
     * Variante sobre arrays para datos [tiempo nativo][nivel][espacio].
     */
    public double[][][] resample(double[] nativeDays, double[][][] data, double[] masterDays) {
        checkIncreasing(nativeDays);
        checkTimeDimension(nativeDays, data.length);
        int levels = data[0].length;
        int x = data[0][0].length;
        double[][][] out = new double[masterDays.length][levels][x];
        double[] series = new double[nativeDays.length];
        for (int i = 0; i < x; i++) {
            for (int k = 0; k < levels; k++) {
                for (int t = 0; t < nativeDays.length; t++) series[t] = data[t][k][i];
                double[] r = ClampedLinearInterpolator.interpolate(nativeDays, series, masterDays);
                for (int t = 0; t < masterDays.length; t++) out[t][k][i] = r[t];
            }
        }
        return out;
    }

    /**
     * Convierte primero las marcas de tiempo nativas a días desde el origen del modelo.
     */
    public double[][][] resample(LocalDateTime[] nativeTimes, ModelClock clock, double[][][] data, double[] masterDays) {
        return resample(clock.toDays(nativeTimes), data, masterDays);
    }

    private static void checkIncreasing(double[] days) {
        for (int t = 1; t < days.length; t++) {
            if (!(days[t] > days[t - 1])) {
                throw new ForcingConfigurationException("time",
                        String.format("Eje temporal nativo no estrictamente creciente en %d (%s <= %s).", t, days[t], days[t - 1]));
            }
        }
    }

    private static void checkTimeDimension(double[] days, int steps) {
        if (days.length != steps) {
            throw new ForcingConfigurationException("time",
                    String.format("%d marcas de tiempo para %d pasos de datos.", days.length, steps));
        }
    }
}
