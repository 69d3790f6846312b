package crocoforcing.domain.time;

import crocoforcing.config.ForcingConfigurationException;

import java.time.LocalDateTime;

/**
 * Eje temporal maestro del fichero de contorno, en días desde el origen del modelo.
 * Estrictamente creciente.
 */
public record MasterTimeAxis(double[] days) {

    private static final double TOLERANCE = 1e-9;

    public MasterTimeAxis {
        if (days == null || days.length == 0) {
            throw new ForcingConfigurationException("time", "El eje temporal maestro está vacío.");
        }
        for (int i = 1; i < days.length; i++) {
            if (!(days[i] > days[i - 1])) {
                throw new ForcingConfigurationException("time",
                        String.format("El eje temporal maestro no es estrictamente creciente en %d (%s <= %s).",
                                i, days[i], days[i - 1]));
            }
        }
        days = days.clone();
    }

    /**
     * Construye el eje maestro a partir de las marcas de tiempo de la variable maestra.
     */
    public static MasterTimeAxis fromTimestamps(ModelClock clock, LocalDateTime[] timestamps) {
        return new MasterTimeAxis(clock.toDays(timestamps));
    }

    @Override
    public double[] days() {
        return days.clone();
    }

    public int size() {
        return days.length;
    }

    /** Primer día del eje (tstart). */
    public double start() {
        return days[0];
    }

    /** Último día del eje (tend). */
    public double end() {
        return days[days.length - 1];
    }

    /**
     * Indica si otro eje coincide con éste punto a punto.
     */
    public boolean matches(double[] other) {
        if (other == null || other.length != days.length) return false;
        for (int i = 0; i < days.length; i++) {
            if (Math.abs(other[i] - days[i]) > TOLERANCE) return false;
        }
        return true;
    }
}
