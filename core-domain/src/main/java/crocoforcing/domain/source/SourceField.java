package crocoforcing.domain.source;

import crocoforcing.config.ForcingConfigurationException;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.Arrays;

/**
 * Variable del producto oceánico de origen sobre su malla regular:
 * datos [tiempo][profundidad][latitud][longitud] y sus ejes.
 * <p>
 * Las variables 2-D llevan una dimensión de profundidad de tamaño 1 y no tienen eje de
 * profundidad. La profundidad es positiva hacia abajo.
 * Objeto de sólo lectura; las operaciones de preparación devuelven instancias nuevas.
 */
@Getter
public final class SourceField {

    private final VariableKind kind;
    private final LocalDateTime[] times;
    private final double[] depth;
    private final double[] latitude;
    private final double[] longitude;
    private final double[][][][] data;

    public SourceField(VariableKind kind, LocalDateTime[] times, double[] depth,
                       double[] latitude, double[] longitude, double[][][][] data) {
        if (kind == null) {
            throw new ForcingConfigurationException("variable", "La variable de origen es obligatoria.");
        }
        if (times == null || times.length == 0) {
            throw new ForcingConfigurationException("time", "El eje temporal de " + kind.code() + " está vacío.");
        }
        if (latitude == null || latitude.length == 0) {
            throw new ForcingConfigurationException("latitude", "Falta el eje de latitud de " + kind.code());
        }
        if (longitude == null || longitude.length == 0) {
            throw new ForcingConfigurationException("longitude", "Falta el eje de longitud de " + kind.code());
        }
        if (kind.isVolumetric() && (depth == null || depth.length == 0)) {
            throw new ForcingConfigurationException("depth", "La variable 3-D " + kind.code() + " no tiene eje de profundidad.");
        }
        int expectedDepth = kind.isVolumetric() ? depth.length : 1;
        if (data == null || data.length != times.length) {
            throw new ForcingConfigurationException("time",
                    String.format("%s: %d pasos de tiempo en el eje y %d en los datos.",
                            kind.code(), times.length, data == null ? 0 : data.length));
        }
        for (double[][][] step : data) {
            if (step.length != expectedDepth) {
                throw new ForcingConfigurationException("depth",
                        String.format("%s: se esperaban %d niveles, hay %d.", kind.code(), expectedDepth, step.length));
            }
            for (double[][] level : step) {
                if (level.length != latitude.length) {
                    throw new ForcingConfigurationException("latitude", kind.code() + ": dimensión de latitud inconsistente.");
                }
                for (double[] row : level) {
                    if (row.length != longitude.length) {
                        throw new ForcingConfigurationException("longitude", kind.code() + ": dimensión de longitud inconsistente.");
                    }
                }
            }
        }
        this.kind = kind;
        this.times = times.clone();
        this.depth = depth == null ? null : depth.clone();
        this.latitude = latitude.clone();
        this.longitude = longitude.clone();
        this.data = data;
    }

    /**
     * Atajo para variables 2-D: datos [tiempo][latitud][longitud].
     */
    public static SourceField surface(VariableKind kind, LocalDateTime[] times,
                                      double[] latitude, double[] longitude, double[][][] data) {
        double[][][][] wrapped = new double[data.length][][][];
        for (int t = 0; t < data.length; t++) {
            wrapped[t] = new double[][][]{data[t]};
        }
        return new SourceField(kind, times, null, latitude, longitude, wrapped);
    }

    public int timeCount() {
        return times.length;
    }

    public int depthCount() {
        return data[0].length;
    }

    /**
     * Campo horizontal [latitud][longitud] en el paso de tiempo t y nivel k.
     */
    public double[][] slice(int t, int k) {
        return data[t][k];
    }

    public LocalDateTime[] getTimes() {
        return times.clone();
    }

    public double[] getDepth() {
        return depth == null ? null : depth.clone();
    }

    /**
     * Mismos datos con las marcas de tiempo desplazadas {@code hours} horas.
     */
    public SourceField shiftedBy(double hours) {
        if (hours == 0.0) return this;
        long seconds = Math.round(hours * 3600.0);
        LocalDateTime[] shifted = Arrays.stream(times)
                .map(t -> t.plusSeconds(seconds))
                .toArray(LocalDateTime[]::new);
        return new SourceField(kind, shifted, depth, latitude, longitude, data);
    }

    /**
     * Mismos ejes espaciales con otro eje temporal y sus datos.
     */
    public SourceField withTimeAxis(LocalDateTime[] newTimes, double[][][][] newData) {
        return new SourceField(kind, newTimes, depth, latitude, longitude, newData);
    }
}
