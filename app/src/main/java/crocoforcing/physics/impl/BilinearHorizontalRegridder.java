package crocoforcing.physics.impl;

import crocoforcing.config.ForcingConfigurationException;
import crocoforcing.physics.i.IHorizontalRegridder;
import crocoforcing.physics.i.IRegridOperator;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.OutOfRangeException;
import org.apache.commons.math3.util.MathArrays;

/**
 * Interpolación bilineal desde una malla regular (latitud, longitud) a puntos arbitrarios.
 * <p>
 * La búsqueda de celda y los pesos se calculan una sola vez en {@link #bind}; el operador
 * resultante se aplica a cada corte (tiempo, profundidad) del producto.
 * <p>
 * Los ejes pueden ser crecientes o decrecientes. Un eje de longitud 1 sólo admite destinos
 * sobre esa misma coordenada. Los destinos fuera de la extensión de origen se rechazan con
 * {@link OutOfRangeException}: no hay extrapolación.
 */
@Slf4j
public class BilinearHorizontalRegridder implements IHorizontalRegridder {

    private static final double EDGE_TOLERANCE = 1e-9;

    @Override
    public String getName() {
        return "Bilinear";
    }

    @Override
    public String getDescription() {
        return "Interpolación bilineal sobre malla regular, sin extrapolación";
    }

    @Override
    public IRegridOperator bind(double[] sourceLatitude, double[] sourceLongitude,
                                double[] targetLatitude, double[] targetLongitude) {
        if (targetLatitude.length != targetLongitude.length) {
            throw new ForcingConfigurationException("target",
                    String.format("Latitudes (%d) y longitudes (%d) destino de distinta longitud.",
                            targetLatitude.length, targetLongitude.length));
        }
        AxisLocator latAxis = new AxisLocator("latitude", sourceLatitude);
        AxisLocator lonAxis = new AxisLocator("longitude", sourceLongitude);

        int n = targetLatitude.length;
        int[] lat0 = new int[n];
        int[] lat1 = new int[n];
        double[] latWeight = new double[n];
        int[] lon0 = new int[n];
        int[] lon1 = new int[n];
        double[] lonWeight = new double[n];
        for (int p = 0; p < n; p++) {
            latAxis.locate(targetLatitude[p], p, lat0, lat1, latWeight);
            lonAxis.locate(targetLongitude[p], p, lon0, lon1, lonWeight);
        }
        log.debug("Interpolante bilineal ligado: malla {}x{} -> {} puntos", sourceLatitude.length, sourceLongitude.length, n);
        return new BilinearStencil(sourceLatitude.length, sourceLongitude.length,
                lat0, lat1, latWeight, lon0, lon1, lonWeight);
    }

    /**
     * Búsqueda de celda en un eje regular. Un eje decreciente se trata como el
     * creciente de sus valores cambiados de signo.
     */
    private static final class AxisLocator {
        private final String name;
        private final double[] axis;
        private final double sign;

        AxisLocator(String name, double[] values) {
            if (values == null || values.length == 0) {
                throw new ForcingConfigurationException(name, "Eje de origen vacío.");
            }
            this.name = name;
            boolean descending = values.length > 1 && values[values.length - 1] < values[0];
            this.sign = descending ? -1.0 : 1.0;
            this.axis = new double[values.length];
            for (int i = 0; i < values.length; i++) axis[i] = sign * values[i];
            if (axis.length > 1) {
                MathArrays.checkOrder(axis);
            }
        }

        void locate(double value, int p, int[] lower, int[] upper, double[] weight) {
            double v = sign * value;
            double first = axis[0];
            double last = axis[axis.length - 1];
            if (Double.isNaN(v) || v < first - EDGE_TOLERANCE || v > last + EDGE_TOLERANCE) {
                throw new OutOfRangeException(value, Math.min(sign * first, sign * last), Math.max(sign * first, sign * last));
            }
            if (axis.length == 1) {
                lower[p] = 0;
                upper[p] = 0;
                weight[p] = 0.0;
                return;
            }
            int i0 = lowerIndex(v);
            int i1 = i0 + 1;
            double t = (v - axis[i0]) / (axis[i1] - axis[i0]);
            lower[p] = i0;
            upper[p] = i1;
            weight[p] = Math.max(0.0, Math.min(1.0, t));
        }

        // Mayor índice i en [0, n-2] con axis[i] <= v
        private int lowerIndex(double v) {
            int lo = 0;
            int hi = axis.length - 1;
            if (v <= axis[0]) return 0;
            if (v >= axis[hi]) return hi - 1;
            while (lo + 1 < hi) {
                int mid = lo + (hi - lo) / 2;
                if (axis[mid] <= v) lo = mid;
                else hi = mid;
            }
            return lo;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * Operador precalculado: índices de las cuatro esquinas y pesos de cada punto destino.
     */
    private static final class BilinearStencil implements IRegridOperator {
        private final int latSize;
        private final int lonSize;
        private final int[] lat0;
        private final int[] lat1;
        private final double[] latWeight;
        private final int[] lon0;
        private final int[] lon1;
        private final double[] lonWeight;

        BilinearStencil(int latSize, int lonSize,
                        int[] lat0, int[] lat1, double[] latWeight,
                        int[] lon0, int[] lon1, double[] lonWeight) {
            this.latSize = latSize;
            this.lonSize = lonSize;
            this.lat0 = lat0;
            this.lat1 = lat1;
            this.latWeight = latWeight;
            this.lon0 = lon0;
            this.lon1 = lon1;
            this.lonWeight = lonWeight;
        }

        @Override
        public double[] apply(double[][] field) {
            if (field.length != latSize || field[0].length != lonSize) {
                throw new ForcingConfigurationException("field",
                        String.format("Campo %dx%d incompatible con los ejes ligados %dx%d.",
                                field.length, field[0].length, latSize, lonSize));
            }
            double[] out = new double[lat0.length];
            for (int p = 0; p < out.length; p++) {
                double ty = latWeight[p];
                double tx = lonWeight[p];
                double sum = 0.0;
                // Los términos de peso nulo se omiten para que un NaN vecino no contamine el punto
                sum += term((1.0 - ty) * (1.0 - tx), field[lat0[p]][lon0[p]]);
                sum += term((1.0 - ty) * tx, field[lat0[p]][lon1[p]]);
                sum += term(ty * (1.0 - tx), field[lat1[p]][lon0[p]]);
                sum += term(ty * tx, field[lat1[p]][lon1[p]]);
                out[p] = sum;
            }
            return out;
        }

        private static double term(double weight, double value) {
            return weight == 0.0 ? 0.0 : weight * value;
        }
    }
}
