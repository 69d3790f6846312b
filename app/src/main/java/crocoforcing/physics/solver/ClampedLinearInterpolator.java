package crocoforcing.physics.solver;

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.util.MathArrays;

import java.util.Arrays;

/**
 * Interpolación lineal 1-D con extremos acotados: fuera del rango de los nodos se
 * devuelve el valor del nodo más cercano (no se extrapola).
 * <p>
 * Los nodos deben ser estrictamente crecientes. Con un único nodo el resultado es constante.
 */
public final class ClampedLinearInterpolator {

    private static final LinearInterpolator LINEAR = new LinearInterpolator();

    /**
     * Prohibido construir esta clase utilidad
     */
    private ClampedLinearInterpolator() {
    }

    /**
     * @param x     Nodos estrictamente crecientes.
     * @param y     Valores en los nodos.
     * @param query Puntos de consulta.
     * @return Valores interpolados en cada punto de consulta.
     * @throws org.apache.commons.math3.exception.NonMonotonicSequenceException si x no es estrictamente creciente.
     * @throws org.apache.commons.math3.exception.DimensionMismatchException si x e y difieren en longitud.
     */
    public static double[] interpolate(double[] x, double[] y, double[] query) {
        MathArrays.checkEqualLength(x, y);
        double[] out = new double[query.length];
        if (x.length == 1) {
            Arrays.fill(out, y[0]);
            return out;
        }
        MathArrays.checkOrder(x);
        PolynomialSplineFunction f = LINEAR.interpolate(x, y);
        double first = x[0];
        double last = x[x.length - 1];
        for (int q = 0; q < query.length; q++) {
            double xq = query[q];
            if (Double.isNaN(xq)) {
                out[q] = Double.NaN;
            } else if (xq <= first) {
                out[q] = y[0];
            } else if (xq >= last) {
                out[q] = y[y.length - 1];
            } else {
                out[q] = f.value(xq);
            }
        }
        return out;
    }
}
