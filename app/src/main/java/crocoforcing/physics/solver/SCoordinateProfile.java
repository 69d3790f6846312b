package crocoforcing.physics.solver;

/**
 * Resultado de la transformación vertical.
 *
 * @param depths     Profundidad de cada nivel en cada punto [nivel][punto], positiva hacia arriba.
 * @param stretching Curva de estiramiento Cs por nivel (32 bits).
 * @param sigma      Coordenada σ por nivel.
 */
public record SCoordinateProfile(double[][] depths, float[] stretching, double[] sigma) {

    public int levelCount() {
        return sigma.length;
    }

    public int pointCount() {
        return depths.length == 0 ? 0 : depths[0].length;
    }

    /**
     * Columna vertical de un punto (equivale a eliminar la dimensión horizontal unitaria).
     */
    public double[] column(int point) {
        double[] out = new double[depths.length];
        for (int k = 0; k < depths.length; k++) out[k] = depths[k][point];
        return out;
    }
}
