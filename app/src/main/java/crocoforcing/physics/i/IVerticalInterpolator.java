package crocoforcing.physics.i;

import crocoforcing.domain.boundary.VerticalRemapResult;
import crocoforcing.domain.source.VariableKind;

public interface IVerticalInterpolator extends ISolverComponent {
    /**
     * Remapea un bloque [profundidad de origen][índice] a los niveles rho del modelo.
     *
     * @param bathymetry  Batimetría a lo largo del contorno (n).
     * @param sourceDepth Eje de profundidad del producto, positivo hacia abajo (Z).
     * @param data        Datos ya interpolados horizontalmente al contorno (Z x n).
     * @param mask        Máscara tierra/mar a lo largo del contorno (n).
     * @param kind        Variable procesada.
     * @return Bloque (N x n) y estado de cada columna.
     */
    VerticalRemapResult remap(double[] bathymetry, double[] sourceDepth, double[][] data, int[] mask, VariableKind kind);
}
