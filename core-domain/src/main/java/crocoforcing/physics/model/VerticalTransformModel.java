package crocoforcing.physics.model;

import crocoforcing.config.VerticalTransform;

/**
 * Estrategia de transformación vertical de la coordenada s.
 * <p>
 * Cada implementación agrupa la curva de estiramiento Cs(σ) y la fórmula de reconstrucción
 * de la profundidad correspondiente. Ambas deben usarse siempre juntas.
 * Las implementaciones son inmutables y seguras entre hilos.
 */
public interface VerticalTransformModel {

    VerticalTransform family();

    /**
     * Curva de estiramiento Cs para cada valor de σ en [-1, 0].
     */
    double[] stretching(double[] sigma);

    /**
     * Profundidad física (positiva hacia arriba, cero en el nivel de reposo) de un nivel.
     *
     * @param sigma      Coordenada σ del nivel.
     * @param stretching Valor de Cs en ese nivel.
     * @param zeta       Elevación de la superficie libre, ya corregida por secado.
     * @param depth      Batimetría H (positiva hacia abajo).
     */
    double depth(double sigma, double stretching, double zeta, double depth);

    /**
     * Batimetría que la formulación usa realmente (p. ej. tras acotar ceros).
     */
    default double effectiveDepth(double depth) {
        return depth;
    }
}
