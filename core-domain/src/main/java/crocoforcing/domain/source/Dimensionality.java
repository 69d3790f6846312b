package crocoforcing.domain.source;

/**
 * Número de dimensiones espaciales de una variable de forzamiento.
 */
public enum Dimensionality {
    /**
     * Variable 2-D (superficie o integrada en la vertical): zeta, ubar, vbar.
     */
    SURFACE,
    /**
     * Variable 3-D que requiere interpolación vertical a la coordenada s.
     */
    VOLUME
}
