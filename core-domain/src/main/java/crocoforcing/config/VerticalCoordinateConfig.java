package crocoforcing.config;

import lombok.Builder;
import lombok.With;

/**
 * Parámetros de la coordenada vertical s del modelo. Inmutable durante toda la ejecución.
 *
 * @param transform        Familia de transformación (old1994 / new2008).
 * @param thetaS           Parámetro de estiramiento en superficie (θs >= 0).
 * @param thetaB           Parámetro de estiramiento en el fondo (θb >= 0).
 * @param levels           Número de niveles rho (N > 0). Los puntos w tienen N+1 niveles.
 * @param criticalDepth    Profundidad crítica hc en metros (>= 0).
 * @param dryingThreshold  Espesor mínimo de la columna de agua (Dcrit). Por defecto 0.2 m.
 */
@Builder
@With
public record VerticalCoordinateConfig(
        VerticalTransform transform,
        double thetaS,
        double thetaB,
        int levels,
        double criticalDepth,
        Double dryingThreshold
) {
    public static final double DEFAULT_DRYING_THRESHOLD = 0.2;

    public VerticalCoordinateConfig {
        if (transform == null) {
            throw new ForcingConfigurationException("Vtransform", "La familia de transformación vertical es obligatoria.");
        }
        if (levels <= 0) {
            throw new ForcingConfigurationException("N", "El número de niveles verticales debe ser positivo: " + levels);
        }
        if (thetaS < 0 || Double.isNaN(thetaS)) {
            throw new ForcingConfigurationException("theta_s", "theta_s no puede ser negativo: " + thetaS);
        }
        if (thetaB < 0 || Double.isNaN(thetaB)) {
            throw new ForcingConfigurationException("theta_b", "theta_b no puede ser negativo: " + thetaB);
        }
        if (criticalDepth < 0 || Double.isNaN(criticalDepth)) {
            throw new ForcingConfigurationException("hc", "La profundidad crítica no puede ser negativa: " + criticalDepth);
        }
        if (dryingThreshold == null) {
            dryingThreshold = DEFAULT_DRYING_THRESHOLD;
        }
    }

    /**
     * Número de niveles en puntos w (interfaces entre capas).
     */
    public int wLevels() {
        return levels + 1;
    }
}
