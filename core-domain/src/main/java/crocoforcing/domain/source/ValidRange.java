package crocoforcing.domain.source;

import crocoforcing.config.ForcingConfigurationException;

/**
 * Rango físicamente plausible de una variable. Los valores fuera de él (y NaN) se
 * consideran contaminados por la interpolación horizontal cerca de la costa.
 */
public record ValidRange(double min, double max) {

    public ValidRange {
        if (Double.isNaN(min) || Double.isNaN(max) || min > max) {
            throw new ForcingConfigurationException("validRange",
                    String.format("Rango válido mal formado: [%s, %s]", min, max));
        }
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }
}
