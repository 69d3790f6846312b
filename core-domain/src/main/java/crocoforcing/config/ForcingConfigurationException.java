package crocoforcing.config;

import lombok.Getter;

/**
 * Error de configuración: parámetro ausente, fuera de dominio o inconsistente con los datos.
 * <p>
 * Es fatal para la variable que se está procesando. El pipeline lo captura, lo registra
 * y continúa con la siguiente variable.
 */
@Getter
public class ForcingConfigurationException extends IllegalArgumentException {

    /**
     * Nombre del parámetro (o dimensión) que provocó el error.
     */
    private final String parameter;

    public ForcingConfigurationException(String parameter, String message) {
        super(String.format("[%s] %s", parameter, message));
        this.parameter = parameter;
    }
}
