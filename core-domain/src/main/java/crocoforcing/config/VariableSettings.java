package crocoforcing.config;

import lombok.Builder;
import lombok.With;

/**
 * Opciones del usuario para una variable concreta del producto de origen.
 *
 * @param enabled         Si la variable se procesa en este ciclo.
 * @param offset          Desplazamiento aditivo aplicado al resultado final.
 * @param factor          Factor multiplicativo aplicado al resultado final (por defecto 1).
 * @param timeShiftHours  Desfase en horas que se suma a las marcas de tiempo del producto.
 * @param extendToCycle   Extiende el eje temporal nativo a todo el ciclo de forzamiento
 *                        replicando el paso de tiempo más cercano.
 */
@Builder
@With
public record VariableSettings(
        boolean enabled,
        double offset,
        Double factor,
        double timeShiftHours,
        boolean extendToCycle
) {
    public VariableSettings {
        if (factor == null) {
            factor = 1.0;
        }
    }

    public static VariableSettings enabledDefault() {
        return VariableSettings.builder().enabled(true).build();
    }
}
