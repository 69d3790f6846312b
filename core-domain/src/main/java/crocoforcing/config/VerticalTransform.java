package crocoforcing.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Familia de transformación vertical del modelo.
 * <p>
 * Las dos formulaciones son excluyentes: cambian tanto la curva de estiramiento
 * como la reconstrucción de la profundidad, y nunca se mezclan.
 */
public enum VerticalTransform {
    /**
     * Song y Haidvogel (1994). Vtransform = 1.
     */
    OLD_1994(1, "old1994"),
    /**
     * Shchepetkin y McWilliams (2008). Vtransform = 2.
     */
    NEW_2008(2, "new2008");

    private final int code;
    private final String label;

    VerticalTransform(int code, String label) {
        this.code = code;
        this.label = label;
    }

    public int code() {
        return code;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Traduce el valor numérico Vtransform (1 o 2) a la familia correspondiente.
     */
    public static VerticalTransform fromCode(int code) {
        for (VerticalTransform t : values()) {
            if (t.code == code) return t;
        }
        throw new ForcingConfigurationException("Vtransform",
                "Transformación vertical desconocida: " + code + " (se esperaba 1 o 2).");
    }

    @JsonCreator
    public static VerticalTransform fromName(String name) {
        if (name != null) {
            for (VerticalTransform t : values()) {
                if (t.label.equalsIgnoreCase(name.trim()) || t.name().equalsIgnoreCase(name.trim())) return t;
            }
        }
        throw new ForcingConfigurationException("scoord",
                "Transformación vertical desconocida: '" + name + "' (se esperaba 'new2008' u 'old1994').");
    }
}
