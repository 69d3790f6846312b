package crocoforcing.domain.grid;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Familias de puntos de la malla escalonada (Arakawa C).
 */
public enum GridPointType {
    RHO("rho"),
    U("u"),
    V("v"),
    PSI("psi");

    private final String suffix;

    GridPointType(String suffix) {
        this.suffix = suffix;
    }

    /**
     * Sufijo usado en los nombres de variables del fichero de malla (lon_rho, mask_u...).
     */
    @JsonValue
    public String suffix() {
        return suffix;
    }
}
