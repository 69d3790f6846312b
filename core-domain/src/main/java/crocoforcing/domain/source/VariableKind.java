package crocoforcing.domain.source;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import crocoforcing.config.ForcingConfigurationException;
import crocoforcing.domain.grid.GridPointType;

/**
 * Tabla de descriptores por defecto de las variables de forzamiento.
 * <p>
 * Sustituye las cadenas de condicionales por variable: familia de puntos de malla,
 * dimensionalidad, rango válido para el relleno de huecos y si la variable es
 * biogeoquímica (mantiene su propio eje temporal).
 */
public enum VariableKind {
    ZETA("zeta", GridPointType.RHO, Dimensionality.SURFACE, -5, 5, false),
    UBAR("ubar", GridPointType.U, Dimensionality.SURFACE, -5, 5, false),
    VBAR("vbar", GridPointType.V, Dimensionality.SURFACE, -5, 5, false),
    U("u", GridPointType.U, Dimensionality.VOLUME, -5, 5, false),
    V("v", GridPointType.V, Dimensionality.VOLUME, -5, 5, false),
    TEMP("temp", GridPointType.RHO, Dimensionality.VOLUME, 0, 40, false),
    SALT("salt", GridPointType.RHO, Dimensionality.VOLUME, 0, 40, false),
    // Biogeoquímica (mol m-3, mmol m-3)
    DIC("DIC", GridPointType.RHO, Dimensionality.VOLUME, 1, 3, true),
    TALK("TALK", GridPointType.RHO, Dimensionality.VOLUME, 1, 3, true),
    PH("pH", GridPointType.RHO, Dimensionality.VOLUME, 7.5, 8.5, true),
    NO3("NO3", GridPointType.RHO, Dimensionality.VOLUME, 0, 100, true),
    NH4("NH4", GridPointType.RHO, Dimensionality.VOLUME, 0, 100, true),
    PO4("PO4", GridPointType.RHO, Dimensionality.VOLUME, 0, 100, true),
    SI("Si", GridPointType.RHO, Dimensionality.VOLUME, 0, 100, true),
    FER("FER", GridPointType.RHO, Dimensionality.VOLUME, 0, 100, true),
    O2("O2", GridPointType.RHO, Dimensionality.VOLUME, 0, 400, true);

    private final String code;
    private final GridPointType gridPointType;
    private final Dimensionality dimensionality;
    private final ValidRange defaultValidRange;
    private final boolean biogeochemical;

    VariableKind(String code, GridPointType gridPointType, Dimensionality dimensionality,
                 double validMin, double validMax, boolean biogeochemical) {
        this.code = code;
        this.gridPointType = gridPointType;
        this.dimensionality = dimensionality;
        this.defaultValidRange = new ValidRange(validMin, validMax);
        this.biogeochemical = biogeochemical;
    }

    /**
     * Nombre de la variable en el fichero de contorno (temp, salt, DIC...).
     */
    @JsonValue
    public String code() {
        return code;
    }

    public GridPointType gridPointType() {
        return gridPointType;
    }

    public boolean isVolumetric() {
        return dimensionality == Dimensionality.VOLUME;
    }

    public ValidRange defaultValidRange() {
        return defaultValidRange;
    }

    public boolean isBiogeochemical() {
        return biogeochemical;
    }

    @JsonCreator
    public static VariableKind fromCode(String code) {
        if (code != null) {
            for (VariableKind kind : values()) {
                if (kind.code.equalsIgnoreCase(code.trim())) return kind;
            }
        }
        throw new ForcingConfigurationException("variable", "Variable no reconocida: '" + code + "'");
    }
}
