package crocoforcing.domain.source;

import crocoforcing.domain.grid.GridPointType;
import lombok.Builder;
import lombok.With;

/**
 * Descriptor resuelto de una variable para el ciclo actual: se consulta una vez y
 * elimina los condicionales repetidos por variable.
 *
 * @param kind               Variable.
 * @param gridPointType      Familia de puntos de la malla donde vive.
 * @param validRange         Rango válido usado por el relleno de huecos.
 * @param offset             Desplazamiento aditivo final.
 * @param factor             Factor multiplicativo final.
 * @param followsMasterClock Si se remuestrea al eje temporal maestro.
 */
@Builder
@With
public record VariableDescriptor(
        VariableKind kind,
        GridPointType gridPointType,
        ValidRange validRange,
        double offset,
        double factor,
        boolean followsMasterClock
) {
    /**
     * offset + valor * factor
     */
    public double apply(double value) {
        return offset + value * factor;
    }

    public boolean isIdentityTransform() {
        return offset == 0.0 && factor == 1.0;
    }
}
