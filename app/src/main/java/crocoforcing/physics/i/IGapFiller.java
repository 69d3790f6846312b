package crocoforcing.physics.i;

import crocoforcing.domain.boundary.GapFillResult;
import crocoforcing.domain.source.VariableKind;

public interface IGapFiller extends ISolverComponent {
    /**
     * Repara las muestras fuera del rango válido de la variable.
     *
     * @param samples Array 1-D (a lo largo del contorno o de la vertical). No se modifica.
     * @param kind    Variable, que determina el rango válido.
     * @return Copia reparada y diagnóstico del relleno.
     */
    GapFillResult fill(double[] samples, VariableKind kind);
}
