package crocoforcing.domain.boundary;

/**
 * Estado de cada índice a lo largo del contorno. Sustituye a los centinelas numéricos
 * (-10 "sin calcular", -999.9 "tierra") para que ningún valor marcado entre en la aritmética.
 */
public enum ColumnStatus {
    /** No se ha intentado el cálculo. */
    PENDING,
    /** Punto de tierra según la máscara: columna omitida. */
    LAND,
    /** Valor oceánico calculado. */
    COMPUTED
}
