package crocoforcing.domain.boundary;

/**
 * Resultado del relleno de huecos.
 *
 * @param values        Copia reparada.
 * @param replacedCount Muestras sustituidas.
 * @param degenerate    Ninguna muestra era válida: los datos se devuelven sin rellenar.
 */
public record GapFillResult(double[] values, int replacedCount, boolean degenerate) {
}
