package crocoforcing.domain.boundary;

/**
 * Bloque remapeado a los niveles del modelo.
 *
 * @param values Valores [nivel][índice]; NaN en columnas no calculadas.
 * @param status Estado de cada índice del contorno.
 * @param degenerateProfiles Columnas de agua sin ninguna muestra válida en el origen.
 */
public record VerticalRemapResult(double[][] values, ColumnStatus[] status, int degenerateProfiles) {

    public int levelCount() {
        return values.length;
    }

    public int length() {
        return status.length;
    }
}
