package crocoforcing.physics.i;

/**
 * Interpolante ya ligado a unos ejes de origen y a unos puntos destino fijos.
 * Se reutiliza para cada corte (tiempo, profundidad) sin recalcular la búsqueda de celdas.
 */
@FunctionalInterface
public interface IRegridOperator {
    /**
     * @param field Campo de origen [latitud][longitud].
     * @return Valor interpolado en cada punto destino.
     */
    double[] apply(double[][] field);
}
