package crocoforcing.physics.i;

public interface IHorizontalRegridder extends ISolverComponent {
    /**
     * Prepara la interpolación de una malla regular (lat, lon) a unos puntos destino.
     *
     * @param sourceLatitude  Eje de latitud del producto (monótono).
     * @param sourceLongitude Eje de longitud del producto (monótono).
     * @param targetLatitude  Latitud de cada punto destino.
     * @param targetLongitude Longitud de cada punto destino.
     * @return Operador reutilizable para todos los cortes sobre los mismos ejes.
     */
    IRegridOperator bind(double[] sourceLatitude, double[] sourceLongitude,
                         double[] targetLatitude, double[] targetLongitude);
}
