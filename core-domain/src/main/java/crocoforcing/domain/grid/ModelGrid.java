package crocoforcing.domain.grid;

import crocoforcing.config.ForcingConfigurationException;
import lombok.Builder;
import lombok.Singular;

import java.util.EnumMap;
import java.util.Map;

/**
 * Malla del modelo regional: batimetría en puntos rho y coordenadas/máscara de cada
 * familia de puntos.
 * <p>
 * Inmutable y de sólo lectura para el núcleo. Puede compartirse entre hilos.
 */
public final class ModelGrid {

    private final double[][] bathymetry;
    private final Map<GridPointType, GridPoints> points;

    /**
     * @param bathymetry Profundidad en puntos rho, positiva hacia abajo, [eta_rho][xi_rho].
     * @param points     Coordenadas y máscara de cada familia disponible.
     */
    @Builder
    public ModelGrid(double[][] bathymetry, @Singular("point") Map<GridPointType, GridPoints> points) {
        if (bathymetry == null || bathymetry.length == 0) {
            throw new ForcingConfigurationException("h", "La batimetría es obligatoria.");
        }
        int xi = bathymetry[0].length;
        for (int j = 0; j < bathymetry.length; j++) {
            if (bathymetry[j].length != xi) {
                throw new ForcingConfigurationException("h", "La batimetría no es rectangular.");
            }
            for (int i = 0; i < xi; i++) {
                // Invariante: profundidad positiva hacia abajo
                if (!(bathymetry[j][i] >= 0)) {
                    throw new ForcingConfigurationException("h",
                            String.format("Batimetría negativa o inválida %s en (%d, %d).", bathymetry[j][i], j, i));
                }
            }
        }
        this.bathymetry = bathymetry;
        this.points = new EnumMap<>(GridPointType.class);
        if (points != null) {
            this.points.putAll(points);
        }
        GridPoints rho = this.points.get(GridPointType.RHO);
        if (rho != null && (rho.etaSize() != bathymetry.length || rho.xiSize() != xi)) {
            throw new ForcingConfigurationException("h", "La batimetría no coincide con la malla rho.");
        }
    }

    /**
     * Coordenadas y máscara de la familia pedida.
     *
     * @throws ForcingConfigurationException si la malla no contiene esa familia.
     */
    public GridPoints points(GridPointType type) {
        GridPoints p = points.get(type);
        if (p == null) {
            throw new ForcingConfigurationException("mask_" + type.suffix(),
                    "La malla no contiene puntos de tipo " + type.suffix());
        }
        return p;
    }

    /**
     * Batimetría en la familia de puntos pedida. En puntos u y v se promedian los dos
     * puntos rho adyacentes; en psi, los cuatro.
     */
    public double[][] bathymetryAt(GridPointType type) {
        int eta = bathymetry.length;
        int xi = bathymetry[0].length;
        double[][] h;
        switch (type) {
            case RHO -> {
                h = new double[eta][];
                for (int j = 0; j < eta; j++) h[j] = bathymetry[j].clone();
            }
            case U -> {
                h = new double[eta][xi - 1];
                for (int j = 0; j < eta; j++)
                    for (int i = 0; i < xi - 1; i++)
                        h[j][i] = 0.5 * (bathymetry[j][i] + bathymetry[j][i + 1]);
            }
            case V -> {
                h = new double[eta - 1][xi];
                for (int j = 0; j < eta - 1; j++)
                    for (int i = 0; i < xi; i++)
                        h[j][i] = 0.5 * (bathymetry[j][i] + bathymetry[j + 1][i]);
            }
            case PSI -> {
                h = new double[eta - 1][xi - 1];
                for (int j = 0; j < eta - 1; j++)
                    for (int i = 0; i < xi - 1; i++)
                        h[j][i] = 0.25 * (bathymetry[j][i] + bathymetry[j][i + 1]
                                + bathymetry[j + 1][i] + bathymetry[j + 1][i + 1]);
            }
            default -> throw new ForcingConfigurationException("gridType", "Familia de puntos desconocida: " + type);
        }
        GridPoints p = points.get(type);
        if (p != null && (p.etaSize() != h.length || p.xiSize() != h[0].length)) {
            throw new ForcingConfigurationException("h",
                    String.format("Batimetría en puntos %s (%dx%d) inconsistente con su máscara (%dx%d).",
                            type.suffix(), h.length, h[0].length, p.etaSize(), p.xiSize()));
        }
        return h;
    }
}
