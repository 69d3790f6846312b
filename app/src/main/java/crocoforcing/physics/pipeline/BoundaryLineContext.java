package crocoforcing.physics.pipeline;

import crocoforcing.config.ForcingConfigurationException;
import crocoforcing.domain.boundary.BoundarySide;
import crocoforcing.domain.grid.GridPointType;
import crocoforcing.domain.grid.GridPoints;
import crocoforcing.domain.grid.ModelGrid;

/**
 * Datos de la malla a lo largo de una línea de contorno para una familia de puntos:
 * coordenadas destino, batimetría y máscara.
 */
public record BoundaryLineContext(
        BoundarySide side,
        GridPointType pointType,
        double[] latitude,
        double[] longitude,
        double[] bathymetry,
        int[] mask
) {
    public BoundaryLineContext {
        int n = latitude.length;
        if (longitude.length != n || bathymetry.length != n || mask.length != n) {
            throw new ForcingConfigurationException("mask_" + pointType.suffix(),
                    String.format("Línea %s inconsistente: lat=%d, lon=%d, h=%d, mask=%d",
                            side.suffix(), n, longitude.length, bathymetry.length, mask.length));
        }
    }

    public static BoundaryLineContext of(ModelGrid grid, GridPointType type, BoundarySide side) {
        GridPoints points = grid.points(type);
        return new BoundaryLineContext(
                side,
                type,
                side.extract(points.latitude()),
                side.extract(points.longitude()),
                side.extract(grid.bathymetryAt(type)),
                side.extract(points.mask()));
    }

    public int length() {
        return latitude.length;
    }
}
