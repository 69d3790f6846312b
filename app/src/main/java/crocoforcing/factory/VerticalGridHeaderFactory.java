package crocoforcing.factory;

import crocoforcing.config.VerticalCoordinateConfig;
import crocoforcing.domain.boundary.VerticalGridHeader;
import crocoforcing.domain.grid.VerticalPointType;
import crocoforcing.domain.time.MasterTimeAxis;
import crocoforcing.physics.solver.VerticalCoordinateEngine;

/**
 * Construye los valores de cabecera de la rejilla vertical del fichero de contorno.
 */
public final class VerticalGridHeaderFactory {

    // Curva de estiramiento de la familia de transformaciones soportada
    private static final int VSTRETCHING = 1;

    private VerticalGridHeaderFactory() {
        // Prohibido construir esta clase utilidad
    }

    public static VerticalGridHeader create(VerticalCoordinateConfig config, MasterTimeAxis masterAxis) {
        return create(config, new VerticalCoordinateEngine(config), masterAxis);
    }

    public static VerticalGridHeader create(VerticalCoordinateConfig config, VerticalCoordinateEngine engine,
                                            MasterTimeAxis masterAxis) {
        return VerticalGridHeader.builder()
                .vtransform(config.transform().code())
                .vstretching(VSTRETCHING)
                .thetaS(config.thetaS())
                .thetaB(config.thetaB())
                .hc(config.criticalDepth())
                .tcline(config.criticalDepth())
                .scR(engine.sigma(VerticalPointType.RHO))
                .scW(engine.sigma(VerticalPointType.W))
                .csR(engine.stretching(VerticalPointType.RHO))
                .csW(engine.stretching(VerticalPointType.W))
                .tstart(masterAxis.start())
                .tend(masterAxis.end())
                .build();
    }
}
