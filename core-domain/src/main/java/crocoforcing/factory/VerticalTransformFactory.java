package crocoforcing.factory;

import crocoforcing.config.ForcingConfigurationException;
import crocoforcing.config.VerticalCoordinateConfig;
import crocoforcing.physics.model.Shchepetkin2008TransformModel;
import crocoforcing.physics.model.Song1994TransformModel;
import crocoforcing.physics.model.VerticalTransformModel;

/**
 * Selecciona la estrategia de transformación vertical una sola vez por ejecución.
 */
public final class VerticalTransformFactory {

    private VerticalTransformFactory() {
    }

    public static VerticalTransformModel create(VerticalCoordinateConfig config) {
        if (config == null || config.transform() == null) {
            throw new ForcingConfigurationException("Vtransform", "Transformación vertical no especificada.");
        }
        return switch (config.transform()) {
            case NEW_2008 -> new Shchepetkin2008TransformModel(config.thetaS(), config.thetaB(), config.criticalDepth());
            case OLD_1994 -> new Song1994TransformModel(config.thetaS(), config.thetaB(), config.criticalDepth());
        };
    }
}
