package crocoforcing.physics.solver;

import crocoforcing.config.ForcingConfigurationException;
import crocoforcing.config.VerticalCoordinateConfig;
import crocoforcing.config.VerticalTransform;
import crocoforcing.domain.grid.VerticalPointType;
import crocoforcing.factory.VerticalTransformFactory;
import crocoforcing.physics.model.VerticalTransformModel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Calcula la coordenada vertical s (terrain-following) del modelo.
 * <p>
 * La familia de transformación se resuelve una vez en el constructor; σ y Cs, que sólo
 * dependen de los parámetros de estiramiento, se precalculan para puntos rho y w.
 * Las llamadas por punto sólo aplican la corrección de secado y la reconstrucción.
 * <p>
 * Esta clase es thread safe: no tiene estado mutable tras la construcción.
 */
@Slf4j
public class VerticalCoordinateEngine {

    @Getter
    private final VerticalCoordinateConfig config;
    private final VerticalTransformModel model;

    private final double[] sigmaRho;
    private final double[] sigmaW;
    private final double[] csRho;
    private final double[] csW;

    public VerticalCoordinateEngine(VerticalCoordinateConfig config) {
        this(config, VerticalTransformFactory.create(config));
    }

    public VerticalCoordinateEngine(VerticalCoordinateConfig config, VerticalTransformModel model) {
        if (config.transform() != model.family()) {
            throw new ForcingConfigurationException("Vtransform",
                    String.format("La estrategia %s no corresponde a la familia configurada %s.",
                            model.family().label(), config.transform().label()));
        }
        this.config = config;
        this.model = model;

        int n = config.levels();
        this.sigmaW = new double[config.wLevels()];
        for (int k = 0; k < sigmaW.length; k++) {
            sigmaW[k] = (k - (double) n) / n;
        }
        this.sigmaRho = new double[n];
        for (int k = 1; k <= n; k++) {
            sigmaRho[k - 1] = (k - n - 0.5) / n;
        }
        this.csRho = model.stretching(sigmaRho);
        this.csW = model.stretching(sigmaW);
        log.debug("Coordenada s {} inicializada: N={}, θs={}, θb={}, hc={}",
                model.family().label(), n, config.thetaS(), config.thetaB(), config.criticalDepth());
    }

    public VerticalTransform family() {
        return model.family();
    }

    /**
     * Coordenada σ en la familia pedida: N+1 valores de -1 a 0 en w, N puntos medios en rho.
     */
    public double[] sigma(VerticalPointType type) {
        return (type == VerticalPointType.W ? sigmaW : sigmaRho).clone();
    }

    /**
     * Curva de estiramiento en 32 bits.
     */
    public float[] stretching(VerticalPointType type) {
        double[] cs = type == VerticalPointType.W ? csW : csRho;
        float[] out = new float[cs.length];
        for (int k = 0; k < cs.length; k++) out[k] = (float) cs[k];
        return out;
    }

    public int levelCount(VerticalPointType type) {
        return type == VerticalPointType.W ? sigmaW.length : sigmaRho.length;
    }

    /**
     * Profundidades de todos los niveles en un conjunto de puntos, para un único instante.
     * ζ y H son vectores paralelos punto a punto; los campos 2-D se pasan aplanados. Para ζ
     * variable en el tiempo sobre la misma batimetría, ver {@link #computeSeries}.
     *
     * @param type       rho o w.
     * @param zeta       Elevación de la superficie libre en cada punto. No se modifica.
     * @param bathymetry Batimetría en cada punto (positiva hacia abajo). No se modifica.
     * @throws ForcingConfigurationException si ζ y H no tienen la misma longitud.
     */
    public SCoordinateProfile compute(VerticalPointType type, double[] zeta, double[] bathymetry) {
        if (zeta.length != bathymetry.length) {
            throw new ForcingConfigurationException("zeta",
                    String.format("zeta (%d) y h (%d) deben tener la misma longitud.", zeta.length, bathymetry.length));
        }
        double[] sigma = type == VerticalPointType.W ? sigmaW : sigmaRho;
        double[] cs = type == VerticalPointType.W ? csW : csRho;
        double[][] z = new double[sigma.length][bathymetry.length];
        for (int p = 0; p < bathymetry.length; p++) {
            fillColumn(sigma, cs, zeta[p], bathymetry[p], z, p);
        }
        return new SCoordinateProfile(z, stretching(type), sigma.clone());
    }

    /**
     * Variante con ζ dependiente del tiempo [paso][punto]: la batimetría se reutiliza en
     * todos los pasos.
     *
     * @return Un perfil por paso de tiempo, en el mismo orden que ζ.
     */
    public List<SCoordinateProfile> computeSeries(VerticalPointType type, double[][] zeta, double[] bathymetry) {
        List<SCoordinateProfile> out = new ArrayList<>(zeta.length);
        for (double[] step : zeta) {
            out.add(compute(type, step, bathymetry));
        }
        return out;
    }

    /**
     * Profundidades de los niveles de una sola columna (ζ, H).
     */
    public double[] columnDepths(VerticalPointType type, double zeta, double bathymetry) {
        double[] sigma = type == VerticalPointType.W ? sigmaW : sigmaRho;
        double[] cs = type == VerticalPointType.W ? csW : csRho;
        double[][] z = new double[sigma.length][1];
        fillColumn(sigma, cs, zeta, bathymetry, z, 0);
        double[] out = new double[sigma.length];
        for (int k = 0; k < sigma.length; k++) out[k] = z[k][0];
        return out;
    }

    private void fillColumn(double[] sigma, double[] cs, double zeta, double bathymetry, double[][] z, int p) {
        double h = model.effectiveDepth(bathymetry);
        // Secado: la columna de agua nunca es más fina que Dcrit
        double floor = config.dryingThreshold() - h;
        double z0 = zeta < floor ? floor : zeta;
        for (int k = 0; k < sigma.length; k++) {
            z[k][p] = model.depth(sigma[k], cs[k], z0, h);
        }
    }
}
