package crocoforcing.physics.model;

import crocoforcing.config.VerticalTransform;

/**
 * Transformación "old1994" (Song y Haidvogel).
 * <p>
 * Cs = (1 - θb)·sinh(θs·σ)/sinh(θs) + θb·(tanh(θs·(σ + 0.5))/(2·tanh(θs/2)) - 0.5)
 * <br>
 * z0 = hc·(σ - Cs) + Cs·H ; z = z0 + ζ·(1 + z0/H)
 * <p>
 * Las constantes proceden de la formulación publicada y se usan tal cual.
 */
public class Song1994TransformModel implements VerticalTransformModel {

    /**
     * Batimetría mínima antes de invertir H (celdas costeras con H = 0).
     */
    public static final double MINIMUM_DEPTH = 1e-2;

    private final double thetaS;
    private final double thetaB;
    private final double criticalDepth;

    public Song1994TransformModel(double thetaS, double thetaB, double criticalDepth) {
        this.thetaS = thetaS;
        this.thetaB = thetaB;
        this.criticalDepth = criticalDepth;
    }

    @Override
    public VerticalTransform family() {
        return VerticalTransform.OLD_1994;
    }

    @Override
    public double[] stretching(double[] sigma) {
        double[] cs = new double[sigma.length];
        if (thetaS == 0.0) {
            // Límite analítico para θs -> 0: ambos términos tienden a σ
            System.arraycopy(sigma, 0, cs, 0, sigma.length);
            return cs;
        }
        double cff1 = 1.0 / Math.sinh(thetaS);
        double cff2 = 0.5 / Math.tanh(0.5 * thetaS);
        for (int k = 0; k < sigma.length; k++) {
            double sc = sigma[k];
            cs[k] = (1.0 - thetaB) * cff1 * Math.sinh(thetaS * sc)
                    + thetaB * (cff2 * Math.tanh(thetaS * (sc + 0.5)) - 0.5);
        }
        return cs;
    }

    @Override
    public double effectiveDepth(double depth) {
        return depth == 0.0 ? MINIMUM_DEPTH : depth;
    }

    @Override
    public double depth(double sigma, double stretching, double zeta, double depth) {
        double h = effectiveDepth(depth);
        double z0 = criticalDepth * (sigma - stretching) + stretching * h;
        return z0 + zeta * (1.0 + z0 / h);
    }
}
