package crocoforcing.physics.model;

import crocoforcing.config.VerticalTransform;

/**
 * Transformación "new2008" (Shchepetkin y McWilliams).
 * <p>
 * Curva de superficie basada en el coseno hiperbólico (parábola -σ² cuando θs = 0),
 * reenfocada hacia el fondo con una mezcla exponencial cuando θb > 0.
 * Profundidad: z = ζ + (ζ + H)·(hc·σ + Cs·|H|)/(hc + |H|).
 */
public class Shchepetkin2008TransformModel implements VerticalTransformModel {

    private final double thetaS;
    private final double thetaB;
    private final double criticalDepth;

    public Shchepetkin2008TransformModel(double thetaS, double thetaB, double criticalDepth) {
        this.thetaS = thetaS;
        this.thetaB = thetaB;
        this.criticalDepth = criticalDepth;
    }

    @Override
    public VerticalTransform family() {
        return VerticalTransform.NEW_2008;
    }

    @Override
    public double[] stretching(double[] sigma) {
        double[] cs = new double[sigma.length];
        for (int k = 0; k < sigma.length; k++) {
            double sc = sigma[k];
            double csrf;
            if (thetaS > 0.0) {
                csrf = (1.0 - Math.cosh(thetaS * sc)) / (Math.cosh(thetaS) - 1.0);
            } else {
                csrf = -sc * sc;
            }
            if (thetaB > 0.0) {
                cs[k] = (Math.exp(thetaB * (csrf + 1.0)) - 1.0) / (Math.exp(thetaB) - 1.0) - 1.0;
            } else {
                cs[k] = csrf;
            }
        }
        return cs;
    }

    @Override
    public double depth(double sigma, double stretching, double zeta, double depth) {
        double h = Math.abs(depth);
        double denominator = criticalDepth + h;
        // hc = 0 y H = 0: columna degenerada en la costa, la profundidad es la propia superficie
        if (denominator == 0.0) return zeta;
        return zeta + (zeta + depth) * (criticalDepth * sigma + stretching * h) / denominator;
    }
}
