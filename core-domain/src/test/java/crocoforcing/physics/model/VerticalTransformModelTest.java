package crocoforcing.physics.model;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class VerticalTransformModelTest {

    private static final double EPS = 1e-12;

    // σ en puntos w para N = 10: de -1 a 0
    private static double[] wSigma(int n) {
        double[] sigma = new double[n + 1];
        for (int k = 0; k <= n; k++) sigma[k] = (double) (k - n) / n;
        return sigma;
    }

    @Test
    @DisplayName("new2008: Cs acotado en [-1, 0] con Cs(-1) = -1 y Cs(0) = 0")
    void shchepetkin_stretchingShouldBeBoundedWithFixedEndpoints() {
        // ARRANGE
        VerticalTransformModel model = new Shchepetkin2008TransformModel(7.0, 2.0, 200.0);

        // ACT
        double[] cs = model.stretching(wSigma(10));

        // ASSERT
        log.info("Cs new2008: {}", Arrays.toString(cs));
        assertEquals(-1.0, cs[0], EPS);
        assertEquals(0.0, cs[cs.length - 1], EPS);
        for (double c : cs) {
            assertTrue(c >= -1.0 - EPS && c <= EPS, "Cs fuera de [-1, 0]: " + c);
        }
        for (int k = 1; k < cs.length; k++) {
            assertTrue(cs[k] >= cs[k - 1], "Cs debe ser monótona en σ");
        }
    }

    @Test
    @DisplayName("new2008: con θs = 0 y θb = 0 la curva es la parábola -σ²")
    void shchepetkin_zeroThetaShouldGiveParabola() {
        VerticalTransformModel model = new Shchepetkin2008TransformModel(0.0, 0.0, 10.0);
        double[] sigma = wSigma(4);

        double[] cs = model.stretching(sigma);

        for (int k = 0; k < sigma.length; k++) {
            assertEquals(-sigma[k] * sigma[k], cs[k], EPS);
        }
    }

    @Test
    @DisplayName("new2008: en el fondo z = -H y en superficie z = ζ")
    void shchepetkin_depthShouldHitBottomAndSurface() {
        VerticalTransformModel model = new Shchepetkin2008TransformModel(5.0, 0.4, 10.0);

        assertEquals(-75.0, model.depth(-1.0, -1.0, 0.0, 75.0), 1e-9);
        assertEquals(0.5, model.depth(0.0, 0.0, 0.5, 75.0), 1e-9);
    }

    @Test
    @DisplayName("new2008: hc = 0 y H = 0 devuelve ζ sin dividir por cero")
    void shchepetkin_degenerateColumnShouldReturnZeta() {
        VerticalTransformModel model = new Shchepetkin2008TransformModel(5.0, 0.4, 0.0);

        double z = model.depth(-0.5, -0.3, 0.2, 0.0);

        assertEquals(0.2, z, EPS);
    }

    @Test
    @DisplayName("old1994: con θs = 0 se usa el límite analítico Cs = σ, sin NaN")
    void song_zeroThetaShouldUseAnalyticLimit() {
        VerticalTransformModel model = new Song1994TransformModel(0.0, 0.4, 10.0);
        double[] sigma = wSigma(5);

        double[] cs = model.stretching(sigma);

        for (int k = 0; k < sigma.length; k++) {
            assertFalse(Double.isNaN(cs[k]));
            assertEquals(sigma[k], cs[k], EPS);
        }
    }

    @Test
    @DisplayName("old1994: con θs = 0 la mezcla de ambos términos coincide con el límite de θs -> 0 para todo θb")
    void song_zeroThetaShouldMatchBlendedLimitForAnyThetaB() {
        double[] sigma = wSigma(8);

        for (double thetaB : new double[]{0.0, 0.4, 1.0}) {
            double[] limit = new Song1994TransformModel(0.0, thetaB, 10.0).stretching(sigma);
            double[] nearZero = new Song1994TransformModel(1e-4, thetaB, 10.0).stretching(sigma);
            log.info("θb = {}: Cs(θs = 0) = {}", thetaB, Arrays.toString(limit));

            for (int k = 0; k < sigma.length; k++) {
                // (1 - θb)·σ + θb·σ = σ
                double blended = (1.0 - thetaB) * sigma[k] + thetaB * sigma[k];
                assertEquals(blended, limit[k], EPS);
                assertEquals(nearZero[k], limit[k], 1e-6);
            }
        }
    }

    @Test
    @DisplayName("old1994: Cs acotado en [-1, 0] con extremos fijos")
    void song_stretchingShouldBeBounded() {
        VerticalTransformModel model = new Song1994TransformModel(6.0, 0.3, 50.0);

        double[] cs = model.stretching(wSigma(20));

        assertEquals(-1.0, cs[0], 1e-9);
        assertEquals(0.0, cs[cs.length - 1], 1e-9);
        for (double c : cs) {
            assertTrue(c >= -1.0 - 1e-9 && c <= 1e-9, "Cs fuera de [-1, 0]: " + c);
        }
    }

    @Test
    @DisplayName("old1994: batimetría nula se acota a 0.01 y no produce infinitos")
    void song_zeroBathymetryShouldBeClamped() {
        VerticalTransformModel model = new Song1994TransformModel(6.0, 0.3, 5.0);

        double z = model.depth(-0.5, -0.4, 0.1, 0.0);

        assertEquals(Song1994TransformModel.MINIMUM_DEPTH, model.effectiveDepth(0.0));
        assertTrue(Double.isFinite(z));
    }
}
