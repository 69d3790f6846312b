package crocoforcing.physics.impl;

import crocoforcing.config.ForcingConfigurationException;
import crocoforcing.physics.i.IRegridOperator;
import org.apache.commons.math3.exception.OutOfRangeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BilinearHorizontalRegridderTest {

    private BilinearHorizontalRegridder regridder;

    // f(lat, lon) = 2·lat + 3·lon: la interpolación bilineal la reproduce exactamente
    private static double[][] plane(double[] lat, double[] lon) {
        double[][] f = new double[lat.length][lon.length];
        for (int j = 0; j < lat.length; j++)
            for (int i = 0; i < lon.length; i++)
                f[j][i] = 2 * lat[j] + 3 * lon[i];
        return f;
    }

    @BeforeEach
    void setUp() {
        regridder = new BilinearHorizontalRegridder();
    }

    @Test
    @DisplayName("Reproduce exactamente un campo lineal en ejes crecientes")
    void apply_shouldReproduceLinearField() {
        double[] lat = {40, 41, 42};
        double[] lon = {-10, -9, -8, -7};

        IRegridOperator op = regridder.bind(lat, lon, new double[]{40.5, 42.0, 41.25}, new double[]{-9.5, -7.0, -10.0});
        double[] r = op.apply(plane(lat, lon));

        assertEquals(2 * 40.5 + 3 * -9.5, r[0], 1e-9);
        assertEquals(2 * 42.0 + 3 * -7.0, r[1], 1e-9);
        assertEquals(2 * 41.25 + 3 * -10.0, r[2], 1e-9);
    }

    @Test
    @DisplayName("Acepta ejes decrecientes")
    void apply_shouldAcceptDescendingAxis() {
        double[] lat = {42, 41, 40};
        double[] lon = {-10, -9};

        double[] r = regridder.bind(lat, lon, new double[]{40.25}, new double[]{-9.75}).apply(plane(lat, lon));

        assertEquals(2 * 40.25 + 3 * -9.75, r[0], 1e-9);
    }

    @Test
    @DisplayName("Un eje de longitud 1 colapsa a esa coordenada")
    void apply_singletonAxisShouldCollapse() {
        double[] lat = {41};
        double[] lon = {0, 1};

        double[] r = regridder.bind(lat, lon, new double[]{41}, new double[]{0.5}).apply(plane(lat, lon));

        assertEquals(82 + 1.5, r[0], 1e-9);
    }

    @Test
    @DisplayName("Malla de origen 3 x 1: se interpola en latitud sobre la única longitud")
    void apply_singleLongitudeColumn() {
        double[] lat = {40, 41, 42};
        double[] lon = {-9};

        IRegridOperator op = regridder.bind(lat, lon, new double[]{40.5, 42.0, 41.25}, new double[]{-9, -9, -9});
        double[] r = op.apply(plane(lat, lon));

        assertEquals(3, r.length);
        assertEquals(2 * 40.5 - 27, r[0], 1e-9);
        assertEquals(2 * 42.0 - 27, r[1], 1e-9);
        assertEquals(2 * 41.25 - 27, r[2], 1e-9);
        // Fuera de la única longitud no hay celda
        assertThrows(OutOfRangeException.class,
                () -> regridder.bind(lat, lon, new double[]{41}, new double[]{-8.5}));
    }

    @Test
    @DisplayName("Puntos destino fuera de la malla de origen -> OutOfRangeException al ligar")
    void bind_shouldRejectTargetsOutsideExtent() {
        double[] lat = {40, 41};
        double[] lon = {0, 1};

        assertThrows(OutOfRangeException.class,
                () -> regridder.bind(lat, lon, new double[]{41.5}, new double[]{0.5}));
        assertThrows(OutOfRangeException.class,
                () -> regridder.bind(lat, lon, new double[]{40.5}, new double[]{Double.NaN}));
    }

    @Test
    @DisplayName("Campo con dimensiones distintas de los ejes -> error de configuración")
    void apply_shouldRejectFieldWithWrongShape() {
        IRegridOperator op = regridder.bind(new double[]{0, 1}, new double[]{0, 1}, new double[]{0.5}, new double[]{0.5});
        assertThrows(ForcingConfigurationException.class, () -> op.apply(new double[3][2]));
    }
}
