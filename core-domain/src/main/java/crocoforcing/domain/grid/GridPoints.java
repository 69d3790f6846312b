package crocoforcing.domain.grid;

import crocoforcing.config.ForcingConfigurationException;

/**
 * Coordenadas y máscara tierra/mar de una familia de puntos de la malla del modelo.
 * Los arrays se indexan como [eta][xi].
 *
 * @param longitude Longitud de cada punto (grados este).
 * @param latitude  Latitud de cada punto (grados norte).
 * @param mask      Máscara: 0 tierra, 1 agua.
 */
public record GridPoints(double[][] longitude, double[][] latitude, int[][] mask) {

    public GridPoints {
        if (longitude == null || latitude == null || mask == null || mask.length == 0) {
            throw new ForcingConfigurationException("grid", "Coordenadas y máscara son obligatorias.");
        }
        int eta = mask.length;
        int xi = mask[0].length;
        checkShape("lon", longitude, eta, xi);
        checkShape("lat", latitude, eta, xi);
        for (int j = 0; j < eta; j++) {
            if (mask[j].length != xi) {
                throw new ForcingConfigurationException("mask", "La máscara no es rectangular.");
            }
            for (int i = 0; i < xi; i++) {
                if (mask[j][i] != 0 && mask[j][i] != 1) {
                    throw new ForcingConfigurationException("mask",
                            String.format("Valor de máscara inválido %d en (%d, %d); se espera 0 o 1.", mask[j][i], j, i));
                }
            }
        }
    }

    public int etaSize() {
        return mask.length;
    }

    public int xiSize() {
        return mask[0].length;
    }

    private static void checkShape(String name, double[][] array, int eta, int xi) {
        if (array.length != eta) {
            throw new ForcingConfigurationException(name, "Dimensión eta inconsistente con la máscara.");
        }
        for (double[] row : array) {
            if (row.length != xi) {
                throw new ForcingConfigurationException(name, "Dimensión xi inconsistente con la máscara.");
            }
        }
    }
}
