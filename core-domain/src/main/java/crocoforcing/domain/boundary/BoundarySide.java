package crocoforcing.domain.boundary;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lados del dominio del modelo. Cada lado sabe extraer su línea de contorno de un
 * array 2-D indexado como [eta][xi].
 */
public enum BoundarySide {
    /** Primera fila (eta = 0). */
    SOUTH("south"),
    /** Última columna (xi = L-1). */
    EAST("east"),
    /** Última fila (eta = M-1). */
    NORTH("north"),
    /** Primera columna (xi = 0). */
    WEST("west");

    private final String suffix;

    BoundarySide(String suffix) {
        this.suffix = suffix;
    }

    @JsonValue
    public String suffix() {
        return suffix;
    }

    public double[] extract(double[][] field) {
        int eta = field.length;
        int xi = field[0].length;
        return switch (this) {
            case SOUTH -> field[0].clone();
            case NORTH -> field[eta - 1].clone();
            case EAST -> column(field, xi - 1);
            case WEST -> column(field, 0);
        };
    }

    public int[] extract(int[][] field) {
        int eta = field.length;
        int xi = field[0].length;
        return switch (this) {
            case SOUTH -> field[0].clone();
            case NORTH -> field[eta - 1].clone();
            case EAST -> column(field, xi - 1);
            case WEST -> column(field, 0);
        };
    }

    private static double[] column(double[][] field, int i) {
        double[] out = new double[field.length];
        for (int j = 0; j < field.length; j++) out[j] = field[j][i];
        return out;
    }

    private static int[] column(int[][] field, int i) {
        int[] out = new int[field.length];
        for (int j = 0; j < field.length; j++) out[j] = field[j][i];
        return out;
    }
}
