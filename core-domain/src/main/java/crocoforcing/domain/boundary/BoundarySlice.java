package crocoforcing.domain.boundary;

import crocoforcing.domain.source.VariableKind;
import lombok.Getter;

import java.util.Arrays;
import java.util.function.DoubleUnaryOperator;

/**
 * Unidad principal de salida del pipeline: los valores de una variable a lo largo de
 * un contorno, con forma [tiempo][nivel][índice]. Las variables 2-D tienen un único nivel.
 * <p>
 * Las celdas que no están en estado {@link ColumnStatus#COMPUTED} guardan NaN. El escritor
 * obtiene una copia con un valor de relleno explícito mediante {@link #filled(double)}.
 * <p>
 * Durante la construcción cada hilo escribe en pasos de tiempo disjuntos; una vez
 * entregada al escritor no se modifica.
 */
public final class BoundarySlice {

    @Getter
    private final VariableKind kind;
    @Getter
    private final BoundarySide side;
    private final double[] time;
    @Getter
    private final int levelCount;
    @Getter
    private final int length;
    private final double[][][] values;
    private final ColumnStatus[] status;

    /**
     * Crea un corte vacío: todas las columnas en PENDING y todos los valores en NaN.
     *
     * @param time       Eje temporal en días desde el origen del modelo.
     * @param levelCount Niveles verticales (1 para variables 2-D).
     * @param length     Número de puntos a lo largo del contorno.
     */
    public BoundarySlice(VariableKind kind, BoundarySide side, double[] time, int levelCount, int length) {
        if (time == null || time.length == 0) {
            throw new IllegalArgumentException("El eje temporal del corte no puede estar vacío.");
        }
        if (levelCount <= 0 || length <= 0) {
            throw new IllegalArgumentException(
                    String.format("Dimensiones inválidas: niveles=%d, longitud=%d", levelCount, length));
        }
        this.kind = kind;
        this.side = side;
        this.time = time.clone();
        this.levelCount = levelCount;
        this.length = length;
        this.values = new double[time.length][levelCount][length];
        for (double[][] block : values) {
            for (double[] row : block) Arrays.fill(row, Double.NaN);
        }
        this.status = new ColumnStatus[length];
        Arrays.fill(status, ColumnStatus.PENDING);
    }

    public int timeCount() {
        return time.length;
    }

    public double[] time() {
        return time.clone();
    }

    public boolean isVolumetric() {
        return kind.isVolumetric();
    }

    public double get(int t, int k, int i) {
        return values[t][k][i];
    }

    public void set(int t, int k, int i, double value) {
        values[t][k][i] = value;
    }

    /**
     * Copia un bloque [nivel][índice] en el paso de tiempo t.
     */
    public void setBlock(int t, double[][] block) {
        if (block.length != levelCount) {
            throw new IllegalArgumentException(
                    String.format("Bloque con %d niveles, se esperaban %d.", block.length, levelCount));
        }
        for (int k = 0; k < levelCount; k++) {
            if (block[k].length != length) {
                throw new IllegalArgumentException("Longitud de contorno inconsistente en el nivel " + k);
            }
            System.arraycopy(block[k], 0, values[t][k], 0, length);
        }
    }

    public ColumnStatus status(int i) {
        return status[i];
    }

    public void markStatus(int i, ColumnStatus newStatus) {
        status[i] = newStatus;
    }

    public ColumnStatus[] statuses() {
        return status.clone();
    }

    public boolean isComputed(int i) {
        return status[i] == ColumnStatus.COMPUTED;
    }

    public boolean isAllLand() {
        for (ColumnStatus s : status) {
            if (s != ColumnStatus.LAND) return false;
        }
        return true;
    }

    /**
     * Serie temporal de un índice y nivel concretos.
     */
    public double[] series(int k, int i) {
        double[] out = new double[time.length];
        for (int t = 0; t < time.length; t++) out[t] = values[t][k][i];
        return out;
    }

    /**
     * Nuevo corte con el mismo estado por columna y otro eje temporal. Los valores quedan en NaN.
     */
    public BoundarySlice withEmptyTimeAxis(double[] newTime) {
        BoundarySlice copy = new BoundarySlice(kind, side, newTime, levelCount, length);
        System.arraycopy(status, 0, copy.status, 0, length);
        return copy;
    }

    /**
     * Aplica una transformación sólo a las celdas calculadas. Devuelve un corte nuevo.
     */
    public BoundarySlice mapComputed(DoubleUnaryOperator operator) {
        BoundarySlice copy = withEmptyTimeAxis(time);
        for (int t = 0; t < time.length; t++) {
            for (int k = 0; k < levelCount; k++) {
                for (int i = 0; i < length; i++) {
                    if (status[i] == ColumnStatus.COMPUTED) {
                        copy.values[t][k][i] = operator.applyAsDouble(values[t][k][i]);
                    }
                }
            }
        }
        return copy;
    }

    /**
     * Copia de los valores con las celdas no calculadas sustituidas por {@code fillValue}.
     */
    public double[][][] filled(double fillValue) {
        double[][][] out = new double[time.length][levelCount][length];
        for (int t = 0; t < time.length; t++) {
            for (int k = 0; k < levelCount; k++) {
                for (int i = 0; i < length; i++) {
                    out[t][k][i] = status[i] == ColumnStatus.COMPUTED ? values[t][k][i] : fillValue;
                }
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return String.format("BoundarySlice[%s_%s, t=%d, k=%d, n=%d]",
                kind.code(), side.suffix(), time.length, levelCount, length);
    }
}
