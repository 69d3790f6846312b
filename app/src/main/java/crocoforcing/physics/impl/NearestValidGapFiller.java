package crocoforcing.physics.impl;

import crocoforcing.config.ForcingConfigurationException;
import crocoforcing.domain.boundary.GapFillResult;
import crocoforcing.domain.source.ValidRange;
import crocoforcing.domain.source.VariableCatalog;
import crocoforcing.domain.source.VariableKind;
import crocoforcing.physics.i.IGapFiller;

import java.util.EnumMap;
import java.util.Map;

/**
 * Relleno de huecos por vecino más cercano en índice.
 * <p>
 * Las celdas próximas a la costa pueden recibir valores contaminados al interpolar el
 * producto de origen al contorno. Cada muestra fuera del rango válido (o NaN) se sustituye
 * por la muestra válida más cercana en índice; en caso de empate gana el índice menor.
 * No se interpola, para no inventar valores fuera del rango medido.
 * <p>
 * Si no hay ninguna muestra válida, el array se devuelve sin cambios y el resultado
 * se marca como degenerado.
 */
public class NearestValidGapFiller implements IGapFiller {

    private final Map<VariableKind, ValidRange> validRanges;

    /**
     * Usa los rangos por defecto de {@link VariableKind}.
     */
    public NearestValidGapFiller() {
        this.validRanges = new EnumMap<>(VariableKind.class);
        for (VariableKind kind : VariableKind.values()) {
            validRanges.put(kind, kind.defaultValidRange());
        }
    }

    public NearestValidGapFiller(Map<VariableKind, ValidRange> validRanges) {
        this.validRanges = new EnumMap<>(VariableKind.class);
        this.validRanges.putAll(validRanges);
    }

    /**
     * Rangos tomados de los descriptores del catálogo.
     */
    public static NearestValidGapFiller fromCatalog(VariableCatalog catalog) {
        Map<VariableKind, ValidRange> ranges = new EnumMap<>(VariableKind.class);
        for (VariableKind kind : catalog.kinds()) {
            ranges.put(kind, catalog.descriptorOf(kind).validRange());
        }
        return new NearestValidGapFiller(ranges);
    }

    @Override
    public String getName() {
        return "NearestValid";
    }

    @Override
    public String getDescription() {
        return "Sustitución por la muestra válida más cercana en índice";
    }

    @Override
    public GapFillResult fill(double[] samples, VariableKind kind) {
        ValidRange range = validRanges.get(kind);
        if (range == null) {
            throw new ForcingConfigurationException(kind == null ? "variable" : kind.code(),
                    "No hay rango válido definido para la variable.");
        }
        int n = samples.length;
        double[] copy = samples.clone();

        // Índice válido más cercano por la izquierda y por la derecha
        int[] left = new int[n];
        int[] right = new int[n];
        int last = -1;
        int invalidCount = 0;
        for (int i = 0; i < n; i++) {
            if (range.contains(samples[i])) {
                last = i;
            } else {
                invalidCount++;
            }
            left[i] = last;
        }
        if (invalidCount == 0) {
            return new GapFillResult(copy, 0, false);
        }
        if (last < 0) {
            return new GapFillResult(copy, 0, true);
        }
        last = -1;
        for (int i = n - 1; i >= 0; i--) {
            if (range.contains(samples[i])) last = i;
            right[i] = last;
        }

        for (int i = 0; i < n; i++) {
            if (range.contains(samples[i])) continue;
            int l = left[i];
            int r = right[i];
            int source;
            if (l < 0) {
                source = r;
            } else if (r < 0) {
                source = l;
            } else {
                source = (i - l) <= (r - i) ? l : r;
            }
            copy[i] = samples[source];
        }
        return new GapFillResult(copy, invalidCount, false);
    }
}
