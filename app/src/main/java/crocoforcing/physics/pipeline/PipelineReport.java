package crocoforcing.physics.pipeline;

import crocoforcing.domain.boundary.BoundarySide;
import crocoforcing.domain.boundary.BoundarySlice;
import crocoforcing.domain.source.VariableKind;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Resumen de una ejecución del pipeline: cortes producidos por variable y fallos aislados.
 * Una variable fallida no tiene cortes.
 * <p>
 * Para cada variable correcta se guarda además cuántas líneas horizontales y perfiles
 * verticales no tenían ninguna muestra válida y quedaron sin rellenar.
 */
public class PipelineReport {

    private final Map<VariableKind, Map<BoundarySide, BoundarySlice>> slices = new EnumMap<>(VariableKind.class);
    private final Map<VariableKind, Integer> degenerateCounts = new EnumMap<>(VariableKind.class);
    private final List<VariableFailure> failures = new ArrayList<>();
    @Getter
    private long elapsedMillis;

    void addSlices(VariableKind kind, Map<BoundarySide, BoundarySlice> produced, int degenerateCount) {
        slices.put(kind, Collections.unmodifiableMap(produced));
        degenerateCounts.put(kind, degenerateCount);
    }

    void addFailure(VariableFailure failure) {
        failures.add(failure);
    }

    void setElapsedMillis(long elapsedMillis) {
        this.elapsedMillis = elapsedMillis;
    }

    public Map<BoundarySide, BoundarySlice> slicesOf(VariableKind kind) {
        return slices.getOrDefault(kind, Collections.emptyMap());
    }

    public List<VariableKind> processedKinds() {
        return List.copyOf(slices.keySet());
    }

    /**
     * Líneas y perfiles sin muestras válidas de una variable, sumados sobre contornos y pasos de tiempo.
     * 0 si la variable no se procesó.
     */
    public int degenerateCount(VariableKind kind) {
        return degenerateCounts.getOrDefault(kind, 0);
    }

    public List<VariableFailure> failures() {
        return Collections.unmodifiableList(failures);
    }

    public boolean isSuccessful(VariableKind kind) {
        return slices.containsKey(kind);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("PipelineReport[ok=%s, fallidas=%d, degenerados=%s, %d ms]",
                slices.keySet(), failures.size(), degenerateCounts, elapsedMillis);
    }
}
