package crocoforcing.physics.pipeline;

import crocoforcing.domain.boundary.BoundarySide;
import crocoforcing.domain.source.VariableKind;

import java.util.List;

/**
 * Variable que no pudo procesarse y motivo del fallo.
 *
 * @param writtenSides Contornos que el escritor llegó a recibir antes del fallo; vacío si
 *                     la variable falló antes de escribir.
 */
public record VariableFailure(VariableKind kind, String reason, Exception cause, List<BoundarySide> writtenSides) {

    public VariableFailure {
        writtenSides = List.copyOf(writtenSides);
    }

    public static VariableFailure of(VariableKind kind, Exception cause) {
        return of(kind, cause, List.of());
    }

    public static VariableFailure of(VariableKind kind, Exception cause, List<BoundarySide> writtenSides) {
        return new VariableFailure(kind, cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause, writtenSides);
    }

    public boolean isPartiallyWritten() {
        return !writtenSides.isEmpty();
    }
}
