package crocoforcing.domain.time;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Ventana de un ciclo de forzamiento: desde {@code reference - daysBack} hasta
 * {@code reference + daysAhead + 1}, ambos incluidos.
 */
public record ForcingCycle(LocalDate start, LocalDate end) {

    public ForcingCycle {
        if (start == null || end == null || end.isBefore(start)) {
            throw new IllegalArgumentException("Ciclo de forzamiento inválido: " + start + " -> " + end);
        }
    }

    public static ForcingCycle of(LocalDate reference, int daysBack, int daysAhead) {
        return new ForcingCycle(reference.minusDays(daysBack), reference.plusDays(daysAhead + 1L));
    }

    /**
     * Marcas diarias a medianoche, de {@code start} a {@code end} inclusive.
     */
    public LocalDateTime[] dailyTimestamps() {
        List<LocalDateTime> out = new ArrayList<>();
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
            out.add(d.atStartOfDay());
        }
        return out.toArray(new LocalDateTime[0]);
    }
}
