package crocoforcing.domain.time;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Convención temporal del modelo: días (fraccionarios) desde una fecha origen.
 * Las marcas de tiempo se truncan al minuto antes de convertirse.
 */
public record ModelClock(LocalDate origin) {

    private static final double SECONDS_PER_DAY = 86400.0;

    public ModelClock {
        if (origin == null) {
            throw new IllegalArgumentException("El origen temporal del modelo es obligatorio.");
        }
    }

    public double toDays(LocalDateTime timestamp) {
        LocalDateTime truncated = timestamp.truncatedTo(ChronoUnit.MINUTES);
        return Duration.between(origin.atStartOfDay(), truncated).getSeconds() / SECONDS_PER_DAY;
    }

    public double[] toDays(LocalDateTime[] timestamps) {
        double[] days = new double[timestamps.length];
        for (int i = 0; i < timestamps.length; i++) {
            days[i] = toDays(timestamps[i]);
        }
        return days;
    }
}
