package crocoforcing.physics.impl;

import crocoforcing.domain.source.SourceField;
import crocoforcing.domain.time.ForcingCycle;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Lleva un campo de origen al eje diario del ciclo de forzamiento.
 * <p>
 * Cada día del ciclo copia el paso de tiempo nativo más cercano (en empate, el primero).
 * Se usa con productos biogeoquímicos que no cubren el ciclo completo.
 */
@Slf4j
public class SourceTimeExtender {

    public SourceField extend(SourceField field, ForcingCycle cycle) {
        LocalDateTime[] nativeTimes = field.getTimes();
        LocalDateTime[] daily = cycle.dailyTimestamps();
        if (sameDays(nativeTimes, daily)) {
            return field;
        }

        double[][][][] extended = new double[daily.length][][][];
        for (int d = 0; d < daily.length; d++) {
            int nearest = nearestIndex(nativeTimes, daily[d]);
            extended[d] = field.getData()[nearest];
        }
        log.info("{}: eje temporal extendido de {} a {} pasos diarios ({} -> {}).",
                field.getKind().code(), nativeTimes.length, daily.length, cycle.start(), cycle.end());
        return field.withTimeAxis(daily, extended);
    }

    private static boolean sameDays(LocalDateTime[] nativeTimes, LocalDateTime[] daily) {
        if (nativeTimes.length != daily.length) return false;
        for (int i = 0; i < daily.length; i++) {
            LocalDate a = nativeTimes[i].toLocalDate();
            if (!a.equals(daily[i].toLocalDate())) return false;
        }
        return true;
    }

    private static int nearestIndex(LocalDateTime[] times, LocalDateTime target) {
        int best = 0;
        long bestDistance = Long.MAX_VALUE;
        for (int i = 0; i < times.length; i++) {
            long distance = Math.abs(Duration.between(times[i], target).getSeconds());
            if (distance < bestDistance) {
                bestDistance = distance;
                best = i;
            }
        }
        return best;
    }
}
