package crocoforcing.physics.impl;

import crocoforcing.config.VariableSettings;
import crocoforcing.domain.source.SourceField;
import crocoforcing.domain.time.ForcingCycle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Ajustes temporales previos a la interpolación: extensión al ciclo y desfase horario.
 */
@Slf4j
@RequiredArgsConstructor
public class SourceFieldPreparer {

    private final ForcingCycle cycle;
    private final SourceTimeExtender extender;

    public SourceFieldPreparer(ForcingCycle cycle) {
        this(cycle, new SourceTimeExtender());
    }

    public SourceField prepare(SourceField field, VariableSettings settings) {
        SourceField prepared = field;
        if (settings.extendToCycle()) {
            prepared = extender.extend(prepared, cycle);
        }
        if (settings.timeShiftHours() != 0.0) {
            log.debug("{}: desfase de {} h sobre las marcas de tiempo.", field.getKind().code(), settings.timeShiftHours());
            prepared = prepared.shiftedBy(settings.timeShiftHours());
        }
        return prepared;
    }
}
