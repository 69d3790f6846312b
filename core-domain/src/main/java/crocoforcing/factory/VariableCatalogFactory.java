package crocoforcing.factory;

import crocoforcing.config.ForcingConfig;
import crocoforcing.config.VariableSettings;
import crocoforcing.domain.source.ValidRange;
import crocoforcing.domain.source.VariableCatalog;
import crocoforcing.domain.source.VariableDescriptor;
import crocoforcing.domain.source.VariableKind;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;

/**
 * Construye la tabla de descriptores del ciclo a partir de la configuración:
 * valores por defecto de {@link VariableKind} más offsets, factores y rangos del usuario.
 */
@Slf4j
public final class VariableCatalogFactory {

    private VariableCatalogFactory() {
    }

    public static VariableCatalog fromConfig(ForcingConfig config) {
        Map<VariableKind, VariableDescriptor> descriptors = new EnumMap<>(VariableKind.class);
        for (VariableKind kind : VariableKind.values()) {
            if (!config.isEnabled(kind)) continue;
            VariableSettings settings = config.settingsOf(kind);
            ValidRange range = config.validRanges().getOrDefault(kind, kind.defaultValidRange());
            descriptors.put(kind, VariableDescriptor.builder()
                    .kind(kind)
                    .gridPointType(kind.gridPointType())
                    .validRange(range)
                    .offset(settings.offset())
                    .factor(settings.factor())
                    // Las biogeoquímicas conservan su propio eje temporal
                    .followsMasterClock(!kind.isBiogeochemical())
                    .build());
        }
        log.info("Catálogo de variables: {}", descriptors.keySet());
        return new VariableCatalog(descriptors);
    }
}
