package crocoforcing.domain.source;

import crocoforcing.config.ForcingConfigurationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Tabla de descriptores de las variables habilitadas en este ciclo.
 */
public final class VariableCatalog {

    private final Map<VariableKind, VariableDescriptor> descriptors;

    public VariableCatalog(Map<VariableKind, VariableDescriptor> descriptors) {
        this.descriptors = Collections.unmodifiableMap(new EnumMap<>(descriptors));
    }

    /**
     * @throws ForcingConfigurationException si la variable no está en la tabla.
     */
    public VariableDescriptor descriptorOf(VariableKind kind) {
        VariableDescriptor d = descriptors.get(kind);
        if (d == null) {
            throw new ForcingConfigurationException(kind == null ? "variable" : kind.code(),
                    "Variable sin descriptor en la configuración.");
        }
        return d;
    }

    public boolean contains(VariableKind kind) {
        return descriptors.containsKey(kind);
    }

    /**
     * Variables habilitadas, en el orden de declaración de {@link VariableKind}.
     */
    public Set<VariableKind> kinds() {
        return descriptors.keySet();
    }
}
