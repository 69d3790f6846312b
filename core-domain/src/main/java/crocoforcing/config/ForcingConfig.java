package crocoforcing.config;

import com.fasterxml.jackson.annotation.JsonFormat;
import crocoforcing.domain.source.ValidRange;
import crocoforcing.domain.source.VariableKind;
import lombok.Builder;
import lombok.Singular;
import lombok.With;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Configuración completa de un ciclo de forzamiento de contorno.
 * <p>
 * La carga desde disco es responsabilidad de la capa de E/S; aquí sólo se
 * normalizan valores por defecto y se validan los campos obligatorios.
 *
 * @param referenceDate      Fecha de referencia del ciclo (hoy si no se indica).
 * @param timeOrigin         Origen de la escala temporal del modelo ("days since", formato yyyyMMdd).
 * @param daysBack           Días de análisis anteriores a la fecha de referencia.
 * @param daysAhead          Días de predicción posteriores a la fecha de referencia.
 * @param masterVariable     Variable cuyo eje temporal define el eje maestro.
 * @param openBoundaries     Contornos abiertos en orden S E N W (p. ej. "1111").
 * @param verticalCoordinate Parámetros de la coordenada s.
 * @param variables          Opciones por variable. Sólo se procesan las habilitadas.
 * @param validRanges        Rangos válidos que sustituyen a los de {@link VariableKind}.
 * @param biogeochemistry    Activa las variables biogeoquímicas (PISCES).
 * @param workerCount        Hilos para procesar pasos de tiempo en paralelo (1 = secuencial).
 * @param landFillValue      Valor con el que el escritor rellena las celdas de tierra.
 */
@Builder(toBuilder = true)
@With
public record ForcingConfig(
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyyMMdd")
        LocalDate referenceDate,
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyyMMdd")
        LocalDate timeOrigin,
        int daysBack,
        int daysAhead,
        VariableKind masterVariable,
        String openBoundaries,
        VerticalCoordinateConfig verticalCoordinate,
        @Singular("variable") Map<VariableKind, VariableSettings> variables,
        @Singular("validRange") Map<VariableKind, ValidRange> validRanges,
        boolean biogeochemistry,
        Integer workerCount,
        Double landFillValue
) {
    public static final double DEFAULT_LAND_FILL_VALUE = -999.9;

    public ForcingConfig {
        if (timeOrigin == null) {
            throw new ForcingConfigurationException("offset", "El origen temporal del modelo es obligatorio.");
        }
        if (masterVariable == null) {
            throw new ForcingConfigurationException("master", "La variable maestra es obligatoria.");
        }
        if (verticalCoordinate == null) {
            throw new ForcingConfigurationException("N", "Falta la configuración de la coordenada vertical.");
        }
        if (daysBack < 0 || daysAhead < 0) {
            throw new ForcingConfigurationException("days-back/days-ahead", "Los días del ciclo no pueden ser negativos.");
        }
        if (referenceDate == null) {
            referenceDate = LocalDate.now();
        }
        if (openBoundaries == null) {
            openBoundaries = "1111";
        }
        variables = Collections.unmodifiableMap(variables == null || variables.isEmpty()
                ? new EnumMap<>(VariableKind.class) : new EnumMap<>(variables));
        validRanges = Collections.unmodifiableMap(validRanges == null || validRanges.isEmpty()
                ? new EnumMap<>(VariableKind.class) : new EnumMap<>(validRanges));
        if (workerCount == null || workerCount < 1) {
            workerCount = 1;
        }
        if (landFillValue == null) {
            landFillValue = DEFAULT_LAND_FILL_VALUE;
        }
    }

    /**
     * Indica si la variable se procesa en este ciclo. Las biogeoquímicas requieren
     * además que la biogeoquímica esté activada.
     */
    public boolean isEnabled(VariableKind kind) {
        VariableSettings s = variables.get(kind);
        if (s == null || !s.enabled()) return false;
        return !kind.isBiogeochemical() || biogeochemistry;
    }

    public VariableSettings settingsOf(VariableKind kind) {
        VariableSettings s = variables.get(kind);
        if (s == null) {
            throw new ForcingConfigurationException(kind.code(), "Variable sin configuración.");
        }
        return s;
    }

    /**
     * Configuración de referencia para pruebas: malla con los cuatro contornos abiertos,
     * transformación 2008 y temperatura, salinidad y nivel del mar habilitados.
     */
    public static ForcingConfig getTestingConfig() {
        return ForcingConfig.builder()
                .referenceDate(LocalDate.of(2024, 3, 10))
                .timeOrigin(LocalDate.of(2000, 1, 1))
                .daysBack(1)
                .daysAhead(3)
                .masterVariable(VariableKind.TEMP)
                .openBoundaries("1111")
                .verticalCoordinate(VerticalCoordinateConfig.builder()
                        .transform(VerticalTransform.NEW_2008)
                        .thetaS(5.0)
                        .thetaB(0.4)
                        .levels(3)
                        .criticalDepth(10.0)
                        .build())
                .variable(VariableKind.TEMP, VariableSettings.enabledDefault())
                .variable(VariableKind.SALT, VariableSettings.enabledDefault())
                .variable(VariableKind.ZETA, VariableSettings.enabledDefault())
                .workerCount(1)
                .build();
    }
}
