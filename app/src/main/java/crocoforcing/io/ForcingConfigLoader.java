package crocoforcing.io;

import crocoforcing.config.ForcingConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Carga la configuración del ciclo de forzamiento desde JSON.
 * <p>
 * Los campos omitidos toman los valores por defecto de {@link ForcingConfig}; los errores de
 * validación de los registros llegan envueltos por Jackson como {@link IOException}.
 */
@Slf4j
@RequiredArgsConstructor
public class ForcingConfigLoader {

    private final JsonFileHandler jsonFileHandler;

    public ForcingConfigLoader() {
        this(new JsonFileHandler());
    }

    public ForcingConfig load(Path path) throws IOException {
        ForcingConfig config = jsonFileHandler.readFromFile(path, ForcingConfig.class);
        log.info("Configuración cargada: referencia {}, maestra {}, contornos {}",
                config.referenceDate(), config.masterVariable().code(), config.openBoundaries());
        return config;
    }

    public ForcingConfig loadResource(String resource) throws IOException {
        try (InputStream in = ForcingConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Recurso de configuración no encontrado: " + resource);
            }
            return jsonFileHandler.readFromStream(in, ForcingConfig.class);
        }
    }
}
