package crocoforcing.io;

import crocoforcing.domain.boundary.BoundarySlice;
import crocoforcing.domain.boundary.ColumnStatus;
import crocoforcing.domain.boundary.VerticalGridHeader;
import crocoforcing.domain.source.VariableDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Volcado de diagnóstico: un documento JSON por variable y contorno en {@code <dir>/<var>_<lado>.json}.
 * Las celdas de tierra o pendientes se escriben con el valor de relleno configurado.
 */
@Slf4j
public class JsonBoundarySliceWriter implements BoundarySliceWriter {

    private final Path directory;
    private final double fillValue;
    private final VerticalGridHeader header;
    private final JsonFileHandler jsonFileHandler;

    public JsonBoundarySliceWriter(Path directory, double fillValue, VerticalGridHeader header) {
        this(directory, fillValue, header, new JsonFileHandler());
    }

    public JsonBoundarySliceWriter(Path directory, double fillValue, VerticalGridHeader header,
                                   JsonFileHandler jsonFileHandler) {
        this.directory = directory;
        this.fillValue = fillValue;
        this.header = header;
        this.jsonFileHandler = jsonFileHandler;
    }

    public Path targetOf(BoundarySlice slice) {
        return directory.resolve(slice.getKind().code() + "_" + slice.getSide().suffix() + ".json");
    }

    @Override
    public void write(VariableDescriptor descriptor, BoundarySlice slice) throws IOException {
        SliceDocument document = new SliceDocument(
                slice.getKind().code(),
                slice.getSide().suffix(),
                descriptor.gridPointType().suffix(),
                descriptor.offset(),
                descriptor.factor(),
                fillValue,
                slice.time(),
                slice.statuses(),
                slice.filled(fillValue),
                header);
        Path target = targetOf(slice);
        jsonFileHandler.writeToFile(document, target);
        log.info("Corte {} escrito en {}", slice, target);
    }

    /**
     * Forma serializada de un corte.
     */
    public record SliceDocument(
            String variable,
            String side,
            String gridPoint,
            double offset,
            double factor,
            double fillValue,
            double[] time,
            ColumnStatus[] status,
            double[][][] values,
            VerticalGridHeader header
    ) {
    }
}
