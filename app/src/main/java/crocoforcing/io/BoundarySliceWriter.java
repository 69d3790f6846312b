package crocoforcing.io;

import crocoforcing.domain.boundary.BoundarySlice;
import crocoforcing.domain.source.VariableDescriptor;

import java.io.IOException;

/**
 * Destino de los cortes de contorno ya terminados (fichero de contorno, volcado de diagnóstico...).
 */
@FunctionalInterface
public interface BoundarySliceWriter {
    void write(VariableDescriptor descriptor, BoundarySlice slice) throws IOException;
}
