package crocoforcing.physics.i;

import crocoforcing.domain.boundary.BoundarySlice;
import crocoforcing.domain.time.MasterTimeAxis;

public interface ITemporalResampler extends ISolverComponent {
    /**
     * Interpola un corte de contorno desde su eje temporal nativo al eje maestro,
     * de forma independiente para cada índice y nivel.
     */
    BoundarySlice resample(BoundarySlice slice, MasterTimeAxis master);
}
