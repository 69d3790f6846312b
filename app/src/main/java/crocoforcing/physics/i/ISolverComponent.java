package crocoforcing.physics.i;

/**
 * Contrato base para cualquier componente numérico del pipeline.
 * Permite tratar a todos los componentes de forma polimórfica para tareas
 * de logging, identificación y depuración.
 */
public interface ISolverComponent {
    /**
     * Nombre corto del algoritmo (ej: "Bilinear", "NearestValid").
     */
    String getName();

    /**
     * Descripción técnica detallada.
     */
    default String getDescription() {
        return "Sin descripción disponible.";
    }
}
