package crocoforcing.domain.grid;

/**
 * Posición vertical: centro de la capa (rho, N niveles) o interfaz (w, N+1 niveles).
 */
public enum VerticalPointType {
    RHO,
    W
}
