package crocoforcing.domain.boundary;

import lombok.Builder;

/**
 * Valores de la rejilla vertical que el escritor coloca en la cabecera del fichero de contorno.
 *
 * @param vtransform Código Vtransform (1 = old1994, 2 = new2008).
 * @param tcline     Anchura de la capa superficial/fondo; coincide con hc.
 * @param scR        σ en puntos rho (N).
 * @param scW        σ en puntos w (N+1).
 * @param csR        Curva de estiramiento en puntos rho.
 * @param csW        Curva de estiramiento en puntos w.
 * @param tstart     Primer día del eje maestro.
 * @param tend       Último día del eje maestro.
 */
@Builder
public record VerticalGridHeader(
        int vtransform,
        int vstretching,
        double thetaS,
        double thetaB,
        double hc,
        double tcline,
        double[] scR,
        double[] scW,
        float[] csR,
        float[] csW,
        double tstart,
        double tend
) {
}
