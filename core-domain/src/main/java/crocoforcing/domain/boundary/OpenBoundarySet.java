package crocoforcing.domain.boundary;

import crocoforcing.config.ForcingConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Contornos abiertos del dominio. Se deriva una vez de la configuración.
 */
public record OpenBoundarySet(boolean south, boolean east, boolean north, boolean west) {

    /**
     * Interpreta la cadena de cuatro dígitos en orden Sur, Este, Norte, Oeste (p. ej. "1011").
     */
    public static OpenBoundarySet fromFlags(String flags) {
        if (flags == null || !flags.trim().matches("[01]{4}")) {
            throw new ForcingConfigurationException("obc",
                    "Se esperan cuatro dígitos 0/1 en orden S E N W, recibido: '" + flags + "'");
        }
        String f = flags.trim();
        return new OpenBoundarySet(f.charAt(0) == '1', f.charAt(1) == '1', f.charAt(2) == '1', f.charAt(3) == '1');
    }

    public boolean isOpen(BoundarySide side) {
        return switch (side) {
            case SOUTH -> south;
            case EAST -> east;
            case NORTH -> north;
            case WEST -> west;
        };
    }

    /**
     * Lados abiertos en el orden canónico S, E, N, W.
     */
    public List<BoundarySide> activeSides() {
        List<BoundarySide> sides = new ArrayList<>(4);
        for (BoundarySide side : BoundarySide.values()) {
            if (isOpen(side)) sides.add(side);
        }
        return Collections.unmodifiableList(sides);
    }
}
