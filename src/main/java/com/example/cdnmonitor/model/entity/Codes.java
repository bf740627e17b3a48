package com.example.cdnmonitor.model.entity;

import java.util.Locale;
import java.util.function.Function;

/**
 * Resuelve enums a partir de su codigo de API ("load-balancer", "srs", ...) o de su nombre.
 */
final class Codes {

    private Codes() {
    }

    static <E extends Enum<E>> E resolve(E[] values, String raw, Function<E, String> code) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String wanted = raw.trim();
        for (E value : values) {
            if (code.apply(value).equalsIgnoreCase(wanted) || value.name().equalsIgnoreCase(wanted)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Valor no soportado: " + raw.toLowerCase(Locale.ROOT));
    }
}
