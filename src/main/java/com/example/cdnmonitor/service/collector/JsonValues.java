package com.example.cdnmonitor.service.collector;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Lectura defensiva de numeros en JSON de terceros: SRS mezcla numeros y cadenas numericas.
 */
final class JsonValues {

    private JsonValues() {
    }

    static boolean present(JsonNode node) {
        return node != null && !node.isMissingNode() && !node.isNull();
    }

    /**
     * @throws NumberFormatException si el valor existe pero no es numerico
     */
    static double decimal(JsonNode node) {
        if (node.isNumber()) return node.doubleValue();
        if (node.isTextual()) return Double.parseDouble(node.textValue().trim());
        throw new NumberFormatException("No es un numero: " + node);
    }

    /**
     * @throws NumberFormatException si el valor existe pero no es entero
     */
    static long integer(JsonNode node) {
        if (node.isIntegralNumber()) return node.longValue();
        if (node.isNumber()) return (long) node.doubleValue();
        if (node.isTextual()) return new java.math.BigDecimal(node.textValue().trim()).longValue();
        throw new NumberFormatException("No es un entero: " + node);
    }

    static Double optionalDecimal(JsonNode node) {
        if (!present(node)) return null;
        try {
            return decimal(node);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    static Integer optionalInt(JsonNode node) {
        if (!present(node)) return null;
        try {
            return Math.toIntExact(integer(node));
        } catch (NumberFormatException | ArithmeticException ex) {
            return null;
        }
    }
}
