package de.jwiegmann.scraper.entity;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Einheitliche Zahlendarstellung im Result-Payload über Store- und Wire-Grenzen hinweg:
 * ganzzahlige Werte als {@link Long}, alle anderen als {@link BigDecimal}.
 */
public final class PayloadNumbers {

    private PayloadNumbers() {
    }

    public static Map<String, Object> normalize(Map<String, Object> payload) {
        if (payload == null) {
            return null;
        }
        Map<String, Object> normalized = new LinkedHashMap<>();
        payload.forEach((key, value) -> normalized.put(key, normalize(value)));
        return normalized;
    }

    public static Object normalize(Object value) {
        if (!(value instanceof Number)) {
            return value;
        }
        if (value instanceof Long) {
            return value;
        }
        Number number = (Number) value;
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return number.longValue();
        }
        if ((value instanceof Double || value instanceof Float) && !Double.isFinite(number.doubleValue())) {
            return value;
        }
        BigDecimal decimal = toBigDecimal(number);
        if (decimal.signum() == 0 || decimal.stripTrailingZeros().scale() <= 0) {
            try {
                return decimal.longValueExact();
            } catch (ArithmeticException e) {
                // außerhalb des long-Bereichs bleibt der exakte Dezimalwert erhalten
                return decimal;
            }
        }
        return decimal;
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (number instanceof BigInteger) {
            return new BigDecimal((BigInteger) number);
        }
        return new BigDecimal(number.toString());
    }
}
