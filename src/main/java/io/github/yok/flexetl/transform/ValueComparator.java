package io.github.yok.flexetl.transform;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.chrono.ChronoLocalDate;
import java.time.chrono.ChronoLocalDateTime;
import java.util.Comparator;
import java.util.List;

/**
 * Total order over cell values, used to sort group keys and to pick minima and maxima.
 *
 * <ul>
 * <li>Missing values sort last.</li>
 * <li>Numbers compare by their exact value regardless of their class; {@code NaN} sorts after
 * every other number.</li>
 * <li>Strings, booleans, dates and date-times of the same kind compare naturally.</li>
 * <li>Anything else compares by class name, then by text.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
final class ValueComparator implements Comparator<Object> {

    static final ValueComparator INSTANCE = new ValueComparator();

    // Lexicographic order over composite keys of equal length
    static final Comparator<List<Object>> KEY_ORDER = (a, b) -> {
        for (int i = 0; i < a.size(); i++) {
            int cmp = INSTANCE.compare(a.get(i), b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    };

    private ValueComparator() {}

    @Override
    public int compare(Object a, Object b) {
        if (a == null || b == null) {
            if (a == b) {
                return 0;
            }
            return a == null ? 1 : -1;
        }
        if (a instanceof Number && b instanceof Number) {
            return compareNumbers((Number) a, (Number) b);
        }
        if (a instanceof String && b instanceof String) {
            return ((String) a).compareTo((String) b);
        }
        if (a instanceof Boolean && b instanceof Boolean) {
            return ((Boolean) a).compareTo((Boolean) b);
        }
        if (a instanceof ChronoLocalDate && b instanceof ChronoLocalDate) {
            return ((ChronoLocalDate) a).compareTo((ChronoLocalDate) b);
        }
        if (a instanceof ChronoLocalDateTime && b instanceof ChronoLocalDateTime) {
            return ((ChronoLocalDateTime<?>) a).compareTo((ChronoLocalDateTime<?>) b);
        }
        int byClass = a.getClass().getName().compareTo(b.getClass().getName());
        return byClass != 0 ? byClass : a.toString().compareTo(b.toString());
    }

    private static int compareNumbers(Number a, Number b) {
        if (isIntegral(a) && isIntegral(b)) {
            return Long.compare(a.longValue(), b.longValue());
        }
        if (isFloating(a) && isFloating(b)) {
            double x = a.doubleValue();
            double y = b.doubleValue();
            // -0.0 and 0.0 are one key
            return x == y ? 0 : Double.compare(x, y);
        }
        if (!isFinite(a) || !isFinite(b)) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        return toBigDecimal(a).compareTo(toBigDecimal(b));
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short
                || n instanceof Byte;
    }

    private static boolean isFloating(Number n) {
        return n instanceof Double || n instanceof Float;
    }

    private static boolean isFinite(Number n) {
        return !isFloating(n) || Double.isFinite(n.doubleValue());
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal) {
            return (BigDecimal) n;
        }
        if (n instanceof BigInteger) {
            return new BigDecimal((BigInteger) n);
        }
        if (isIntegral(n)) {
            return BigDecimal.valueOf(n.longValue());
        }
        if (isFloating(n)) {
            // exact binary value
            return new BigDecimal(n.doubleValue());
        }
        try {
            return new BigDecimal(n.toString());
        } catch (NumberFormatException e) {
            return new BigDecimal(n.doubleValue());
        }
    }
}
