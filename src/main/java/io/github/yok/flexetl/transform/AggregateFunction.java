package io.github.yok.flexetl.transform;

import io.github.yok.flexetl.exception.ConfigurationException;
import io.github.yok.flexetl.exception.TransformationException;
import io.github.yok.flexetl.table.ColumnType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Aggregate functions of {@code aggregate_data}.
 *
 * <p>
 * Every function ignores missing values. {@link #SUM} of nothing is {@code 0}; {@link #MEAN},
 * {@link #MIN}, {@link #MAX}, {@link #MEDIAN}, {@link #FIRST} and {@link #LAST} of nothing are
 * missing; {@link #STD} is the sample standard deviation and is missing below two values.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public enum AggregateFunction {

    SUM {
        @Override
        Object apply(String column, ColumnType type, List<Object> values) {
            if (type == ColumnType.INT) {
                long sum = 0L;
                for (Object value : values) {
                    sum += ((Number) value).longValue();
                }
                return sum;
            }
            double sum = 0.0;
            for (double value : numbers(this, column, values)) {
                sum += value;
            }
            return sum;
        }
    },

    MEAN {
        @Override
        Object apply(String column, ColumnType type, List<Object> values) {
            List<Double> numbers = numbers(this, column, values);
            return numbers.isEmpty() ? null : mean(numbers);
        }
    },

    COUNT {
        @Override
        Object apply(String column, ColumnType type, List<Object> values) {
            return (long) values.size();
        }
    },

    MIN {
        @Override
        Object apply(String column, ColumnType type, List<Object> values) {
            return values.isEmpty() ? null : Collections.min(values, ValueComparator.INSTANCE);
        }
    },

    MAX {
        @Override
        Object apply(String column, ColumnType type, List<Object> values) {
            return values.isEmpty() ? null : Collections.max(values, ValueComparator.INSTANCE);
        }
    },

    MEDIAN {
        @Override
        Object apply(String column, ColumnType type, List<Object> values) {
            List<Double> numbers = numbers(this, column, values);
            if (numbers.isEmpty()) {
                return null;
            }
            Collections.sort(numbers);
            int mid = numbers.size() / 2;
            if (numbers.size() % 2 == 1) {
                return numbers.get(mid);
            }
            return (numbers.get(mid - 1) + numbers.get(mid)) / 2.0;
        }
    },

    STD {
        @Override
        Object apply(String column, ColumnType type, List<Object> values) {
            List<Double> numbers = numbers(this, column, values);
            if (numbers.size() < 2) {
                return null;
            }
            return sampleStdDev(numbers);
        }
    },

    FIRST {
        @Override
        Object apply(String column, ColumnType type, List<Object> values) {
            return values.isEmpty() ? null : values.get(0);
        }
    },

    LAST {
        @Override
        Object apply(String column, ColumnType type, List<Object> values) {
            return values.isEmpty() ? null : values.get(values.size() - 1);
        }
    },

    NUNIQUE {
        @Override
        Object apply(String column, ColumnType type, List<Object> values) {
            return (long) new HashSet<>(values).size();
        }
    };

    /**
     * Computes the aggregate of one group.
     *
     * @param column source column name (for error messages)
     * @param type source column type
     * @param values non-missing values of the group, in row order
     * @return aggregate value, {@code null} when undefined
     * @throws TransformationException if a numeric function meets a non-numeric value
     */
    abstract Object apply(String column, ColumnType type, List<Object> values);

    /**
     * Returns the name used in aggregate specifications, e.g. {@code mean}.
     *
     * @return lowercase name
     */
    public String getConfigName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a function from its name.
     *
     * @param name function name (case-insensitive)
     * @return the function
     * @throws ConfigurationException if the name is unknown
     */
    public static AggregateFunction fromName(String name) {
        for (AggregateFunction function : values()) {
            if (function.getConfigName().equalsIgnoreCase(name == null ? "" : name.trim())) {
                return function;
            }
        }
        throw new ConfigurationException("aggregate_data: unknown aggregate function: " + name
                + ". Supported: " + Arrays.stream(values()).map(AggregateFunction::getConfigName)
                        .collect(Collectors.joining(", ")));
    }

    static double mean(List<Double> numbers) {
        double sum = 0.0;
        for (double value : numbers) {
            sum += value;
        }
        return sum / numbers.size();
    }

    static double sampleStdDev(List<Double> numbers) {
        double mean = mean(numbers);
        double squares = 0.0;
        for (double value : numbers) {
            squares += (value - mean) * (value - mean);
        }
        return Math.sqrt(squares / (numbers.size() - 1));
    }

    private static List<Double> numbers(AggregateFunction function, String column,
            List<Object> values) {
        List<Double> numbers = new ArrayList<>(values.size());
        for (Object value : values) {
            if (!(value instanceof Number)) {
                throw new TransformationException("aggregate_data: " + function.getConfigName()
                        + " needs numeric values but column " + column + " holds " + value);
            }
            numbers.add(((Number) value).doubleValue());
        }
        return numbers;
    }
}
