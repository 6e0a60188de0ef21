package org.Aayush.tsp.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Read-only view over a loosely typed solver parameter map.
 *
 * <p>Every accessor applies the caller's default when a name is absent and fails fast with a
 * reason-coded {@link SolverConfigurationException} when a supplied value is present but unusable.
 * A supplied value is never silently replaced by the default.</p>
 */
public final class ParameterMap {
    public static final String REASON_UNKNOWN_PARAMETER = "TSP_UNKNOWN_PARAMETER";
    public static final String REASON_TYPE_MISMATCH = "TSP_PARAMETER_TYPE_MISMATCH";
    public static final String REASON_UNKNOWN_OPTION = "TSP_UNKNOWN_OPTION_VALUE";
    public static final String REASON_OUT_OF_RANGE = "TSP_PARAMETER_OUT_OF_RANGE";

    private final Map<String, Object> values;

    private ParameterMap(Map<String, Object> values) {
        this.values = values;
    }

    /**
     * Wraps a parameter map and rejects names that the target engine does not recognize.
     *
     * @param raw caller-supplied parameters (null is treated as empty).
     * @param recognizedNames parameter names accepted by the target engine.
     * @return validated parameter view.
     */
    public static ParameterMap of(Map<String, ?> raw, Set<String> recognizedNames) {
        Objects.requireNonNull(recognizedNames, "recognizedNames");
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>();
        if (raw != null) {
            for (Map.Entry<String, ?> entry : raw.entrySet()) {
                String name = Objects.requireNonNull(entry.getKey(), "parameter name");
                if (!recognizedNames.contains(name)) {
                    throw new SolverConfigurationException(
                            REASON_UNKNOWN_PARAMETER,
                            "unrecognized parameter '" + name + "', expected one of " + new TreeSet<>(recognizedNames)
                    );
                }
                copy.put(name, entry.getValue());
            }
        }
        return new ParameterMap(copy);
    }

    /**
     * Returns true when the caller supplied a non-null value for the name.
     */
    public boolean contains(String name) {
        return values.get(name) != null;
    }

    /**
     * Reads an integral parameter. Whole-valued floating numbers and numeric strings are accepted.
     */
    public int intValue(String name, int defaultValue) {
        Object value = values.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        if (value instanceof Long) {
            long longValue = (Long) value;
            if (longValue < Integer.MIN_VALUE || longValue > Integer.MAX_VALUE) {
                throw new SolverConfigurationException(
                        REASON_OUT_OF_RANGE,
                        name + " does not fit in an int: " + longValue
                );
            }
            return (int) longValue;
        }
        if (value instanceof Number) {
            double raw = ((Number) value).doubleValue();
            if (Double.isFinite(raw) && raw == Math.rint(raw) && Math.abs(raw) <= Integer.MAX_VALUE) {
                return (int) raw;
            }
            throw typeMismatch(name, "an integer", value);
        }
        if (value instanceof String) {
            String text = (String) value;
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException ex) {
                throw new SolverConfigurationException(
                        REASON_TYPE_MISMATCH,
                        name + " must be an integer, got '" + text + "'",
                        ex
                );
            }
        }
        throw typeMismatch(name, "an integer", value);
    }

    /**
     * Reads a floating-point parameter. Numeric strings are accepted.
     */
    public double doubleValue(String name, double defaultValue) {
        Object value = values.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            String text = (String) value;
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException ex) {
                throw new SolverConfigurationException(
                        REASON_TYPE_MISMATCH,
                        name + " must be a number, got '" + text + "'",
                        ex
                );
            }
        }
        throw typeMismatch(name, "a number", value);
    }

    /**
     * Reads a boolean parameter. Only {@code true}/{@code false} (any case) are accepted as strings.
     */
    public boolean booleanValue(String name, boolean defaultValue) {
        Object value = values.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            String normalized = ((String) value).trim().toLowerCase(Locale.ROOT);
            if ("true".equals(normalized)) {
                return true;
            }
            if ("false".equals(normalized)) {
                return false;
            }
        }
        throw typeMismatch(name, "a boolean", value);
    }

    /**
     * Reads an enumerated option through the supplied id parser.
     *
     * @param name parameter name.
     * @param defaultValue value used when the name is absent.
     * @param parser maps a textual id to the option, returning null for unknown ids.
     * @param <E> option type.
     * @return parsed option.
     */
    public <E extends Enum<E>> E optionValue(String name, E defaultValue, Function<String, E> parser) {
        Object value = values.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (defaultValue.getDeclaringClass().isInstance(value)) {
            return defaultValue.getDeclaringClass().cast(value);
        }
        if (!(value instanceof String)) {
            throw typeMismatch(name, "an option id", value);
        }
        String text = (String) value;
        E parsed = parser.apply(text);
        if (parsed == null) {
            throw new SolverConfigurationException(
                    REASON_UNKNOWN_OPTION,
                    "unknown " + name + " value '" + text + "'"
            );
        }
        return parsed;
    }

    /**
     * Fails unless {@code value >= min}.
     */
    public static int requireAtLeast(String name, int value, int min) {
        if (value < min) {
            throw new SolverConfigurationException(
                    REASON_OUT_OF_RANGE,
                    name + " must be >= " + min + ", got " + value
            );
        }
        return value;
    }

    /**
     * Fails unless {@code min <= value <= max} and the value is finite.
     */
    public static double requireClosedRange(String name, double value, double min, double max) {
        if (!Double.isFinite(value) || value < min || value > max) {
            throw new SolverConfigurationException(
                    REASON_OUT_OF_RANGE,
                    name + " must be finite and in [" + min + "," + max + "], got " + value
            );
        }
        return value;
    }

    /**
     * Fails unless {@code min < value < max} and the value is finite.
     */
    public static double requireOpenRange(String name, double value, double min, double max) {
        if (!Double.isFinite(value) || value <= min || value >= max) {
            throw new SolverConfigurationException(
                    REASON_OUT_OF_RANGE,
                    name + " must be finite and in (" + min + "," + max + "), got " + value
            );
        }
        return value;
    }

    /**
     * Fails unless the value is finite and strictly positive.
     */
    public static double requirePositive(String name, double value) {
        if (!Double.isFinite(value) || value <= 0.0d) {
            throw new SolverConfigurationException(
                    REASON_OUT_OF_RANGE,
                    name + " must be finite and > 0, got " + value
            );
        }
        return value;
    }

    /**
     * Fails when a required option was explicitly set to null on a builder.
     */
    public static <T> T requirePresent(String name, T value) {
        if (value == null) {
            throw new SolverConfigurationException(REASON_OUT_OF_RANGE, name + " must be set");
        }
        return value;
    }

    private static SolverConfigurationException typeMismatch(String name, String expected, Object value) {
        return new SolverConfigurationException(
                REASON_TYPE_MISMATCH,
                name + " must be " + expected + ", got " + value.getClass().getSimpleName() + " '" + value + "'"
        );
    }
}
