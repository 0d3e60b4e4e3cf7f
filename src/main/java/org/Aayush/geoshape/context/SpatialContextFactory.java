package org.Aayush.geoshape.context;

import org.Aayush.geoshape.distance.DistanceCalculatorRegistry;
import org.Aayush.geoshape.exception.InvalidSpatialArgumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds a {@link SpatialContext} from string key/value configuration.
 *
 * <p>Recognized keys: {@code geo}, {@code distCalculator}, {@code worldBounds},
 * {@code normWrapLongitude}, {@code precisionModel}, {@code precisionScale} and
 * {@code allowMultiOverlap}. Absent keys keep the {@link SpatialContextConfig} defaults;
 * unknown keys are logged and ignored.</p>
 */
public final class SpatialContextFactory {
    private static final Logger LOG = LoggerFactory.getLogger(SpatialContextFactory.class);

    public static final String KEY_GEO = "geo";
    public static final String KEY_DIST_CALCULATOR = "distCalculator";
    public static final String KEY_WORLD_BOUNDS = "worldBounds";
    public static final String KEY_NORM_WRAP_LONGITUDE = "normWrapLongitude";
    public static final String KEY_PRECISION_MODEL = "precisionModel";
    public static final String KEY_PRECISION_SCALE = "precisionScale";
    public static final String KEY_ALLOW_MULTI_OVERLAP = "allowMultiOverlap";

    public static final String PRECISION_FLOATING = "floating";
    public static final String PRECISION_FIXED = "fixed";

    private static final Set<String> KNOWN_KEYS = Set.of(
            KEY_GEO,
            KEY_DIST_CALCULATOR,
            KEY_WORLD_BOUNDS,
            KEY_NORM_WRAP_LONGITUDE,
            KEY_PRECISION_MODEL,
            KEY_PRECISION_SCALE,
            KEY_ALLOW_MULTI_OVERLAP
    );

    private static final String ENVELOPE_PREFIX = "ENVELOPE";

    private final DistanceCalculatorRegistry calculatorRegistry;

    /**
     * Creates a factory resolving only the built-in distance calculators.
     */
    public SpatialContextFactory() {
        this(DistanceCalculatorRegistry.defaultRegistry());
    }

    /**
     * Creates a factory resolving {@code distCalculator} ids against a custom registry.
     */
    public SpatialContextFactory(DistanceCalculatorRegistry calculatorRegistry) {
        this.calculatorRegistry = Objects.requireNonNull(calculatorRegistry, "calculatorRegistry");
    }

    /**
     * Builds a context with the built-in calculators.
     */
    public static SpatialContext makeSpatialContext(Map<String, String> args) {
        return new SpatialContextFactory().newSpatialContext(args);
    }

    /**
     * Builds a context from configuration values.
     *
     * @throws InvalidSpatialArgumentException when a value is malformed.
     */
    public SpatialContext newSpatialContext(Map<String, String> args) {
        return new SpatialContext(readConfig(args));
    }

    /**
     * Parses configuration values into a startup config without building the context.
     *
     * @throws InvalidSpatialArgumentException when a value is malformed.
     */
    public SpatialContextConfig readConfig(Map<String, String> args) {
        Objects.requireNonNull(args, "args");
        for (String key : args.keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                LOG.warn("Ignoring unknown spatial context key {}", key);
            }
        }

        SpatialContextConfig.SpatialContextConfigBuilder builder = SpatialContextConfig.builder();
        String geo = args.get(KEY_GEO);
        if (geo != null) {
            builder.geo(parseBoolean(KEY_GEO, geo));
        }
        String calculator = args.get(KEY_DIST_CALCULATOR);
        if (calculator != null) {
            builder.distanceCalculator(calculatorRegistry.require(calculator.trim()));
        }
        String worldBounds = args.get(KEY_WORLD_BOUNDS);
        if (worldBounds != null) {
            builder.worldBounds(parseWorldBounds(worldBounds));
        }
        String wrap = args.get(KEY_NORM_WRAP_LONGITUDE);
        if (wrap != null) {
            builder.normWrapLongitude(parseBoolean(KEY_NORM_WRAP_LONGITUDE, wrap));
        }
        builder.precisionScale(parsePrecision(args.get(KEY_PRECISION_MODEL), args.get(KEY_PRECISION_SCALE)));
        String overlap = args.get(KEY_ALLOW_MULTI_OVERLAP);
        if (overlap != null) {
            builder.allowMultiOverlap(parseBoolean(KEY_ALLOW_MULTI_OVERLAP, overlap));
        }

        SpatialContextConfig config = builder.build();
        LOG.debug("Resolved spatial context config {}", config);
        return config;
    }

    /**
     * Parses {@code ENVELOPE(minX, maxX, maxY, minY)} or {@code minX,maxX,minY,maxY}.
     */
    static SpatialContextConfig.WorldBounds parseWorldBounds(String value) {
        String trimmed = value.trim();
        boolean envelope = trimmed.toUpperCase(Locale.ROOT).startsWith(ENVELOPE_PREFIX);
        String body = trimmed;
        if (envelope) {
            int open = trimmed.indexOf('(');
            int close = trimmed.lastIndexOf(')');
            if (open < 0 || close < open) {
                throw badValue(KEY_WORLD_BOUNDS, value, null);
            }
            body = trimmed.substring(open + 1, close);
        }
        String[] parts = body.split(",");
        if (parts.length != 4) {
            throw badValue(KEY_WORLD_BOUNDS, value, null);
        }
        double[] numbers = new double[4];
        for (int i = 0; i < parts.length; i++) {
            numbers[i] = parseDouble(KEY_WORLD_BOUNDS, parts[i]);
        }
        if (envelope) {
            return new SpatialContextConfig.WorldBounds(numbers[0], numbers[1], numbers[3], numbers[2]);
        }
        return new SpatialContextConfig.WorldBounds(numbers[0], numbers[1], numbers[2], numbers[3]);
    }

    private static Double parsePrecision(String model, String scale) {
        String normalizedModel = model == null ? null : model.trim().toLowerCase(Locale.ROOT);
        if (normalizedModel == null) {
            // a bare scale implies the fixed model
            return scale == null ? null : parseDouble(KEY_PRECISION_SCALE, scale);
        }
        switch (normalizedModel) {
            case PRECISION_FLOATING:
                if (scale != null) {
                    LOG.warn("Ignoring {}={} for the floating precision model", KEY_PRECISION_SCALE, scale);
                }
                return null;
            case PRECISION_FIXED:
                if (scale == null) {
                    throw new InvalidSpatialArgumentException(
                            InvalidSpatialArgumentException.REASON_BAD_CONFIG_VALUE,
                            "precisionModel=fixed requires " + KEY_PRECISION_SCALE
                    );
                }
                return parseDouble(KEY_PRECISION_SCALE, scale);
            default:
                throw badValue(KEY_PRECISION_MODEL, model, null);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("true".equals(normalized)) {
            return true;
        }
        if ("false".equals(normalized)) {
            return false;
        }
        throw badValue(key, value, null);
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw badValue(key, value, e);
        }
    }

    private static InvalidSpatialArgumentException badValue(String key, String value, Throwable cause) {
        String message = "bad value for " + key + ": " + value;
        if (cause == null) {
            return new InvalidSpatialArgumentException(InvalidSpatialArgumentException.REASON_BAD_CONFIG_VALUE, message);
        }
        return new InvalidSpatialArgumentException(InvalidSpatialArgumentException.REASON_BAD_CONFIG_VALUE, message, cause);
    }
}
