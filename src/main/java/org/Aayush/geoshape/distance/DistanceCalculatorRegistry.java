package org.Aayush.geoshape.distance;

import org.Aayush.geoshape.exception.InvalidSpatialArgumentException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable distance-calculator registry keyed by calculator id.
 *
 * <p>Lookups are case-insensitive, matching how configuration values are written.</p>
 */
public final class DistanceCalculatorRegistry {
    private final Map<String, DistanceCalculator> calculatorById;

    /**
     * Creates a registry with the built-in calculators.
     */
    public DistanceCalculatorRegistry() {
        this(List.of());
    }

    /**
     * Creates a registry by merging built-ins with custom calculators.
     *
     * <p>Custom calculator ids override built-ins when ids collide.</p>
     */
    public DistanceCalculatorRegistry(Collection<? extends DistanceCalculator> customCalculators) {
        LinkedHashMap<String, DistanceCalculator> merged = new LinkedHashMap<>();
        for (DistanceCalculator calculator : defaultCalculators()) {
            merged.put(normalizeId(calculator.id()), calculator);
        }
        if (customCalculators != null) {
            for (DistanceCalculator calculator : customCalculators) {
                DistanceCalculator nonNull = Objects.requireNonNull(calculator, "calculator");
                merged.put(normalizeId(nonNull.id()), nonNull);
            }
        }
        this.calculatorById = Map.copyOf(merged);
    }

    /**
     * Resolves a calculator by id, or null when missing.
     */
    public DistanceCalculator calculator(String calculatorId) {
        if (calculatorId == null || calculatorId.isBlank()) {
            return null;
        }
        return calculatorById.get(normalizeId(calculatorId));
    }

    /**
     * Resolves a calculator by id, failing when it is not registered.
     */
    public DistanceCalculator require(String calculatorId) {
        DistanceCalculator calculator = calculator(calculatorId);
        if (calculator == null) {
            throw new InvalidSpatialArgumentException(
                    InvalidSpatialArgumentException.REASON_UNKNOWN_CALCULATOR,
                    "unknown distance calculator: " + calculatorId
            );
        }
        return calculator;
    }

    /**
     * Returns immutable set of registered (lower-cased) calculator ids.
     */
    public Set<String> calculatorIds() {
        return calculatorById.keySet();
    }

    /**
     * Returns a registry holding only the built-ins.
     */
    public static DistanceCalculatorRegistry defaultRegistry() {
        return new DistanceCalculatorRegistry();
    }

    private static List<DistanceCalculator> defaultCalculators() {
        return List.of(
                new GeodesicSphereDistanceCalculator.Haversine(),
                new GeodesicSphereDistanceCalculator.LawOfCosines(),
                new GeodesicSphereDistanceCalculator.Vincenty(),
                new CartesianDistanceCalculator(false),
                new CartesianDistanceCalculator(true)
        );
    }

    private static String normalizeId(String id) {
        String normalized = Objects.requireNonNull(id, "id").trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("calculator id must be non-blank");
        }
        return normalized.toLowerCase(Locale.ROOT);
    }
}
