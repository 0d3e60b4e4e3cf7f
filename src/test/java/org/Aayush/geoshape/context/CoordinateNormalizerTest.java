package org.Aayush.geoshape.context;

import org.Aayush.geoshape.exception.InvalidShapeException;
import org.Aayush.geoshape.exception.InvalidSpatialArgumentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("CoordinateNormalizer Tests")
class CoordinateNormalizerTest {

    private static CoordinateNormalizer geo() {
        return new CoordinateNormalizer(true, true, null, SpatialContextConfig.WorldBounds.GEO);
    }

    @ParameterizedTest
    @CsvSource({
            "10, 10",
            "190, -170",
            "-181, 179",
            "540, 180"
    })
    @DisplayName("Geo X wraps into the longitude range")
    void testGeoXWraps(double input, double expected) {
        assertEquals(expected, geo().normX(input), 1e-12);
    }

    @Test
    @DisplayName("Latitude overshoot within tolerance clamps to the pole")
    void testLatitudeClamp() {
        CoordinateNormalizer normalizer = geo();
        assertEquals(90.0d, normalizer.normY(90.0000001d));
        assertEquals(-90.0d, normalizer.normY(-90.0000001d));
        assertEquals(45.0d, normalizer.normY(45.0d));
        assertTrue(Double.isNaN(normalizer.normY(Double.NaN)));
    }

    @ParameterizedTest
    @ValueSource(doubles = {91.0d, -90.5d, 180.0d})
    @DisplayName("Latitude beyond the poles is rejected")
    void testLatitudeOutOfRange(double y) {
        InvalidSpatialArgumentException ex = assertThrows(
                InvalidSpatialArgumentException.class,
                () -> geo().normY(y)
        );
        assertEquals(InvalidSpatialArgumentException.REASON_LATITUDE_OUT_OF_RANGE, ex.reasonCode());
    }

    @Test
    @DisplayName("Disabled wrapping verifies X instead")
    void testNoWrapVerifies() {
        CoordinateNormalizer normalizer = new CoordinateNormalizer(true, false, null, SpatialContextConfig.WorldBounds.GEO);
        assertEquals(170.0d, normalizer.normX(170.0d));
        InvalidShapeException ex = assertThrows(InvalidShapeException.class, () -> normalizer.normX(190.0d));
        assertEquals(InvalidShapeException.REASON_X_OUT_OF_BOUNDS, ex.reasonCode());
    }

    @Test
    @DisplayName("Cartesian coordinates pass through untouched")
    void testCartesianPassThrough() {
        CoordinateNormalizer normalizer = new CoordinateNormalizer(false, true, null, SpatialContextConfig.WorldBounds.MAX);
        assertEquals(1000.0d, normalizer.normX(1000.0d));
        assertEquals(-1000.0d, normalizer.normY(-1000.0d));
        assertNull(normalizer.precisionScale());
    }

    @ParameterizedTest
    @CsvSource({
            "10, 1.26, 1.3",
            "10, -1.24, -1.2",
            "1, 2.5, 3",
            "1000, 0.12345, 0.123"
    })
    @DisplayName("Fixed precision rounds to multiples of 1/scale")
    void testPrecisionRounding(double scale, double input, double expected) {
        CoordinateNormalizer normalizer = new CoordinateNormalizer(true, true, scale, SpatialContextConfig.WorldBounds.GEO);
        assertEquals(expected, normalizer.round(input), 1e-12);
        assertEquals(expected, normalizer.normX(input), 1e-12);
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0d, -1.0d, Double.POSITIVE_INFINITY, Double.NaN})
    @DisplayName("Invalid precision scale is rejected")
    void testInvalidPrecisionScale(double scale) {
        InvalidSpatialArgumentException ex = assertThrows(
                InvalidSpatialArgumentException.class,
                () -> new CoordinateNormalizer(true, true, scale, SpatialContextConfig.WorldBounds.GEO)
        );
        assertEquals(InvalidSpatialArgumentException.REASON_BAD_CONFIG_VALUE, ex.reasonCode());
    }

    @Test
    @DisplayName("Verify methods check the world bounds")
    void testVerifyBounds() {
        CoordinateNormalizer normalizer = geo();
        assertDoesNotThrow(() -> normalizer.verifyX(-180.0d));
        assertDoesNotThrow(() -> normalizer.verifyY(90.0d));
        InvalidShapeException ex = assertThrows(InvalidShapeException.class, () -> normalizer.verifyY(-91.0d));
        assertEquals(InvalidShapeException.REASON_Y_OUT_OF_BOUNDS, ex.reasonCode());
        assertThrows(InvalidShapeException.class, () -> normalizer.verifyX(180.5d));
    }
}
