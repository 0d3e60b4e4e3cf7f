package org.Aayush.geoshape.distance;

import org.Aayush.geoshape.context.SpatialContext;
import org.Aayush.geoshape.exception.InvalidSpatialArgumentException;
import org.Aayush.geoshape.shape.Rectangle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("DistanceUtils Tests")
class DistanceUtilsTest {

    private static final double EPS = 1e-9d;

    @ParameterizedTest
    @CsvSource({
            "0, 0",
            "180, 180",
            "-180, -180",
            "190, -170",
            "-190, 170",
            "360, 0",
            "540, 180",
            "-540, -180",
            "725, 5"
    })
    @DisplayName("Longitude wraps into [-180, 180]")
    void testNormLonDEG(double input, double expected) {
        assertEquals(expected, DistanceUtils.normLonDEG(input), EPS);
    }

    @ParameterizedTest
    @CsvSource({
            "45, 45",
            "90, 90",
            "100, 80",
            "-100, -80",
            "180, 0"
    })
    @DisplayName("Latitude reflects over the poles")
    void testNormLatDEG(double input, double expected) {
        assertEquals(expected, DistanceUtils.normLatDEG(input), EPS);
    }

    @Test
    @DisplayName("Quarter of the equator is PI/2 under every formula")
    void testQuarterEquator() {
        double quarter = Math.PI / 2.0d;
        assertEquals(quarter, DistanceUtils.distHaversineRAD(0, 0, 0, quarter), EPS);
        assertEquals(quarter, DistanceUtils.distLawOfCosinesRAD(0, 0, 0, quarter), EPS);
        assertEquals(quarter, DistanceUtils.distVincentyRAD(0, 0, 0, quarter), EPS);
    }

    @Test
    @DisplayName("Antipodal points are PI apart")
    void testAntipodal() {
        assertEquals(Math.PI, DistanceUtils.distVincentyRAD(0, 0, 0, Math.PI), EPS);
        assertEquals(Math.PI, DistanceUtils.distHaversineRAD(0, 0, 0, Math.PI), EPS);
    }

    @Test
    @DisplayName("Identical coordinates have zero distance")
    void testZeroDistance() {
        assertEquals(0.0d, DistanceUtils.distHaversineRAD(0.3, 0.2, 0.3, 0.2));
        assertEquals(0.0d, DistanceUtils.distLawOfCosinesRAD(0.3, 0.2, 0.3, 0.2));
        assertEquals(0.0d, DistanceUtils.distVincentyRAD(0.3, 0.2, 0.3, 0.2));
    }

    @Test
    @DisplayName("Point on bearing due east along the equator")
    void testPointOnBearingEast() {
        double[] lonLat = DistanceUtils.pointOnBearingRAD(0, 0, DistanceUtils.toRadians(10), DistanceUtils.toRadians(90));
        assertEquals(10.0d, DistanceUtils.toDegrees(lonLat[0]), EPS);
        assertEquals(0.0d, DistanceUtils.toDegrees(lonLat[1]), EPS);
    }

    @Test
    @DisplayName("Cap bounding box on the equator is square")
    void testCalcBoxOnEquator() {
        Rectangle box = DistanceUtils.calcBoxByDistFromPtDEG(0, 0, 10, SpatialContext.GEO);
        assertEquals(-10.0d, box.minX(), EPS);
        assertEquals(10.0d, box.maxX(), EPS);
        assertEquals(-10.0d, box.minY(), EPS);
        assertEquals(10.0d, box.maxY(), EPS);
    }

    @Test
    @DisplayName("Cap crossing a pole spans all longitudes")
    void testCalcBoxCrossingPole() {
        Rectangle box = DistanceUtils.calcBoxByDistFromPtDEG(85, 20, 10, SpatialContext.GEO);
        assertEquals(-180.0d, box.minX());
        assertEquals(180.0d, box.maxX());
        assertEquals(75.0d, box.minY(), EPS);
        assertEquals(90.0d, box.maxY());
    }

    @Test
    @DisplayName("Cap touching a pole spans half the longitudes")
    void testCalcBoxTouchingPole() {
        Rectangle box = DistanceUtils.calcBoxByDistFromPtDEG(80, 0, 10, SpatialContext.GEO);
        assertEquals(-90.0d, box.minX(), EPS);
        assertEquals(90.0d, box.maxX(), EPS);
        assertEquals(90.0d, box.maxY(), EPS);
    }

    @Test
    @DisplayName("Cap of 180 degrees or more is the whole world")
    void testCalcBoxWholeWorld() {
        Rectangle box = DistanceUtils.calcBoxByDistFromPtDEG(10, 10, 180, SpatialContext.GEO);
        assertEquals(SpatialContext.GEO.worldBounds(), box);
    }

    @Test
    @DisplayName("Longitude skew grows toward the poles")
    void testLonDegreesAtLat() {
        assertEquals(1.0d, DistanceUtils.calcLonDegreesAtLat(0, 1), EPS);
        assertTrue(DistanceUtils.calcLonDegreesAtLat(60, 1) > 1.9d);
    }

    @Test
    @DisplayName("One degree of arc converts to DEG_TO_KM kilometers")
    void testDegreeConversions() {
        assertEquals(DistanceUtils.DEG_TO_KM, DistanceUtils.degrees2Dist(1, DistanceUtils.EARTH_MEAN_RADIUS_KM), EPS);
        assertEquals(1.0d, DistanceUtils.dist2Degrees(DistanceUtils.DEG_TO_KM, DistanceUtils.EARTH_MEAN_RADIUS_KM), EPS);
        assertEquals(1.0d, DistanceUnits.KILOMETERS.toDegrees(DistanceUtils.DEG_TO_KM), EPS);
        assertEquals(DistanceUtils.DEG_TO_KM, DistanceUnits.KILOMETERS.fromDegrees(1), EPS);
    }

    @Test
    @DisplayName("Distance units convert by earth radius ratio")
    void testDistanceUnitsConvert() {
        assertEquals(DistanceUtils.KM_TO_MILES, DistanceUnits.MILES.convert(1.0d, DistanceUnits.KILOMETERS), EPS);
        assertEquals(7.0d, DistanceUnits.MILES.convert(7.0d, DistanceUnits.MILES));
        assertEquals(DistanceUnits.MILES, DistanceUnits.fromSymbol(" MI "));
        assertEquals(DistanceUnits.KILOMETERS, DistanceUnits.fromSymbol("kilometers"));
        InvalidSpatialArgumentException ex = assertThrows(
                InvalidSpatialArgumentException.class,
                () -> DistanceUnits.fromSymbol("furlongs")
        );
        assertEquals(InvalidSpatialArgumentException.REASON_BAD_CONFIG_VALUE, ex.reasonCode());
    }
}
