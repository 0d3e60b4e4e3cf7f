package org.Aayush.geoshape.geohash;

import lombok.experimental.UtilityClass;
import org.Aayush.geoshape.context.SpatialContext;
import org.Aayush.geoshape.exception.InvalidSpatialArgumentException;
import org.Aayush.geoshape.shape.Point;
import org.Aayush.geoshape.shape.Rectangle;

import java.util.Arrays;
import java.util.Objects;

/**
 * Geohash encoding and decoding.
 *
 * <p>Each character carries 5 bits taken from alternating longitude and latitude bisections,
 * longitude first. The alphabet is sorted, so sub-hashes come out in order.</p>
 */
@UtilityClass
public final class GeohashUtils {
    public static final int MAX_PRECISION = 24;
    public static final int DEFAULT_PRECISION = 12;

    private static final char[] BASE_32 = {
            '0', '1', '2', '3', '4', '5', '6', '7', '8', '9',
            'b', 'c', 'd', 'e', 'f', 'g', 'h', 'j', 'k', 'm',
            'n', 'p', 'q', 'r', 's', 't', 'u', 'v', 'w', 'x',
            'y', 'z'
    };

    /** Sparse index from {@code c - '0'} to the symbol value; -1 marks a gap. */
    private static final int[] BASE_32_INDEX = buildBase32Index();

    private static final int[] BITS = {16, 8, 4, 2, 1};

    private static final double[] HASH_LEN_TO_LAT_HEIGHT = buildSizeTable(180.0d, 4, 8);
    private static final double[] HASH_LEN_TO_LON_WIDTH = buildSizeTable(360.0d, 8, 4);

    private static int[] buildBase32Index() {
        int[] index = new int[BASE_32[BASE_32.length - 1] - BASE_32[0] + 1];
        Arrays.fill(index, -1);
        for (int i = 0; i < BASE_32.length; i++) {
            index[BASE_32[i] - BASE_32[0]] = i;
        }
        return index;
    }

    /**
     * Cell size per hash length; odd lengths divide by {@code oddDivisor}, even ones by {@code evenDivisor}.
     */
    private static double[] buildSizeTable(double worldSize, int oddDivisor, int evenDivisor) {
        double[] table = new double[MAX_PRECISION + 1];
        table[0] = worldSize;
        boolean even = false;
        for (int i = 1; i <= MAX_PRECISION; i++) {
            table[i] = table[i - 1] / (even ? evenDivisor : oddDivisor);
            even = !even;
        }
        return table;
    }

    /**
     * Encodes at {@link #DEFAULT_PRECISION} characters.
     */
    public static String encodeLatLon(double latitude, double longitude) {
        return encodeLatLon(latitude, longitude, DEFAULT_PRECISION);
    }

    /**
     * Encodes a location into a geohash of {@code precision} characters.
     *
     * @throws InvalidSpatialArgumentException when {@code precision} is outside 1..24.
     */
    public static String encodeLatLon(double latitude, double longitude, int precision) {
        requirePrecision(precision, 1);
        double latMin = -90.0d;
        double latMax = 90.0d;
        double lonMin = -180.0d;
        double lonMax = 180.0d;

        StringBuilder geohash = new StringBuilder(precision);
        boolean isEven = true;
        int bit = 0;
        int ch = 0;
        while (geohash.length() < precision) {
            if (isEven) {
                double mid = (lonMin + lonMax) / 2.0d;
                if (longitude > mid) {
                    ch |= BITS[bit];
                    lonMin = mid;
                } else {
                    lonMax = mid;
                }
            } else {
                double mid = (latMin + latMax) / 2.0d;
                if (latitude > mid) {
                    ch |= BITS[bit];
                    latMin = mid;
                } else {
                    latMax = mid;
                }
            }
            isEven = !isEven;
            if (bit < 4) {
                bit++;
            } else {
                geohash.append(BASE_32[ch]);
                bit = 0;
                ch = 0;
            }
        }
        return geohash.toString();
    }

    /**
     * Decodes a geohash to the center of its cell.
     */
    public static Point decode(String geohash, SpatialContext ctx) {
        Rectangle rect = decodeBoundary(geohash, ctx);
        double latitude = (rect.minY() + rect.maxY()) / 2.0d;
        double longitude = (rect.minX() + rect.maxX()) / 2.0d;
        return ctx.makePoint(longitude, latitude);
    }

    /**
     * Decodes a geohash to its cell. Uppercase characters are accepted.
     *
     * @throws InvalidSpatialArgumentException when a character is outside the geohash alphabet.
     */
    public static Rectangle decodeBoundary(String geohash, SpatialContext ctx) {
        Objects.requireNonNull(geohash, "geohash");
        Objects.requireNonNull(ctx, "ctx");
        double minY = -90.0d;
        double maxY = 90.0d;
        double minX = -180.0d;
        double maxX = 180.0d;
        boolean isEven = true;
        for (int i = 0; i < geohash.length(); i++) {
            int cd = symbolValue(geohash, i);
            for (int mask : BITS) {
                if (isEven) {
                    if ((cd & mask) != 0) {
                        minX = (minX + maxX) / 2.0d;
                    } else {
                        maxX = (minX + maxX) / 2.0d;
                    }
                } else {
                    if ((cd & mask) != 0) {
                        minY = (minY + maxY) / 2.0d;
                    } else {
                        maxY = (minY + maxY) / 2.0d;
                    }
                }
                isEven = !isEven;
            }
        }
        return ctx.makeRectangle(minX, maxX, minY, maxY);
    }

    /**
     * The 32 geohashes one level below {@code baseGeohash}, sorted.
     */
    public static String[] getSubGeohashes(String baseGeohash) {
        Objects.requireNonNull(baseGeohash, "baseGeohash");
        String[] hashes = new String[BASE_32.length];
        for (int i = 0; i < BASE_32.length; i++) {
            hashes[i] = baseGeohash + BASE_32[i];
        }
        return hashes;
    }

    /**
     * Cell size for a hash length as {@code {latHeight, lonWidth}} in degrees.
     */
    public static double[] lookupDegreesSizeForHashLen(int hashLen) {
        requirePrecision(hashLen, 0);
        return new double[]{HASH_LEN_TO_LAT_HEIGHT[hashLen], HASH_LEN_TO_LON_WIDTH[hashLen]};
    }

    /**
     * Shortest hash length whose cell is smaller than both errors; {@link #MAX_PRECISION} if none is.
     */
    public static int lookupHashLenForWidthHeight(double lonErr, double latErr) {
        for (int len = 1; len < MAX_PRECISION; len++) {
            if (HASH_LEN_TO_LAT_HEIGHT[len] < latErr && HASH_LEN_TO_LON_WIDTH[len] < lonErr) {
                return len;
            }
        }
        return MAX_PRECISION;
    }

    private static int symbolValue(String geohash, int pos) {
        char c = Character.toLowerCase(geohash.charAt(pos));
        int offset = c - BASE_32[0];
        if (offset >= 0 && offset < BASE_32_INDEX.length && BASE_32_INDEX[offset] >= 0) {
            return BASE_32_INDEX[offset];
        }
        throw new InvalidSpatialArgumentException(
                InvalidSpatialArgumentException.REASON_BAD_GEOHASH_CHAR,
                "invalid geohash character '" + geohash.charAt(pos) + "' at " + pos + " in " + geohash
        );
    }

    private static void requirePrecision(int precision, int min) {
        if (precision < min || precision > MAX_PRECISION) {
            throw new InvalidSpatialArgumentException(
                    InvalidSpatialArgumentException.REASON_BAD_GEOHASH_PRECISION,
                    "geohash precision must be in [" + min + ", " + MAX_PRECISION + "]: " + precision
            );
        }
    }
}
