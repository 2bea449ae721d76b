package com.hausbesuch.planner.util;

import com.hausbesuch.planner.planning.GeoPoint;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GeoDistanceUtilsTest {

    @Test
    void distanceToSamePointIsZero() {
        GeoPoint point = new GeoPoint(49.79245, 9.93296);
        assertEquals(0.0, GeoDistanceUtils.haversineKm(point, point), 1e-9);
    }

    @Test
    void oneDegreeOfLatitudeIsAboutOneHundredElevenKilometres() {
        double km = GeoDistanceUtils.haversineKm(new GeoPoint(50.0, 10.0), new GeoPoint(51.0, 10.0));
        assertEquals(111.195, km, 0.01);
    }

    @Test
    void distanceIsSymmetric() {
        GeoPoint wuerzburg = new GeoPoint(49.79245, 9.93296);
        GeoPoint schweinfurt = new GeoPoint(50.0492, 10.2194);
        assertEquals(GeoDistanceUtils.haversineKm(wuerzburg, schweinfurt),
                GeoDistanceUtils.haversineKm(schweinfurt, wuerzburg), 1e-9);
        assertEquals(35.5, GeoDistanceUtils.haversineKm(wuerzburg, schweinfurt), 1.0);
    }

    @Test
    void missingPointIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> GeoDistanceUtils.haversineKm(null, new GeoPoint(0, 0)));
    }
}
