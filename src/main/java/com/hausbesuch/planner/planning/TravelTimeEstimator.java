package com.hausbesuch.planner.planning;

import com.hausbesuch.planner.util.GeoDistanceUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts straight-line hop distances into driving minutes.
 * <p>
 * Every hop costs {@code round(km * detourFactor / speedKmh * 60)}, plus an optional fixed
 * {@code perHopBufferMinutes} that is 0 unless configured. The same constants apply to every hop
 * of a run.
 */
@Component
public class TravelTimeEstimator {

    private final double speedKmh;
    private final double detourFactor;
    private final int perHopBufferMinutes;

    public TravelTimeEstimator(@Value("${planner.travel.speed-kmh:30}") double speedKmh,
                               @Value("${planner.travel.detour-factor:1.3}") double detourFactor,
                               @Value("${planner.travel.per-hop-buffer-minutes:0}") int perHopBufferMinutes) {
        if (speedKmh <= 0) {
            throw new IllegalArgumentException("planner.travel.speed-kmh must be positive: " + speedKmh);
        }
        if (detourFactor < 1.0) {
            throw new IllegalArgumentException("planner.travel.detour-factor must be at least 1.0: " + detourFactor);
        }
        if (perHopBufferMinutes < 0) {
            throw new IllegalArgumentException("planner.travel.per-hop-buffer-minutes must not be negative: "
                    + perHopBufferMinutes);
        }
        this.speedKmh = speedKmh;
        this.detourFactor = detourFactor;
        this.perHopBufferMinutes = perHopBufferMinutes;
    }

    public int estimateHopMinutes(double distanceKm) {
        double roadKm = Math.max(0.0, distanceKm) * detourFactor;
        long minutes = Math.round(roadKm / speedKmh * 60.0);
        return (int) minutes + perHopBufferMinutes;
    }

    /**
     * Sums hop minutes along {@code points} in order. The caller supplies the full loop,
     * home first and home last; {@code null} points are skipped.
     */
    public int estimateMinutes(List<GeoPoint> points) {
        if (points == null) {
            return 0;
        }
        List<GeoPoint> stops = new ArrayList<>(points.size());
        for (GeoPoint point : points) {
            if (point != null && point.isValid()) {
                stops.add(point);
            }
        }
        int total = 0;
        for (int i = 1; i < stops.size(); i++) {
            total += estimateHopMinutes(GeoDistanceUtils.haversineKm(stops.get(i - 1), stops.get(i)));
        }
        return total;
    }

    /**
     * Minutes for the loop {@code home -> stops... -> home}. A route without any located stop
     * costs nothing.
     */
    public int estimateLoopMinutes(GeoPoint home, List<GeoPoint> stops) {
        List<GeoPoint> located = new ArrayList<>();
        if (stops != null) {
            for (GeoPoint stop : stops) {
                if (stop != null && stop.isValid()) {
                    located.add(stop);
                }
            }
        }
        if (located.isEmpty() || home == null || !home.isValid()) {
            return 0;
        }
        List<GeoPoint> loop = new ArrayList<>(located.size() + 2);
        loop.add(home);
        loop.addAll(located);
        loop.add(home);
        return estimateMinutes(loop);
    }
}
