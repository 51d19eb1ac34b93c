package org.mides.pooling.grasp;

import org.mides.pooling.model.Coordinate;

/**
 * Great-circle distances driven at a constant speed. Travel times are rounded
 * up to whole seconds so that schedules are integral.
 */
public class TravelTimeCalculator {

    private static final double EARTH_RADIUS_KM = 6371.0;

    private final double speedKmPerHour;

    public TravelTimeCalculator(double speedKmPerHour) {
        if (!(speedKmPerHour > 0))
            throw new IllegalArgumentException("Speed must be positive");
        this.speedKmPerHour = speedKmPerHour;
    }

    public double distanceKm(Coordinate from, Coordinate to) {
        double lat1 = Math.toRadians(from.getLatitude());
        double lat2 = Math.toRadians(to.getLatitude());
        double dLat = lat2 - lat1;
        double dLon = Math.toRadians(to.getLongitude() - from.getLongitude());

        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
            + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return 2 * EARTH_RADIUS_KM * Math.asin(Math.min(1.0, Math.sqrt(a)));
    }

    public long travelTime(Coordinate from, Coordinate to) {
        if (from.equals(to))
            return 0;
        return (long) Math.ceil(distanceKm(from, to) / speedKmPerHour * 3600.0);
    }
}
