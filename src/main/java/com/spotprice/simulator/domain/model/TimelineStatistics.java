package com.spotprice.simulator.domain.model;

import java.util.List;

public record TimelineStatistics(int pointCount,
                                 double minPrice,
                                 double maxPrice,
                                 double meanPrice,
                                 double finalPrice,
                                 int jumpCount) {

    public static TimelineStatistics of(List<PricePoint> points) {
        if (points.isEmpty()) {
            return new TimelineStatistics(0, Double.NaN, Double.NaN, Double.NaN, Double.NaN, 0);
        }

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0.0;
        int jumps = 0;
        for (PricePoint point : points) {
            double p = point.price();
            if (p < min) min = p;
            if (p > max) max = p;
            sum += p;
            if (point.jumpOccurred()) jumps++;
        }

        return new TimelineStatistics(points.size(), min, max, sum / points.size(),
                points.get(points.size() - 1).price(), jumps);
    }
}
