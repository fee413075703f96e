package com.ble.positioning.algorithm.util;

import com.ble.positioning.model.Point;
import java.util.List;

/**
 * Planar geometry helpers shared by the estimator and the zone engine.
 */
public final class PlanarGeometry {

    /**
     * Ratio of the minor to the major principal variance of a point set below which the points
     * are treated as lying on one line.
     */
    public static final double DEFAULT_COLLINEARITY_TOLERANCE = 1e-3;

    private PlanarGeometry() {
    }

    /**
     * Ray-casting point-in-polygon test. The polygon is given in drawing order and is implicitly
     * closed. Points exactly on an edge may fall either way.
     */
    public static boolean contains(List<Point> polygon, Point point) {
        boolean inside = false;
        int n = polygon.size();
        for (int i = 0, j = n - 1; i < n; j = i++) {
            Point a = polygon.get(i);
            Point b = polygon.get(j);
            if ((a.y() > point.y()) != (b.y() > point.y())
                    && point.x() < (b.x() - a.x()) * (point.y() - a.y()) / (b.y() - a.y()) + a.x()) {
                inside = !inside;
            }
        }
        return inside;
    }

    /**
     * Returns true if the points lie on, or very close to, a single line. The test compares the
     * principal variances of the point cloud, so it does not depend on scale or orientation.
     */
    public static boolean isCollinear(List<Point> points, double tolerance) {
        if (points.size() < 3) {
            return true;
        }
        double meanX = 0;
        double meanY = 0;
        for (Point p : points) {
            meanX += p.x();
            meanY += p.y();
        }
        meanX /= points.size();
        meanY /= points.size();

        double sxx = 0;
        double syy = 0;
        double sxy = 0;
        for (Point p : points) {
            double dx = p.x() - meanX;
            double dy = p.y() - meanY;
            sxx += dx * dx;
            syy += dy * dy;
            sxy += dx * dy;
        }
        double half = (sxx + syy) / 2.0;
        double spread = Math.sqrt(((sxx - syy) / 2.0) * ((sxx - syy) / 2.0) + sxy * sxy);
        double major = half + spread;
        double minor = half - spread;
        if (major <= 0) {
            return true;
        }
        return minor / major < tolerance;
    }

    /** Heading of a vector in degrees counter-clockwise from the +x axis, normalized to [0, 360). */
    public static double headingDegrees(double vx, double vy) {
        double degrees = Math.toDegrees(Math.atan2(vy, vx));
        if (degrees < 0) {
            degrees += 360.0;
        }
        return degrees >= 360.0 ? 0.0 : degrees;
    }
}
