package com.spatialflow.service;

import com.spatialflow.model.Bounds;

/**
 * Rectangle math shared by the region service and the proximity trigger.
 */
public final class Geometry {

    private Geometry() {
    }

    /**
     * Open-interval overlap: rectangles that only touch along an edge do not overlap.
     */
    public static boolean rectsOverlap(Bounds a, Bounds b) {
        return a.getX() < b.right()
                && a.right() > b.getX()
                && a.getY() < b.bottom()
                && a.bottom() > b.getY();
    }

    public static double centerDistance(Bounds a, Bounds b) {
        double dx = a.centerX() - b.centerX();
        double dy = a.centerY() - b.centerY();
        return Math.sqrt(dx * dx + dy * dy);
    }
}
