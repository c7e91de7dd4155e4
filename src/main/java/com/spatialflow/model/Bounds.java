package com.spatialflow.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Axis-aligned rectangle in canvas coordinates.
 * Immutable: a region that grows gets a new Bounds instance, a region
 * that does not grow keeps the exact same one.
 */
@Value
@Builder
@Jacksonized
public class Bounds {

    double x;
    double y;
    double width;
    double height;

    public static Bounds of(double x, double y, double width, double height) {
        return new Bounds(x, y, width, height);
    }

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    public double centerX() {
        return x + width / 2;
    }

    public double centerY() {
        return y + height / 2;
    }
}
