package com.example.workflowguard.graph;

/**
 * Canvas position of a node. Coordinates are boxed so that missing values from untrusted input stay visible.
 */
public record Position(Double x, Double y) {

    public static Position of(double x, double y) {
        return new Position(x, y);
    }

    public boolean isComplete() {
        return x != null && y != null && Double.isFinite(x) && Double.isFinite(y);
    }
}
