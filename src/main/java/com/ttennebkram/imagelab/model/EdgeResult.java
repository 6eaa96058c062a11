package com.ttennebkram.imagelab.model;

import java.util.Objects;

/**
 * Output of an edge operator. Gradient operators produce the MULTI layout
 * (x gradient, y gradient, magnitude); Canny produces a SINGLE edge map.
 */
public final class EdgeResult {

    public enum Layout {
        MULTI("multi"),
        SINGLE("single");

        private final String wireName;

        Layout(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    private final Layout layout;
    private final Image gradX;
    private final Image gradY;
    private final Image magnitude;
    private final Image edges;

    private EdgeResult(Layout layout, Image gradX, Image gradY, Image magnitude, Image edges) {
        this.layout = layout;
        this.gradX = gradX;
        this.gradY = gradY;
        this.magnitude = magnitude;
        this.edges = edges;
    }

    public static EdgeResult multi(Image gradX, Image gradY, Image magnitude) {
        return new EdgeResult(Layout.MULTI,
                Objects.requireNonNull(gradX), Objects.requireNonNull(gradY), Objects.requireNonNull(magnitude), null);
    }

    public static EdgeResult single(Image edges) {
        return new EdgeResult(Layout.SINGLE, null, null, null, Objects.requireNonNull(edges));
    }

    public Layout layout() {
        return layout;
    }

    /** Null for the SINGLE layout. */
    public Image gradX() {
        return gradX;
    }

    /** Null for the SINGLE layout. */
    public Image gradY() {
        return gradY;
    }

    /** Null for the SINGLE layout. */
    public Image magnitude() {
        return magnitude;
    }

    /** Null for the MULTI layout. */
    public Image edges() {
        return edges;
    }
}
