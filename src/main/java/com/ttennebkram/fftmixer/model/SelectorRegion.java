package com.ttennebkram.fftmixer.model;

import org.opencv.core.Rect;

/**
 * Square selector in working-frame coordinates that bounds the Inner/Outer mask.
 * Instances are immutable; every geometry change returns a new region.
 */
public final class SelectorRegion {

    /** Smallest allowed side length. */
    public static final int MIN_SIZE = 50;

    /** Region used before any working frame exists. */
    public static final SelectorRegion DEFAULT = new SelectorRegion(0, 0, 200);

    private final int x;
    private final int y;
    private final int size;

    public SelectorRegion(int x, int y, int size) {
        this.x = x;
        this.y = y;
        this.size = Math.max(MIN_SIZE, size);
    }

    /**
     * A region of the given size (at least {@link #MIN_SIZE}) centered on the frame.
     * A region larger than the frame is anchored at the origin.
     */
    public static SelectorRegion centered(WorkingFrame frame, int size) {
        int side = Math.max(MIN_SIZE, size);
        int cx = Math.floorDiv(frame.getWidth() - side, 2);
        int cy = Math.floorDiv(frame.getHeight() - side, 2);
        return new SelectorRegion(cx, cy, side).clampTo(frame);
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getWidth() {
        return size;
    }

    public int getHeight() {
        return size;
    }

    public int getSize() {
        return size;
    }

    /**
     * Same size, origin moved so that 0 <= x <= width - w and 0 <= y <= height - h.
     * When the square is larger than the frame along an axis the origin on that axis is 0.
     */
    public SelectorRegion clampTo(WorkingFrame frame) {
        int cx = Math.max(0, Math.min(x, frame.getWidth() - size));
        int cy = Math.max(0, Math.min(y, frame.getHeight() - size));
        if (cx == x && cy == y) {
            return this;
        }
        return new SelectorRegion(cx, cy, size);
    }

    /**
     * Region moved to a requested origin, clamped to the frame.
     */
    public SelectorRegion moveTo(int newX, int newY, WorkingFrame frame) {
        return new SelectorRegion(newX, newY, size).clampTo(frame);
    }

    /**
     * The clamped region intersected with the frame bounds, as an OpenCV rectangle.
     */
    public Rect toRect(WorkingFrame frame) {
        SelectorRegion clamped = clampTo(frame);
        int w = Math.min(size, frame.getWidth() - clamped.x);
        int h = Math.min(size, frame.getHeight() - clamped.y);
        return new Rect(clamped.x, clamped.y, w, h);
    }

    /**
     * (x, y, w, h) as exposed to the UI layer.
     */
    public int[] toArray() {
        return new int[]{x, y, size, size};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SelectorRegion)) return false;
        SelectorRegion other = (SelectorRegion) o;
        return x == other.x && y == other.y && size == other.size;
    }

    @Override
    public int hashCode() {
        return (31 * x + y) * 31 + size;
    }

    @Override
    public String toString() {
        return "SelectorRegion[x=" + x + ", y=" + y + ", w=" + size + ", h=" + size + "]";
    }
}
