package com.project.image.autocrop.model;

/**
 * Inclusive rectangle that grows to enclose every coordinate passed to {@link #correct(int, int)}.
 *
 * <p>A fresh range is empty: {@code min = (MAX, MAX)}, {@code max = (0, 0)}. Width and height are
 * {@code max - min}, so a range holding a single pixel is 0x0.</p>
 */
public class RectangleRange {
    private int minX = Integer.MAX_VALUE;
    private int minY = Integer.MAX_VALUE;
    private int maxX = 0;
    private int maxY = 0;

    /**
     * Widens the range so it contains (x, y).
     *
     * @return true if any bound moved
     */
    public boolean correct(int x, int y) {
        boolean changed = false;
        if (x < minX) { minX = x; changed = true; }
        if (y < minY) { minY = y; changed = true; }
        if (x > maxX) { maxX = x; changed = true; }
        if (y > maxY) { maxY = y; changed = true; }
        return changed;
    }

    public boolean contains(int x, int y) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY;
    }

    /** True while no coordinate has been accumulated. */
    public boolean isEmpty() {
        return minX > maxX || minY > maxY;
    }

    // empty range reports 0 instead of a negative extent
    public int width() {
        return isEmpty() ? 0 : maxX - minX;
    }

    public int height() {
        return isEmpty() ? 0 : maxY - minY;
    }

    public PixelPos min() {
        return new PixelPos(minX, minY);
    }

    public PixelPos max() {
        return new PixelPos(maxX, maxY);
    }

    @Override
    public String toString() {
        return isEmpty()
                ? "RectangleRange[empty]"
                : "RectangleRange[min=(" + minX + "," + minY + "), max=(" + maxX + "," + maxY + ")]";
    }
}
