package com.project.image.autocrop.service;

/**
 * Colour distance between two pixels.
 */
public final class PixelDistance {
    /** 3 * 255^2, the largest possible sum of squared channel differences. */
    static final double MAX_SQUARED_DIFFERENCE = 195075.0;

    private PixelDistance() {}

    /**
     * Returns how far apart two packed ARGB pixels are, from 0 (same colour) to 1 (black vs white).
     * Only the red, green and blue channels count, alpha is ignored.
     */
    public static double distance(int argb1, int argb2) {
        int dr = ((argb1 >> 16) & 0xFF) - ((argb2 >> 16) & 0xFF);
        int dg = ((argb1 >> 8) & 0xFF) - ((argb2 >> 8) & 0xFF);
        int db = (argb1 & 0xFF) - (argb2 & 0xFF);
        return (dr * dr + dg * dg + db * db) / MAX_SQUARED_DIFFERENCE;
    }
}
