package com.project.image.autocrop.service;

import com.project.image.autocrop.DTOs.CropSettings;
import com.project.image.autocrop.DTOs.ScanResult;
import com.project.image.autocrop.model.CropMode;
import com.project.image.autocrop.model.PixelPos;
import com.project.image.autocrop.model.RectangleRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;

/**
 * Turns one input image and the scan result into the raster that gets written out.
 *
 * <p>Every raster returned is {@link BufferedImage#TYPE_INT_ARGB}; images without an alpha channel
 * come out opaque, and transparent pixels (0,0,0,0) mark what was cut away.</p>
 */
@Service
public class CropStrategy {
    private static final Logger log = LoggerFactory.getLogger(CropStrategy.class);

    private static final int TRANSPARENT = 0x00000000;

    /**
     * @param mode must match {@code settings.mode()}
     * @param index position of {@code image} in the input list; 0 is the background, which is
     *              always returned uncropped
     * @param scan for {@link CropMode#EXACT}, a scan that collected the differing pixels
     * @throws IllegalArgumentException if {@code mode} disagrees with the settings, or an exact
     *                                  crop is given a scan without pixel sets
     */
    public BufferedImage apply(CropMode mode, BufferedImage image, int index, ScanResult scan, CropSettings settings) {
        if (mode != settings.mode()) {
            throw new IllegalArgumentException("Crop mode " + mode + " does not match settings mode " + settings.mode());
        }
        if (mode == CropMode.EXACT && !scan.hasPixelSets()) {
            throw new IllegalArgumentException("Exact crop needs a scan that collected differing pixels");
        }
        if (index == 0) {
            return copyArgb(image);
        }

        RectangleRange range = scan.boundingBox();
        if (range.isEmpty()) {
            log.debug("No differences found, image {} becomes a transparent canvas", index);
            return new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_ARGB);
        }

        return switch (mode) {
            case RECTANGLE -> settings.resizeOutput()
                    ? cropTo(copyArgb(image), range)
                    : maskOutside(image, range);
            case EXACT -> {
                BufferedImage canvas = exactPixels(image, scan, index);
                yield settings.resizeOutput() ? cropTo(canvas, range) : canvas;
            }
        };
    }

    private static BufferedImage maskOutside(BufferedImage source, RectangleRange range) {
        final int w = source.getWidth(), h = source.getHeight();
        int[] argb = new int[w * h];
        source.getRGB(0, 0, w, h, argb, 0, w);

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (!range.contains(x, y)) {
                    argb[y * w + x] = TRANSPARENT;
                }
            }
        }

        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        out.setRGB(0, 0, w, h, argb, 0, w);
        return out;
    }

    private static BufferedImage exactPixels(BufferedImage source, ScanResult scan, int index) {
        BufferedImage canvas = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_ARGB);
        for (PixelPos p : scan.differingPixels(index)) {
            canvas.setRGB(p.x(), p.y(), source.getRGB(p.x(), p.y()));
        }
        return canvas;
    }

    /**
     * Cuts {@code source} down to {@code width() x height()} starting at the range's minimum.
     * An axis of extent 0 (a single row or column of differences) is kept one pixel wide, since a
     * raster cannot be empty.
     */
    private static BufferedImage cropTo(BufferedImage source, RectangleRange range) {
        PixelPos min = range.min();
        int cw = Math.min(Math.max(range.width(), 1), source.getWidth() - min.x());
        int ch = Math.min(Math.max(range.height(), 1), source.getHeight() - min.y());

        int[] argb = new int[cw * ch];
        source.getRGB(min.x(), min.y(), cw, ch, argb, 0, cw);
        BufferedImage out = new BufferedImage(cw, ch, BufferedImage.TYPE_INT_ARGB);
        out.setRGB(0, 0, cw, ch, argb, 0, cw);
        return out;
    }

    static BufferedImage copyArgb(BufferedImage source) {
        final int w = source.getWidth(), h = source.getHeight();
        int[] argb = new int[w * h];
        source.getRGB(0, 0, w, h, argb, 0, w);
        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        out.setRGB(0, 0, w, h, argb, 0, w);
        return out;
    }
}
