package com.project.image.autocrop.service;

import com.project.image.autocrop.DTOs.ScanResult;
import com.project.image.autocrop.exceptions.CropInputException;
import com.project.image.autocrop.model.PixelPos;
import com.project.image.autocrop.model.RectangleRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds where the comparison images differ from the background (the first image).
 * All images are expected to have the background's dimensions.
 */
@Service
public class DifferenceScanner {
    private static final Logger log = LoggerFactory.getLogger(DifferenceScanner.class);

    /**
     * @param images background first, then the comparison images
     * @param threshold normalized leniency; a pixel differs when its distance is strictly greater
     * @param collectPixels whether to run the second pass that records the exact differing pixels
     */
    public ScanResult scan(List<BufferedImage> images, double threshold, boolean collectPixels) {
        if (images == null || images.size() < 2) {
            throw new CropInputException("At minimum two images are required, got "
                    + (images == null ? 0 : images.size()));
        }

        BufferedImage background = images.get(0);
        final int w = background.getWidth(), h = background.getHeight();

        int[] bg = readArgb(background);
        List<int[]> others = new ArrayList<>(images.size() - 1);
        for (int i = 1; i < images.size(); i++) {
            others.add(readArgb(images.get(i)));
        }

        RectangleRange range = new RectangleRange();
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int idx = y * w + x;
                for (int[] other : others) {
                    // one differing image is enough to put this coordinate in the box
                    if (PixelDistance.distance(bg[idx], other[idx]) > threshold) {
                        range.correct(x, y);
                        break;
                    }
                }
            }
        }
        log.debug("Bounding box of differences: {}", range);

        if (!collectPixels) {
            return new ScanResult(range, List.of());
        }

        List<List<PixelPos>> differing = new ArrayList<>(others.size());
        for (int i = 0; i < others.size(); i++) {
            differing.add(new ArrayList<>());
        }

        if (!range.isEmpty()) {
            PixelPos min = range.min(), max = range.max();
            for (int y = min.y(); y <= max.y(); y++) {
                for (int x = min.x(); x <= max.x(); x++) {
                    int idx = y * w + x;
                    for (int i = 0; i < others.size(); i++) {
                        if (PixelDistance.distance(bg[idx], others.get(i)[idx]) > threshold) {
                            differing.get(i).add(new PixelPos(x, y));
                        }
                    }
                }
            }
        }

        if (log.isDebugEnabled()) {
            for (int i = 0; i < differing.size(); i++) {
                log.debug("Image {} has {} differing pixels", i + 1, differing.get(i).size());
            }
        }
        return new ScanResult(range, differing);
    }

    private static int[] readArgb(BufferedImage image) {
        int w = image.getWidth(), h = image.getHeight();
        int[] argb = new int[w * h];
        image.getRGB(0, 0, w, h, argb, 0, w);
        return argb;
    }
}
