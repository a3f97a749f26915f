package com.project.image.autocrop.DTOs;

import com.project.image.autocrop.model.CropMode;
import com.project.image.autocrop.model.RectangleRange;

import java.nio.file.Path;
import java.util.List;

public record CropResult(
        int width,
        int height,
        CropMode mode,
        BoundingBox boundingBox,   // null when nothing differs
        List<WrittenImage> images
) {
    public record BoundingBox(int minX, int minY, int maxX, int maxY, int width, int height) {
        public static BoundingBox of(RectangleRange range) {
            if (range.isEmpty()) {
                return null;
            }
            return new BoundingBox(range.min().x(), range.min().y(), range.max().x(), range.max().y(),
                    range.width(), range.height());
        }
    }

    public record WrittenImage(int index, Path path, int width, int height) {}
}
