package com.project.image.autocrop.model;

/** Strategy used to cut the comparison images down to what differs from the background. */
public enum CropMode {
    /** Keeps the whole bounding box of all differences. */
    RECTANGLE,
    /** Keeps only the pixels that differ, everything else becomes transparent. */
    EXACT
}
