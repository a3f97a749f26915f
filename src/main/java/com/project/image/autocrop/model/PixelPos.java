package com.project.image.autocrop.model;

/** Pixel coordinate inside an image, origin at the top-left corner. */
public record PixelPos(int x, int y) {}
