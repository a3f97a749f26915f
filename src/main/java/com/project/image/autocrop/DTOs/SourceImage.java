package com.project.image.autocrop.DTOs;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/** A decoded input image together with the file it came from. */
public record SourceImage(Path path, BufferedImage image) {}
