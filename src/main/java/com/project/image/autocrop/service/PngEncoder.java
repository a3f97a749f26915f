package com.project.image.autocrop.service;

import com.project.image.autocrop.exceptions.ImageWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * Writes rasters as PNG files. The deflate level is fixed for the lifetime of the encoder.
 */
@Service
public class PngEncoder {
    private static final Logger log = LoggerFactory.getLogger(PngEncoder.class);

    private final float compressionQuality;

    /**
     * @param compressionQuality 0 for the strongest (slowest) compression, 1 for the fastest
     */
    public PngEncoder(@Value("${app.png.compression-quality:0.5}") float compressionQuality) {
        if (compressionQuality < 0f || compressionQuality > 1f) {
            throw new IllegalArgumentException("PNG compression quality must be in [0, 1]: " + compressionQuality);
        }
        this.compressionQuality = compressionQuality;
    }

    /**
     * Encodes {@code image} to {@code target}, replacing any existing file.
     *
     * @throws ImageWriteException if no PNG writer is available or writing fails
     */
    public void write(BufferedImage image, Path target) {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("png");
        if (!writers.hasNext()) {
            throw new ImageWriteException("No ImageIO writer for format: png");
        }
        ImageWriter writer = writers.next();
        try (OutputStream out = Files.newOutputStream(target);
             ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            if (ios == null) {
                throw new ImageWriteException("No ImageOutputStream could be created for " + target);
            }
            writer.setOutput(ios);
            writer.write(null, new IIOImage(image, null, null), writeParam(writer));
            log.debug("Wrote {}x{} PNG to {}", image.getWidth(), image.getHeight(), target);
        } catch (IOException e) {
            throw new ImageWriteException("Failed to write PNG " + target, e);
        } finally {
            writer.dispose();
        }
    }

    private ImageWriteParam writeParam(ImageWriter writer) {
        ImageWriteParam param = writer.getDefaultWriteParam();
        if (param.canWriteCompressed()) {
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            String[] types = param.getCompressionTypes();
            if (param.getCompressionType() == null && types != null && types.length > 0) {
                param.setCompressionType(types[0]);
            }
            param.setCompressionQuality(compressionQuality);
        }
        return param;
    }

    public float compressionQuality() {
        return compressionQuality;
    }
}
