package com.project.image.autocrop.service;

import com.project.image.autocrop.DTOs.StagedBatch;
import com.project.image.autocrop.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Puts uploaded images on disk so they can be loaded like any other input file.
 * Original file names are kept, they are what {@code ORIGINAL} output naming is based on.
 * A batch only lives until its images are decoded; callers {@link #discard(StagedBatch)} it afterwards.
 */
@Service
public class StorageService {
    private static final Logger log = LoggerFactory.getLogger(StorageService.class);
    private static final DateTimeFormatter BATCH_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final Path rootDir;

    public StorageService(@Value("${app.upload.dir:uploads}") String root) {
        this.rootDir = Paths.get(root).toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.rootDir);
            log.info("Using upload directory: {}", this.rootDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create upload directory: " + rootDir, e);
        }
    }

    /**
     * Stores a batch of uploads in a fresh directory, in order. Each file gets its own numbered
     * sub-directory so two uploads with the same name do not overwrite each other.
     *
     * @return the batch, with stored paths in upload order
     */
    public StagedBatch stageBatch(List<MultipartFile> files) {
        if (files == null || files.isEmpty()) {
            throw new StorageException("Empty upload");
        }
        String batchName = BATCH_FORMAT.format(LocalDateTime.now()) + "_" + UUID.randomUUID().toString().substring(0, 8);
        Path batchDir = rootDir.resolve(batchName);

        StagedBatch batch = new StagedBatch(batchName, batchDir, List.of());
        List<Path> stored = new ArrayList<>(files.size());
        try {
            for (int i = 0; i < files.size(); i++) {
                stored.add(store(files.get(i), batchDir.resolve(String.format("%05d", i))));
            }
        } catch (StorageException e) {
            discard(batch);
            throw e;
        }
        log.debug("Staged {} uploads in {}", stored.size(), batchDir);
        return new StagedBatch(batchName, batchDir, stored);
    }

    /**
     * Deletes a staged batch with everything in it. A failed delete is logged, not thrown, so it
     * never hides the outcome of the crop that used the batch.
     */
    public void discard(StagedBatch batch) {
        try {
            if (FileSystemUtils.deleteRecursively(batch.dir())) {
                log.debug("Discarded upload batch {}", batch.id());
            }
        } catch (IOException e) {
            log.warn("Could not delete upload batch {}", batch.dir(), e);
        }
    }

    private Path store(MultipartFile file, Path dir) {
        if (file == null || file.isEmpty()) {
            throw new StorageException("Empty upload");
        }
        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            throw new StorageException("Only image uploads are allowed (received: " + contentType + ")");
        }
        String original = StringUtils.cleanPath(file.getOriginalFilename() == null ? "upload" : file.getOriginalFilename());
        String safeName = StringUtils.getFilename(original);
        if (safeName == null || safeName.isBlank() || safeName.equals("..")) {
            safeName = "upload";
        }

        Path target = dir.resolve(safeName).normalize();
        if (!target.startsWith(dir)) {
            throw new StorageException("Cannot store file outside the upload directory: " + original);
        }
        try (InputStream in = file.getInputStream()) {
            Files.createDirectories(dir);
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            return target;
        } catch (IOException e) {
            throw new StorageException("Failed to store file " + safeName, e);
        }
    }

    public Path rootDir() {
        return rootDir;
    }
}
