package com.rebenew.stageParty.syncserver.service;

import com.rebenew.stageParty.syncserver.config.StageProperties;
import com.rebenew.stageParty.syncserver.core.StageIds;
import com.rebenew.stageParty.syncserver.exception.StageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Guarda el audio que suben los hosts para que la audiencia lo cargue desde {@code /rooms/uploads/}.
 */
@Service
public class AudioUploadService {
    private static final Logger logger = LoggerFactory.getLogger(AudioUploadService.class);

    private static final int MAX_ORIGINAL_NAME = 80;

    private final Path directory;
    private final long maxBytes;

    public AudioUploadService(StageProperties properties) {
        this.directory = properties.getUploads().getDirectory().toAbsolutePath().normalize();
        this.maxBytes = properties.getUploads().getMaxBytes();
    }

    /**
     * @return el nombre del archivo guardado, único por subida
     */
    public String store(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw StageException.invalidCommand("No file uploaded");
        }
        if (file.getSize() > maxBytes) {
            throw StageException.invalidCommand("File exceeds " + maxBytes + " bytes");
        }

        String filename = StageIds.next() + "_" + sanitize(file.getOriginalFilename());
        Path target = directory.resolve(filename);
        try {
            Files.createDirectories(directory);
            try (InputStream in = file.getInputStream()) {
                Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not store upload " + filename, e);
        }
        logger.info("📁 Stored upload {} ({} bytes)", filename, file.getSize());
        return filename;
    }

    public Resource load(String filename) {
        Path file = directory.resolve(filename).normalize();
        if (!file.startsWith(directory) || !Files.isRegularFile(file)) {
            throw StageException.notFound("File not found");
        }
        return new FileSystemResource(file);
    }

    public String contentType(String filename) {
        try {
            String detected = Files.probeContentType(directory.resolve(filename));
            if (detected != null) {
                return detected;
            }
        } catch (IOException e) {
            logger.debug("Could not detect content type of {}: {}", filename, e.getMessage());
        }
        return "application/octet-stream";
    }

    // Solo letras, números, punto, guion y guion bajo
    static String sanitize(String original) {
        String name = original == null ? "" : original.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        name = name.replaceAll("[^A-Za-z0-9._-]", "_");
        if (name.isBlank() || name.matches("[._]+")) {
            name = "audio";
        }
        if (name.length() > MAX_ORIGINAL_NAME) {
            name = name.substring(name.length() - MAX_ORIGINAL_NAME);
        }
        return name;
    }
}
