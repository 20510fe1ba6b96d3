package com.example.batchrunner;

import com.example.batchrunner.metadata.ImageMetadata;
import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Local processor that describes each image: size, timestamps, detected media type and a
 * SHA-256 digest. Used when no remote processor is plugged in.
 */
public class FileMetadataProcessor implements ItemProcessor<ImageMetadata> {
    private final Tika tika;

    public FileMetadataProcessor(Tika tika) {
        this.tika = tika;
    }

    @Override
    public ImageMetadata process(Path path) throws IOException {
        BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
        return new ImageMetadata(
                path.toString(),
                path.getFileName().toString(),
                attributes.size(),
                detectMimeType(path),
                computeSha256(path),
                attributes.creationTime().toInstant(),
                attributes.lastModifiedTime().toInstant()
        );
    }

    private String detectMimeType(Path path) {
        try {
            MediaType mediaType = MediaType.parse(tika.detect(path));
            return mediaType == null ? "application/octet-stream" : mediaType.toString();
        } catch (IOException ex) {
            return "application/octet-stream";
        }
    }

    private String computeSha256(Path path) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        try (InputStream inputStream = Files.newInputStream(path)) {
            byte[] buffer = new byte[8192];
            int read;
            while ((read = inputStream.read(buffer)) != -1) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new IOException("Interrupted while hashing " + path);
                }
                digest.update(buffer, 0, read);
            }
        }
        byte[] hash = digest.digest();
        StringBuilder builder = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            builder.append(String.format("%02x", b));
        }
        return builder.toString();
    }
}
