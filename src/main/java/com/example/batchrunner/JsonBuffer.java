package com.example.batchrunner;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Buffers records and writes them to sequentially numbered JSON files
 * ({@code <prefix>000001.json}, {@code <prefix>000002.json}, ...).
 */
public class JsonBuffer<T> {
    private final ObjectMapper mapper;
    private final Path outputDirectory;
    private final String prefix;
    private final int threshold;
    private final List<T> buffer;
    private int sequence;

    public JsonBuffer(ObjectMapper mapper, Path outputDirectory, int threshold, int startingSequence, String prefix) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("Buffer threshold must be positive: " + threshold);
        }
        this.mapper = mapper;
        this.outputDirectory = outputDirectory;
        this.prefix = prefix;
        this.threshold = threshold;
        this.buffer = new ArrayList<>(Math.min(threshold, 1024));
        this.sequence = startingSequence;
    }

    /**
     * Opens a buffer that continues numbering after the files already present in the directory.
     */
    public static <T> JsonBuffer<T> resume(ObjectMapper mapper, Path outputDirectory, int threshold, String prefix) throws IOException {
        return new JsonBuffer<>(mapper, outputDirectory, threshold, nextSequenceIn(outputDirectory, prefix), prefix);
    }

    static int nextSequenceIn(Path directory, String prefix) throws IOException {
        if (!Files.isDirectory(directory)) {
            return 1;
        }
        Pattern pattern = Pattern.compile(Pattern.quote(prefix) + "(\\d{1,9})\\.json");
        int highest = 0;
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                Matcher matcher = pattern.matcher(file.getFileName().toString());
                if (matcher.matches()) {
                    highest = Math.max(highest, Integer.parseInt(matcher.group(1)));
                }
            }
        }
        return highest + 1;
    }

    public synchronized void add(T entry) throws IOException {
        buffer.add(entry);
        if (buffer.size() >= threshold) {
            flush();
        }
    }

    public synchronized void flush() throws IOException {
        if (buffer.isEmpty()) {
            return;
        }
        Files.createDirectories(outputDirectory);
        Path file = outputDirectory.resolve(String.format("%s%06d.json", prefix, sequence));
        mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), buffer);
        sequence++;
        buffer.clear();
    }

    public synchronized int nextSequence() {
        return sequence;
    }
}
