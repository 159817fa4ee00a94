package com.updownbot.hft.controller.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Append-only file of one JSON document per line. Lines that fail to parse are skipped with a warning.
 */
@Slf4j
public class JsonLinesFile {

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonLinesFile(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    public Path path() {
        return path;
    }

    public synchronized void append(Object value) {
        try {
            String line = objectMapper.writeValueAsString(value);
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter w = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE)) {
                w.write(line);
                w.write('\n');
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed appending to " + path, e);
        }
    }

    public synchronized void forEachNode(Consumer<JsonNode> consumer) {
        if (!Files.exists(path)) {
            return;
        }
        try (BufferedReader r = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = r.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                JsonNode node;
                try {
                    node = objectMapper.readTree(line);
                } catch (JsonProcessingException e) {
                    log.warn("{}:{} skipped, not valid JSON: {}", path.getFileName(), lineNo, e.getOriginalMessage());
                    continue;
                }
                consumer.accept(node);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed reading " + path, e);
        }
    }

    public <T> List<T> readAll(Class<T> type) {
        List<T> out = new ArrayList<>();
        forEachNode(node -> {
            try {
                out.add(objectMapper.treeToValue(node, type));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("{} skipped a {} line: {}", path.getFileName(), type.getSimpleName(), e.getMessage());
            }
        });
        return out;
    }
}
