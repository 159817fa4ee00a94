package com.updownbot.hft.controller.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Stream;

import static com.updownbot.hft.controller.ControllerFixtures.objectMapper;
import static org.assertj.core.api.Assertions.assertThat;

class ControllerSnapshotWriterTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = objectMapper();

    @Test
    void overwritesSnapshotWithoutLeavingTempFile() throws Exception {
        Path target = dir.resolve("state/controller_state.json");
        ControllerSnapshotWriter writer = new ControllerSnapshotWriter(target, mapper);

        writer.write(Map.of("cycle", 1));
        writer.write(Map.of("cycle", 2));

        JsonNode node = mapper.readTree(target.toFile());
        assertThat(node.get("cycle").asInt()).isEqualTo(2);
        try (Stream<Path> files = Files.list(target.getParent())) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("controller_state.json");
        }
    }
}
