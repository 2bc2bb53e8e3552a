package com.volumesentinel.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.volumesentinel.core.model.ValidatedAnomaly;
import com.volumesentinel.core.report.AlertSink;
import com.volumesentinel.core.report.SinkResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link AlertSink} that appends each {@link ValidatedAnomaly} as one JSON
 * object per line.
 *
 * <p>
 * Alerts are serialized before the file is opened. An alert that cannot be
 * serialized is logged and counted as failed; an I/O error fails the whole
 * batch.
 * </p>
 */
public class JsonLinesAlertSink implements AlertSink {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesAlertSink.class);

    private final Path output;
    private final ObjectMapper mapper;

    public JsonLinesAlertSink(Path output) {
        this.output = Objects.requireNonNull(output, "output must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    @Override
    public synchronized SinkResult persist(List<ValidatedAnomaly> anomalies) {
        Objects.requireNonNull(anomalies, "anomalies must not be null");
        if (anomalies.isEmpty()) {
            return SinkResult.empty();
        }

        List<String> lines = new ArrayList<>(anomalies.size());
        for (ValidatedAnomaly anomaly : anomalies) {
            try {
                lines.add(mapper.writeValueAsString(anomaly));
            } catch (JsonProcessingException e) {
                LOG.error("Failed to serialize alert {}: {}", anomaly, e.getMessage(), e);
            }
        }
        int failed = anomalies.size() - lines.size();

        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                for (String line : lines) {
                    writer.write(line);
                    writer.newLine();
                }
            }
        } catch (IOException e) {
            LOG.error("Failed to write {} alert(s) to {}: {}", lines.size(), output, e.getMessage(), e);
            return SinkResult.of(0, anomalies.size());
        }

        LOG.info("Wrote {} alert(s) to {}", lines.size(), output);
        return SinkResult.of(lines.size(), failed);
    }

    public Path getOutput() {
        return output;
    }
}
