package com.genai.anomaly.repository;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.genai.anomaly.config.AnomalyProperties;
import com.genai.anomaly.exception.StoreException;
import com.genai.anomaly.model.ActualRecord;
import com.genai.anomaly.model.PredictedRecord;
import com.genai.anomaly.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Reads {@code predicted.jsonl} and {@code actual.jsonl} from the input directory.
 * A missing file is an empty stream. Unparseable lines are skipped with a
 * warning so one bad export line cannot block detection.
 */
@Repository
public class JsonLinesInputSource implements InputSource {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesInputSource.class);

    static final String PREDICTED_FILE = "predicted.jsonl";
    static final String ACTUAL_FILE = "actual.jsonl";

    private final Path dataDir;
    private final ObjectMapper objectMapper;

    @Autowired
    public JsonLinesInputSource(AnomalyProperties properties) {
        this(Paths.get(properties.getInput().getDataDir()));
    }

    public JsonLinesInputSource(Path dataDir) {
        this.dataDir = dataDir;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public List<PredictedRecord> fetchPredicted(TimeWindow window) {
        return read(dataDir.resolve(PREDICTED_FILE), PredictedRecord.class, window, PredictedRecord::getTimestamp);
    }

    @Override
    public List<ActualRecord> fetchActual(TimeWindow window) {
        return read(dataDir.resolve(ACTUAL_FILE), ActualRecord.class, window, ActualRecord::getTimestamp);
    }

    private <T> List<T> read(Path file, Class<T> type, TimeWindow window, Function<T, Instant> timestampOf) {
        if (!Files.exists(file)) {
            log.debug("Input file {} not found, treating as empty", file);
            return List.of();
        }

        List<T> records = new ArrayList<>();
        int lineNumber = 0;
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) continue;
                T record;
                try {
                    record = objectMapper.readValue(line, type);
                } catch (IOException e) {
                    skipped++;
                    log.warn("Skipping malformed line {} in {}: {}", lineNumber, file.getFileName(), e.getMessage());
                    continue;
                }
                Instant ts = timestampOf.apply(record);
                // Records without a timestamp are passed on so the correlator can report them
                if (ts == null || window.contains(ts)) {
                    records.add(record);
                }
            }
        } catch (IOException e) {
            throw new StoreException("Failed to read input file " + file, e);
        }

        if (skipped > 0) {
            log.warn("Skipped {} malformed line(s) in {}", skipped, file.getFileName());
        }
        return records;
    }
}
