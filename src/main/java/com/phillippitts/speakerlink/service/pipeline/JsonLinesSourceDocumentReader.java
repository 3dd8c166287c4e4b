package com.phillippitts.speakerlink.service.pipeline;

import com.phillippitts.speakerlink.exception.PipelineExceptionBuilder;
import com.phillippitts.speakerlink.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Reads {@code <input-dir>/<source>.jsonl}, one JSON object per line.
 *
 * <p>Lines are read lazily. Blank lines are ignored; lines that are not a JSON object are
 * logged and skipped, but still count towards the resume offset. A missing file is an empty
 * source.
 */
public class JsonLinesSourceDocumentReader implements SourceDocumentReader {

    private static final Logger LOG = LogManager.getLogger(JsonLinesSourceDocumentReader.class);
    private static final String EXTENSION = ".jsonl";
    private static final int PREVIEW_LENGTH = 80;

    private final Path inputDir;

    public JsonLinesSourceDocumentReader(Path inputDir) {
        this.inputDir = Objects.requireNonNull(inputDir, "inputDir must not be null");
    }

    @Override
    public Stream<Map<String, Object>> read(String sourceName, long offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative, got: " + offset);
        }
        Path file = inputDir.resolve(sourceName + EXTENSION);
        if (!Files.isRegularFile(file)) {
            LOG.info("No input file for source {} at {}", sourceName, file);
            return Stream.empty();
        }
        try {
            return Files.lines(file, StandardCharsets.UTF_8)
                    .filter(line -> !line.isBlank())
                    .skip(offset)
                    .map(line -> parse(sourceName, line))
                    .filter(Objects::nonNull);
        } catch (IOException e) {
            throw PipelineExceptionBuilder.create("Cannot open source file")
                    .source(sourceName)
                    .cause(e)
                    .metadata("path", file)
                    .build();
        }
    }

    private static Map<String, Object> parse(String sourceName, String line) {
        try {
            return new JSONObject(line).toMap();
        } catch (JSONException e) {
            LOG.warn("Skipping unparseable {} line: {} ({})",
                    sourceName, LogSanitizer.truncate(line, PREVIEW_LENGTH), e.getMessage());
            return null;
        }
    }
}
