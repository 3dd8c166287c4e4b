package com.phillippitts.speakerlink.service.pipeline;

import com.phillippitts.speakerlink.domain.CanonicalProfile;
import com.phillippitts.speakerlink.exception.PipelineExceptionBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Profile store kept as one JSON-lines file, ordered by profile id.
 *
 * <p>Upserts are buffered in memory; {@link #flush()} rewrites the whole file through a
 * temporary sibling and an atomic move, so a crashed run never leaves a half-written store.
 * The buffer is seeded from the existing file on first access.
 */
public class JsonLinesProfileSink implements ProfileSink {

    private static final Logger LOG = LogManager.getLogger(JsonLinesProfileSink.class);

    private final Path file;
    private final ProfileJsonCodec codec;
    private Map<String, CanonicalProfile> profiles;

    public JsonLinesProfileSink(Path file, ProfileJsonCodec codec) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    @Override
    public synchronized void upsert(CanonicalProfile profile) {
        buffer().put(profile.profileId(), profile);
    }

    @Override
    public synchronized Collection<CanonicalProfile> loadAll() {
        return List.copyOf(buffer().values());
    }

    @Override
    public synchronized void flush() {
        Path parent = file.toAbsolutePath().getParent();
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                for (CanonicalProfile profile : buffer().values()) {
                    writer.write(codec.encode(profile));
                    writer.write('\n');
                }
            }
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            LOG.info("Wrote {} profiles to {}", buffer().size(), file);
        } catch (IOException e) {
            throw PipelineExceptionBuilder.create("Cannot write profile store")
                    .cause(e)
                    .metadata("path", file)
                    .metadata("profiles", buffer().size())
                    .build();
        }
    }

    private Map<String, CanonicalProfile> buffer() {
        if (profiles == null) {
            profiles = read();
        }
        return profiles;
    }

    private Map<String, CanonicalProfile> read() {
        TreeMap<String, CanonicalProfile> loaded = new TreeMap<>();
        if (!Files.isRegularFile(file)) {
            return loaded;
        }
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    CanonicalProfile profile = codec.decode(line);
                    loaded.put(profile.profileId(), profile);
                }
            }
        } catch (IOException | IllegalArgumentException e) {
            throw PipelineExceptionBuilder.create("Cannot read profile store")
                    .cause(e)
                    .metadata("path", file)
                    .build();
        }
        LOG.info("Loaded {} profiles from {}", loaded.size(), file);
        return loaded;
    }
}
