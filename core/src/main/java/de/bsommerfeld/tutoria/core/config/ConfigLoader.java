package de.bsommerfeld.tutoria.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link TutoriaConfig} from a TOML file. A missing file is created with
 * the default values so operators have something to edit; missing keys inside
 * an existing file keep their defaults.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private final TomlMapper mapper;

    public ConfigLoader() {
        this.mapper = TomlMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /**
     * Loads the configuration at {@code path}, writing defaults first if the
     * file does not exist yet.
     *
     * @throws UncheckedIOException if the file exists but cannot be parsed, or
     *                              the defaults cannot be written
     */
    public TutoriaConfig load(Path path) {
        try {
            if (!Files.exists(path)) {
                TutoriaConfig defaults = new TutoriaConfig();
                if (path.getParent() != null) {
                    Files.createDirectories(path.getParent());
                }
                mapper.writeValue(path.toFile(), defaults);
                LOG.info("Wrote default configuration to {}", path.toAbsolutePath());
                return defaults;
            }
            return mapper.readValue(path.toFile(), TutoriaConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load configuration from " + path, e);
        }
    }
}
