package de.bsommerfeld.tutoria.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Each TOML table maps to one section object;
 * unknown keys are ignored so older files keep loading after upgrades.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TutoriaConfig {

    @JsonProperty("database")
    private DatabaseConfig database = new DatabaseConfig();

    @JsonProperty("loop")
    private LoopConfig loop = new LoopConfig();

    @JsonProperty("security")
    private SecurityConfig security = new SecurityConfig();

    public DatabaseConfig getDatabase() {
        return database;
    }

    public LoopConfig getLoop() {
        return loop;
    }

    public SecurityConfig getSecurity() {
        return security;
    }
}
