package de.bsommerfeld.tutoria.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Store location and connection options. An empty {@code url} means the
 * default SQLite file inside the application data directory.
 */
public class DatabaseConfig {

    @JsonProperty("url")
    private String url = "";

    @JsonProperty("foreign-keys")
    private boolean foreignKeys = true;

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public boolean isForeignKeys() {
        return foreignKeys;
    }

    public void setForeignKeys(boolean foreignKeys) {
        this.foreignKeys = foreignKeys;
    }

    public boolean hasCustomUrl() {
        return url != null && !url.isBlank();
    }
}
