package de.bsommerfeld.tutoria.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

public class SecurityConfig {

    @JsonProperty("password-iterations")
    private int passwordIterations = 120_000;

    public int getPasswordIterations() {
        return passwordIterations;
    }

    public void setPasswordIterations(int passwordIterations) {
        this.passwordIterations = passwordIterations;
    }
}
