package de.bsommerfeld.tutoria.service;

/**
 * Snapshot of the database layer.
 *
 * @param loopRunning  a background loop is live
 * @param connected    the shared client holds an open connection
 * @param loopsCreated loops started since process start; more than one
 *                     means the loop was restarted
 */
public record HealthStatus(boolean loopRunning, boolean connected, int loopsCreated) {

    public boolean isHealthy() {
        return loopRunning && connected;
    }
}
