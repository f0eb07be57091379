package de.bsommerfeld.feedupdate.api;

/**
 * Receives the human readable trace of an update cycle, e.g. for a
 * diagnostics window in the host application.
 */
@FunctionalInterface
public interface UpdateDiagnostics {

    void log(String message);
}
