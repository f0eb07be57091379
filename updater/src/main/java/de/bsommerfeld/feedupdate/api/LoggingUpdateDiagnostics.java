package de.bsommerfeld.feedupdate.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes the update trace to the application log. */
public class LoggingUpdateDiagnostics implements UpdateDiagnostics {

    private static final Logger LOG = LoggerFactory.getLogger("de.bsommerfeld.feedupdate.diagnostics");

    @Override
    public void log(String message) {
        LOG.info(message);
    }
}
