package it.aw.pagesearch.service;

import it.aw.pagesearch.model.IngestOutcome;
import it.aw.pagesearch.model.IngestStats;
import it.aw.pagesearch.model.IngestStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Listener di default: scrive gli eventi di ingestione sul log.
 * I fallimenti vanno a livello ERROR con il path del file.
 */
public class LoggingIngestListener implements IngestListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingIngestListener.class);

    @Override
    public void onRunStarted(Path sourceDir, int discovered) {
        log.info("Inizio ingestione da {}: {} PDF trovati", sourceDir, discovered);
    }

    @Override
    public void onDocument(IngestOutcome outcome) {
        switch (outcome.status()) {
            case FAILED -> log.error("Ingestione fallita per {}: {}", outcome.path(), outcome.reason());
            case SKIPPED -> log.debug("Invariato, saltato: {}", outcome.path());
            default -> log.info("{}: {} ({} pagine)",
                    outcome.status() == IngestStatus.INGESTED ? "Nuovo" : "Aggiornato",
                    outcome.path(), outcome.pageCount());
        }
    }

    @Override
    public void onRunFinished(IngestStats stats) {
        log.info("Ingestione completata: {}", stats);
    }
}
