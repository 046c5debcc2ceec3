package it.aw.pagesearch.service;

import it.aw.pagesearch.model.IngestOutcome;
import it.aw.pagesearch.model.IngestStats;

import java.nio.file.Path;

/**
 * Riceve gli eventi di una esecuzione di ingestione.
 * Iniettato in {@link IngestionService} al posto di un logger globale.
 */
public interface IngestListener {

    default void onRunStarted(Path sourceDir, int discovered) {}

    void onDocument(IngestOutcome outcome);

    default void onRunFinished(IngestStats stats) {}
}
