package it.aw.pagesearch.model;

import java.nio.file.Path;

/**
 * Risultato etichettato dell'ingestione di un file.
 * <p>
 * {@code reason} è valorizzato solo per {@link IngestStatus#FAILED};
 * {@code pageCount} è 0 per SKIPPED e FAILED.
 */
public record IngestOutcome(Path path, IngestStatus status, int pageCount, String reason) {

    public static IngestOutcome written(Path path, IngestStatus status, int pageCount) {
        return new IngestOutcome(path, status, pageCount, null);
    }

    public static IngestOutcome skipped(Path path) {
        return new IngestOutcome(path, IngestStatus.SKIPPED, 0, null);
    }

    public static IngestOutcome failed(Path path, String reason) {
        return new IngestOutcome(path, IngestStatus.FAILED, 0, reason);
    }
}
