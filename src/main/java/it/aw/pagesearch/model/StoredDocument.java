package it.aw.pagesearch.model;

/**
 * Riga della tabella {@code documents}, decodificata subito dopo la query.
 * <p>
 * Il {@code path} assoluto è l'identità del documento (UNIQUE); {@code sha256}
 * riflette i byte dell'ultima ingestione riuscita.
 */
public record StoredDocument(
        long   docId,
        String path,
        String filename,
        String sha256,      // 64 caratteri hex minuscoli
        int    pageCount,
        String ingestedAt   // ISO-8601 UTC al secondo, es. 2024-05-01T10:00:00Z
) {}
