package it.aw.pagesearch.model;

/** Esito dell'ingestione di un singolo documento. */
public enum IngestStatus {
    INGESTED,
    UPDATED,
    SKIPPED,
    FAILED
}
