package it.aw.pagesearch.model;

/**
 * Contatori di una singola esecuzione di ingestione.
 * <p>
 * Invariante: {@code discovered == ingested + updated + skipped + failed}
 * a fine esecuzione. Modificato solo da IngestionService.
 */
public class IngestStats {

    private final int discovered;
    private int ingested;
    private int updated;
    private int skipped;
    private int failed;

    public IngestStats(int discovered) {
        this.discovered = discovered;
    }

    public void record(IngestStatus status) {
        switch (status) {
            case INGESTED -> ingested++;
            case UPDATED  -> updated++;
            case SKIPPED  -> skipped++;
            case FAILED   -> failed++;
        }
    }

    public int discovered() { return discovered; }
    public int ingested()   { return ingested; }
    public int updated()    { return updated; }
    public int skipped()    { return skipped; }
    public int failed()     { return failed; }

    /** Esito complessivo: nessun documento fallito. */
    public boolean isSuccessful() {
        return failed == 0;
    }

    @Override
    public String toString() {
        return "IngestStats{discovered=" + discovered + ", ingested=" + ingested
                + ", updated=" + updated + ", skipped=" + skipped + ", failed=" + failed + "}";
    }
}
