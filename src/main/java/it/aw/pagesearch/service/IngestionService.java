package it.aw.pagesearch.service;

import it.aw.pagesearch.model.IngestOutcome;
import it.aw.pagesearch.model.IngestStats;
import it.aw.pagesearch.model.IngestStatus;
import it.aw.pagesearch.model.StoredDocument;
import it.aw.pagesearch.store.DocumentStore;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Ingestione di una directory di PDF nello store, pagina per pagina.
 * <p>
 * Pipeline per ogni file:
 * <ol>
 *   <li>Lettura byte + SHA-256</li>
 *   <li>Lookup del documento esistente per path assoluto</li>
 *   <li>Digest invariato: SKIPPED, l'estrazione non viene eseguita</li>
 *   <li>Estrazione pagine + normalizzazione del testo</li>
 *   <li>Scrittura transazionale documento + pagine: INGESTED o UPDATED</li>
 * </ol>
 * Un errore su un file produce un esito FAILED e l'esecuzione prosegue con il file successivo.
 */
public class IngestionService {

    private static final String PDF_EXTENSION = ".pdf";

    private final PageExtractor extractor;
    private final IngestListener listener;

    public IngestionService(PageExtractor extractor, IngestListener listener) {
        this.extractor = extractor;
        this.listener = listener;
    }

    /**
     * Esegue l'ingestione di tutti i PDF sotto {@code sourceDir}.
     *
     * @throws IllegalArgumentException se {@code sourceDir} non esiste o non è una directory;
     *                                  in quel caso lo store non viene toccato
     */
    public IngestStats run(Path sourceDir, DocumentStore store) throws IOException {
        requireSourceDirectory(sourceDir);

        List<Path> pdfs = discover(sourceDir);
        IngestStats stats = new IngestStats(pdfs.size());
        listener.onRunStarted(sourceDir, pdfs.size());

        store.ensureSchema();
        for (Path pdf : pdfs) {
            IngestOutcome outcome = ingestDocument(pdf, store);
            listener.onDocument(outcome);
            stats.record(outcome.status());
        }

        listener.onRunFinished(stats);
        return stats;
    }

    /** Verifica la directory sorgente prima di aprire qualsiasi risorsa. */
    public static void requireSourceDirectory(Path sourceDir) {
        if (!Files.exists(sourceDir)) {
            throw new IllegalArgumentException("La directory dei PDF non esiste: " + sourceDir);
        }
        if (!Files.isDirectory(sourceDir)) {
            throw new IllegalArgumentException("Il path dei PDF non è una directory: " + sourceDir);
        }
    }

    /**
     * Tutti i file con estensione .pdf (case-insensitive) sotto {@code sourceDir},
     * ricorsivamente, come path reali (link simbolici risolti), senza duplicati
     * e ordinati per path.
     * <p>
     * La radice viene risolta prima della visita: {@code Files.walk} non segue
     * una directory di partenza che sia essa stessa un link.
     */
    public static List<Path> discover(Path sourceDir) throws IOException {
        Path root = sourceDir.toRealPath();
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(PDF_EXTENSION))
                    .map(IngestionService::realPath)
                    .distinct()
                    .sorted(Comparator.comparing(Path::toString))
                    .collect(Collectors.toCollection(ArrayList::new));
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private static Path realPath(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Ingestione di un singolo file. Non lancia eccezioni: ogni errore diventa
     * un esito {@link IngestStatus#FAILED} con il motivo.
     */
    public IngestOutcome ingestDocument(Path pdf, DocumentStore store) {
        Path resolved = pdf.toAbsolutePath().normalize();
        try {
            // identità del documento = path reale, così due grafie dello stesso file coincidono
            resolved = pdf.toRealPath();
            byte[] content = Files.readAllBytes(resolved);
            String sha256 = ContentFingerprinter.digest(content);
            String path = resolved.toString();

            Optional<StoredDocument> existing = store.loadExisting(path);
            if (existing.isPresent() && existing.get().sha256().equals(sha256)) {
                return IngestOutcome.skipped(resolved);
            }

            List<String> pages = extractor.extractPages(content, resolved).stream()
                    .map(TextNormalizer::normalize)
                    .collect(Collectors.toList());

            IngestStatus status = store.writeDocument(
                    path, resolved.getFileName().toString(), sha256, pages, existing);
            return IngestOutcome.written(resolved, status, pages.size());
        } catch (Exception e) {
            return IngestOutcome.failed(resolved, describe(e));
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message != null ? message : e.getClass().getSimpleName();
    }
}
