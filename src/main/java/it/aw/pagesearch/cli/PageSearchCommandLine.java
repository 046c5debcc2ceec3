package it.aw.pagesearch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.pagesearch.model.IngestStats;
import it.aw.pagesearch.model.SearchHit;
import it.aw.pagesearch.service.IngestionService;
import it.aw.pagesearch.service.SearchService;
import it.aw.pagesearch.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Entry point a riga di comando.
 *
 * Comandi disponibili:
 *   ingest &lt;source_dir&gt; &lt;db_path&gt;
 *       indicizza ricorsivamente i PDF della directory; exit 0 se nessun file è fallito, 1 altrimenti
 *   search &lt;db_path&gt; &lt;query...&gt; [--top-k N] [--json]
 *       ricerca BM25 sulle pagine; exit 0 se la query è stata eseguita,
 *       1 per argomenti non validi o database inesistente
 *
 * L'output dei comandi va su stdout; log ed errori vanno su stderr (vedi logback-spring.xml).
 *
 * Esempi:
 *   java -jar pagesearch.jar ingest ./pdfs ./data/pages.sqlite
 *   java -jar pagesearch.jar search ./data/pages.sqlite "telemetry frame" --top-k 3
 */
@Component
public class PageSearchCommandLine implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(PageSearchCommandLine.class);

    static final String USAGE = """
            Uso:
              ingest <source_dir> <db_path>
              search <db_path> <query...> [--top-k N] [--json]
            """;

    private final IngestionService ingestionService;
    private final SearchService searchService;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int defaultTopK;
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode;

    @Autowired
    public PageSearchCommandLine(IngestionService ingestionService,
                                 SearchService searchService,
                                 ObjectMapper objectMapper,
                                 Clock clock,
                                 @Value("${search.default-top-k:5}") int defaultTopK) {
        this(ingestionService, searchService, objectMapper, clock, defaultTopK, System.out, System.err);
    }

    PageSearchCommandLine(IngestionService ingestionService,
                          SearchService searchService,
                          ObjectMapper objectMapper,
                          Clock clock,
                          int defaultTopK,
                          PrintStream out,
                          PrintStream err) {
        this.ingestionService = ingestionService;
        this.searchService = searchService;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.defaultTopK = defaultTopK;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args.getSourceArgs());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /** Esegue un comando e restituisce l'exit code del processo. */
    int execute(String... args) {
        if (args.length == 0) {
            err.print(USAGE);
            return 1;
        }
        try {
            switch (args[0]) {
                case "ingest":
                    return ingest(args);
                case "search":
                    return search(args);
                default:
                    log.error("Comando sconosciuto: {}", args[0]);
                    err.print(USAGE);
                    return 1;
            }
        } catch (IllegalArgumentException e) {
            log.error("{}", e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Errore inatteso: {}", e.getMessage(), e);
            return 1;
        }
    }

    // -------------------------------------------------------------------------
    // ingest <source_dir> <db_path>
    // -------------------------------------------------------------------------

    private int ingest(String[] args) throws IOException {
        if (args.length != 3) {
            throw new IllegalArgumentException("ingest richiede <source_dir> <db_path>");
        }
        Path sourceDir = Path.of(args[1]);
        Path dbPath = Path.of(args[2]);
        IngestionService.requireSourceDirectory(sourceDir);

        IngestStats stats;
        int documents;
        int pages;
        try (DocumentStore store = DocumentStore.open(dbPath, clock)) {
            stats = ingestionService.run(sourceDir, store);
            documents = store.countDocuments();
            pages = store.countPages();
        }
        out.println("Discovered PDFs: " + stats.discovered());
        out.println("Ingested new: " + stats.ingested());
        out.println("Updated changed: " + stats.updated());
        out.println("Skipped unchanged: " + stats.skipped());
        out.println("Failed: " + stats.failed());
        out.println("Documents in store: " + documents);
        out.println("Pages in store: " + pages);
        return stats.isSuccessful() ? 0 : 1;
    }

    // -------------------------------------------------------------------------
    // search <db_path> <query...> [--top-k N] [--json]
    // -------------------------------------------------------------------------

    private int search(String[] args) throws JsonProcessingException {
        List<String> positional = new ArrayList<>();
        int topK = defaultTopK;
        boolean json = false;
        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("--json")) {
                json = true;
            } else if (arg.equals("--top-k")) {
                if (i + 1 >= args.length) throw new IllegalArgumentException("--top-k richiede un valore");
                topK = parseTopK(args[++i]);
            } else if (arg.startsWith("--top-k=")) {
                topK = parseTopK(arg.substring("--top-k=".length()));
            } else if (arg.startsWith("--")) {
                throw new IllegalArgumentException("Opzione sconosciuta: " + arg);
            } else {
                positional.add(arg);
            }
        }
        if (positional.size() < 2) {
            throw new IllegalArgumentException("search richiede <db_path> <query>");
        }
        Path dbPath = Path.of(positional.get(0));
        String query = String.join(" ", positional.subList(1, positional.size()));

        List<SearchHit> hits = searchService.search(dbPath, query, topK);
        if (json) {
            out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(hits));
        } else {
            formatHits(hits).forEach(out::println);
        }
        return 0;
    }

    static List<String> formatHits(List<SearchHit> hits) {
        if (hits.isEmpty()) {
            return List.of("No results.");
        }
        List<String> lines = new ArrayList<>(hits.size() * 2);
        for (SearchHit hit : hits) {
            lines.add(String.format(Locale.ROOT, "%d. %s:p%d score=%.4f",
                    hit.rank(), hit.filename(), hit.pageIndex() + 1, hit.score()));
            lines.add("  " + hit.snippet());
        }
        return lines;
    }

    private static int parseTopK(String value) {
        int topK;
        try {
            topK = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--top-k deve essere un intero (ricevuto: " + value + ")", e);
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("--top-k deve essere > 0 (ricevuto: " + topK + ")");
        }
        return topK;
    }
}
