package it.aw.pagesearch.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import it.aw.pagesearch.model.SearchHit;
import it.aw.pagesearch.store.DocumentStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SearchServiceTest {

    @TempDir Path tempDir;

    private final SearchService service = new SearchService(new Bm25Ranker());

    private Path populatedDatabase() {
        Path dbPath = tempDir.resolve("pages.sqlite");
        try (DocumentStore store = DocumentStore.open(dbPath)) {
            store.ensureSchema();
            store.writeDocument("/corpus/blue.pdf", "blue.pdf", "a".repeat(64),
                    List.of("Space link extension services", "Telemetry channel coding"), Optional.empty());
            store.writeDocument("/corpus/green.pdf", "green.pdf", "b".repeat(64),
                    List.of("Telemetry telemetry synchronization"), Optional.empty());
        }
        return dbPath;
    }

    @Test
    void shouldRankPagesFromStore() {
        Path dbPath = populatedDatabase();

        List<SearchHit> hits = service.search(dbPath, "telemetry", 5);

        assertThat(hits).extracting(SearchHit::filename).containsExactly("green.pdf", "blue.pdf");
        assertThat(hits.get(1).pageIndex()).isEqualTo(1);
        assertThat(hits.get(1).path()).isEqualTo("/corpus/blue.pdf");
        assertThat(hits.get(1).snippet()).isEqualTo("Telemetry channel coding");
    }

    @Test
    void shouldReturnEmpty_whenNothingMatches() {
        assertThat(service.search(populatedDatabase(), "orbit determination", 10)).isEmpty();
    }

    @Test
    void shouldRejectMissingDatabaseWithoutCreatingIt() {
        Path missing = tempDir.resolve("nope.sqlite");

        assertThatThrownBy(() -> service.search(missing, "telemetry", 5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nope.sqlite");
        assertThat(missing).doesNotExist();
    }

    @Test
    void shouldRejectDirectoryAsDatabase() {
        assertThatThrownBy(() -> service.search(tempDir, "telemetry", 5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectNonPositiveTopKBeforeOpeningDatabase() {
        Path missing = tempDir.resolve("never.sqlite");

        assertThatThrownBy(() -> service.search(missing, "telemetry", 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("top-k");
        assertThat(Files.exists(missing)).isFalse();
    }
}
