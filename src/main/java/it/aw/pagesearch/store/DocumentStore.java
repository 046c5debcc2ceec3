package it.aw.pagesearch.store;

import it.aw.pagesearch.model.IngestStatus;
import it.aw.pagesearch.model.StoredDocument;
import it.aw.pagesearch.model.StoredPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.*;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Store relazionale di documenti e pagine su un file SQLite.
 * <p>
 * Un'unica connessione JDBC per istanza, aperta con {@link #open(Path, Clock)} e
 * chiusa con {@link #close()}. Le foreign key sono attivate a ogni apertura
 * (in SQLite sono disattivate di default), così la cancellazione di un documento
 * elimina in cascata le sue pagine.
 * <p>
 * Ogni scrittura di documento è una singola transazione: in caso di errore
 * viene eseguito il rollback e nessuno stato parziale diventa visibile.
 * Le pagine di un documento vengono sempre cancellate e reinserite in blocco,
 * mai modificate singolarmente, così gli indici restano contigui {@code 0..n-1}.
 */
public class DocumentStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DocumentStore.class);

    private static final String CREATE_SCHEMA = """
            CREATE TABLE IF NOT EXISTS documents (
                doc_id      INTEGER PRIMARY KEY,
                path        TEXT    NOT NULL UNIQUE,
                filename    TEXT    NOT NULL,
                sha256      TEXT    NOT NULL,
                page_count  INTEGER NOT NULL,
                ingested_at TEXT    NOT NULL
            );

            CREATE TABLE IF NOT EXISTS pages (
                doc_id     INTEGER NOT NULL REFERENCES documents(doc_id) ON DELETE CASCADE,
                page_index INTEGER NOT NULL,
                text       TEXT    NOT NULL,
                PRIMARY KEY (doc_id, page_index)
            );

            CREATE INDEX IF NOT EXISTS idx_documents_sha256 ON documents(sha256);
            """;

    private static final String SELECT_ALL_PAGES = """
            SELECT d.filename, d.path, p.page_index, p.text
            FROM pages p
            JOIN documents d ON d.doc_id = p.doc_id
            ORDER BY d.filename ASC, p.page_index ASC, d.path ASC
            """;

    private final Path dbPath;
    private final Connection conn;
    private final Clock clock;

    private DocumentStore(Path dbPath, Connection conn, Clock clock) {
        this.dbPath = dbPath;
        this.conn = conn;
        this.clock = clock;
    }

    /**
     * Apre (creandolo se necessario) il database SQLite indicato.
     * La directory padre viene creata se non esiste.
     */
    public static DocumentStore open(Path dbPath, Clock clock) {
        Path absolute = dbPath.toAbsolutePath();
        try {
            Files.createDirectories(absolute.getParent());
        } catch (IOException e) {
            throw new StoreException("Impossibile creare la directory del database " + absolute.getParent(), e);
        }
        try {
            Connection conn = DriverManager.getConnection("jdbc:sqlite:" + absolute);
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA foreign_keys = ON");
            }
            log.debug("DocumentStore: connessione aperta su {}", absolute);
            return new DocumentStore(absolute, conn, clock);
        } catch (SQLException e) {
            throw new StoreException("Impossibile aprire il database " + absolute, e);
        }
    }

    public static DocumentStore open(Path dbPath) {
        return open(dbPath, Clock.systemUTC());
    }

    public Path dbPath() {
        return dbPath;
    }

    /** Crea tabelle e indice se assenti. Idempotente, sicuro a ogni avvio. */
    public void ensureSchema() {
        try (Statement stmt = conn.createStatement()) {
            for (String ddl : CREATE_SCHEMA.split(";")) {
                if (!ddl.isBlank()) stmt.execute(ddl);
            }
        } catch (SQLException e) {
            throw new StoreException("Errore creazione schema su " + dbPath, e);
        }
        log.debug("DocumentStore: schema pronto su {}", dbPath);
    }

    /** Lookup puntuale per path assoluto. */
    public Optional<StoredDocument> loadExisting(String path) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT doc_id, path, filename, sha256, page_count, ingested_at FROM documents WHERE path = ?")) {
            ps.setString(1, path);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(toDocument(rs));
            }
        } catch (SQLException e) {
            throw new StoreException("Errore lettura documento " + path, e);
        }
        return Optional.empty();
    }

    /**
     * Inserisce o sostituisce un documento e tutte le sue pagine in un'unica transazione.
     *
     * @param existing documento già presente per lo stesso path, se c'è
     * @return {@link IngestStatus#INGESTED} per un nuovo documento,
     *         {@link IngestStatus#UPDATED} se è stato sostituito
     * @throws StoreException dopo il rollback, se una qualsiasi istruzione fallisce
     */
    public IngestStatus writeDocument(String path,
                                      String filename,
                                      String sha256,
                                      List<String> pages,
                                      Optional<StoredDocument> existing) {
        String ingestedAt = Instant.now(clock).truncatedTo(ChronoUnit.SECONDS).toString();
        IngestStatus status = existing.isPresent() ? IngestStatus.UPDATED : IngestStatus.INGESTED;
        try {
            conn.setAutoCommit(false);
            try {
                long docId = existing.isPresent()
                        ? replaceDocument(existing.get().docId(), filename, sha256, pages.size(), ingestedAt)
                        : insertDocument(path, filename, sha256, pages.size(), ingestedAt);
                insertPages(docId, pages);
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(e);
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Errore scrittura documento " + path + " (rollback eseguito)", e);
        }
        return status;
    }

    private long insertDocument(String path, String filename, String sha256, int pageCount, String ingestedAt)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("""
                INSERT INTO documents (path, filename, sha256, page_count, ingested_at)
                VALUES (?, ?, ?, ?, ?)
                """)) {
            ps.setString(1, path);
            ps.setString(2, filename);
            ps.setString(3, sha256);
            ps.setInt(4, pageCount);
            ps.setString(5, ingestedAt);
            ps.executeUpdate();
        }
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT last_insert_rowid()")) {
            if (!rs.next()) throw new SQLException("doc_id non disponibile dopo l'inserimento di " + path);
            return rs.getLong(1);
        }
    }

    private long replaceDocument(long docId, String filename, String sha256, int pageCount, String ingestedAt)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("""
                UPDATE documents
                SET filename = ?, sha256 = ?, page_count = ?, ingested_at = ?
                WHERE doc_id = ?
                """)) {
            ps.setString(1, filename);
            ps.setString(2, sha256);
            ps.setInt(3, pageCount);
            ps.setString(4, ingestedAt);
            ps.setLong(5, docId);
            ps.executeUpdate();
        }
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM pages WHERE doc_id = ?")) {
            ps.setLong(1, docId);
            ps.executeUpdate();
        }
        return docId;
    }

    private void insertPages(long docId, List<String> pages) throws SQLException {
        if (pages.isEmpty()) return;
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO pages (doc_id, page_index, text) VALUES (?, ?, ?)")) {
            for (int i = 0; i < pages.size(); i++) {
                ps.setLong(1, docId);
                ps.setInt(2, i);
                ps.setString(3, pages.get(i));
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private void rollbackQuietly(Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
            log.warn("Rollback fallito su {}: {}", dbPath, e.getMessage());
        }
    }

    /**
     * Tutte le pagine del database, ordinate per filename, page_index e path.
     * L'ordine non dipende dalla disposizione fisica delle righe: il ranking
     * lo usa come base per un tie-break riproducibile.
     */
    public List<StoredPage> loadAllPages() {
        List<StoredPage> result = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(SELECT_ALL_PAGES)) {
            while (rs.next()) {
                result.add(new StoredPage(
                        rs.getString("filename"),
                        rs.getString("path"),
                        rs.getInt("page_index"),
                        rs.getString("text")));
            }
        } catch (SQLException e) {
            throw new StoreException("Errore lettura pagine da " + dbPath, e);
        }
        return result;
    }

    /** Pagine di un singolo documento in ordine di indice. */
    public List<String> loadPageTexts(long docId) {
        List<String> result = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT text FROM pages WHERE doc_id = ? ORDER BY page_index ASC")) {
            ps.setLong(1, docId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) result.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new StoreException("Errore lettura pagine del documento " + docId, e);
        }
        return result;
    }

    public int countDocuments() {
        return count("SELECT COUNT(*) FROM documents");
    }

    public int countPages() {
        return count("SELECT COUNT(*) FROM pages");
    }

    private int count(String sql) {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StoreException("Errore conteggio su " + dbPath, e);
        }
    }

    @Override
    public void close() {
        try {
            if (!conn.isClosed()) conn.close();
        } catch (SQLException e) {
            log.warn("Errore chiusura connessione SQLite {}: {}", dbPath, e.getMessage());
        }
    }

    private StoredDocument toDocument(ResultSet rs) throws SQLException {
        return new StoredDocument(
                rs.getLong("doc_id"),
                rs.getString("path"),
                rs.getString("filename"),
                rs.getString("sha256"),
                rs.getInt("page_count"),
                rs.getString("ingested_at"));
    }
}
