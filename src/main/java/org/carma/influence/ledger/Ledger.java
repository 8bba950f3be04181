package org.carma.influence.ledger;

import org.carma.influence.model.GridPoint;
import org.carma.influence.model.ResultRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The persisted result store: one CSV row per grid point.
 *
 * {@link #open} loads an existing file, or creates it with a header. Loading repairs
 * what an interrupted or concurrent earlier run may have left behind:
 * - a trailing line without its newline (a partial write) is dropped
 * - unreadable lines are dropped
 * - a second row for the same grid point is dropped, keeping an OK row over a FAILED one
 * - with {@code retryFailed}, FAILED rows are dropped so their points run again
 *
 * Any repair rewrites the file through a temporary sibling and an atomic move, so a
 * crash during the repair leaves either the old or the new file. Otherwise the file
 * is only ever appended to, through {@link #openWriter()}.
 */
public final class Ledger {

    private static final Logger log = LoggerFactory.getLogger(Ledger.class);

    private final Path path;
    private final ResultRowCodec codec;
    private final Map<GridPoint, ResultRow> rows;
    private final int droppedLines;

    private Ledger(Path path, ResultRowCodec codec, Map<GridPoint, ResultRow> rows, int droppedLines) {
        this.path = path;
        this.codec = codec;
        this.rows = Collections.unmodifiableMap(rows);
        this.droppedLines = droppedLines;
    }

    /**
     * Load or create the ledger at {@code path}.
     *
     * @param retryFailed drop FAILED rows so those grid points are pending again
     * @throws LedgerException if the file cannot be read or its header lacks key columns
     */
    public static Ledger open(Path path, boolean retryFailed) throws LedgerException {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(path) || Files.size(path) == 0) {
                ResultRowCodec codec = ResultRowCodec.standard();
                Files.writeString(path, codec.header(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
                log.info("Created ledger {}", path);
                return new Ledger(path, codec, new LinkedHashMap<>(), 0);
            }
            return load(path, retryFailed);
        } catch (LedgerException e) {
            throw e;
        } catch (IOException e) {
            throw new LedgerException("Cannot open ledger " + path + ": " + e.getMessage(), e);
        }
    }

    private static Ledger load(Path path, boolean retryFailed) throws IOException {
        String text = Files.readString(path, StandardCharsets.UTF_8);
        boolean terminated = text.endsWith("\n");
        List<String> lines = new ArrayList<>(List.of(text.split("\n", -1)));
        // last element: the empty tail after the final newline, or a partial line
        String tail = lines.remove(lines.size() - 1);
        int dropped = 0;
        if (lines.isEmpty()) {
            // header only, written without its newline
            lines.add(tail);
        } else if (!terminated) {
            log.warn("Dropping partial last line of {}: {}", path, abbreviate(tail));
            dropped++;
        }
        boolean rewrite = !terminated;

        List<String> columns = ResultRowCodec.parseHeader(stripCr(lines.get(0)));
        ResultRowCodec codec;
        try {
            codec = new ResultRowCodec(columns);
        } catch (IllegalArgumentException e) {
            throw new LedgerException("Ledger " + path + " has an unusable header: " + e.getMessage(), e);
        }

        Map<GridPoint, ResultRow> rows = new LinkedHashMap<>();
        Map<GridPoint, String> rowLines = new LinkedHashMap<>();

        for (int i = 1; i < lines.size(); i++) {
            String line = stripCr(lines.get(i));
            if (line.isBlank()) {
                rewrite = true;
                continue;
            }
            ResultRow row;
            try {
                row = codec.decode(line);
            } catch (IllegalArgumentException e) {
                log.warn("Dropping unreadable line {} of {}: {}", i + 1, path, abbreviate(line));
                dropped++;
                rewrite = true;
                continue;
            }
            ResultRow existing = rows.get(row.gridPoint());
            if (existing != null) {
                dropped++;
                rewrite = true;
                if (existing.isFailed() && !row.isFailed()) {
                    rows.put(row.gridPoint(), row);
                    rowLines.put(row.gridPoint(), line);
                }
                log.warn("Dropping duplicate row for {} in {}", row.gridPoint(), path);
                continue;
            }
            rows.put(row.gridPoint(), row);
            rowLines.put(row.gridPoint(), line);
        }

        if (retryFailed) {
            int before = rows.size();
            rows.values().removeIf(ResultRow::isFailed);
            rowLines.keySet().retainAll(rows.keySet());
            if (rows.size() != before) {
                log.info("Removed {} FAILED rows from {} for retry", before - rows.size(), path);
                dropped += before - rows.size();
                rewrite = true;
            }
        }

        if (rewrite || lines.size() - 1 != rows.size()) {
            rewrite(path, stripCr(lines.get(0)), rowLines.values());
        }
        log.info("Loaded ledger {} with {} rows ({} columns)", path, rows.size(), columns.size());
        return new Ledger(path, codec, rows, dropped);
    }

    private static void rewrite(Path path, String header, Iterable<String> lines) throws IOException {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        StringBuilder sb = new StringBuilder(header).append('\n');
        for (String line : lines) {
            sb.append(line).append('\n');
        }
        Files.writeString(tmp, sb.toString(), StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
            channel.force(true);
        }
        try {
            Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
        log.info("Rewrote ledger {} after repair", path);
    }

    /**
     * Open the single append handle for this ledger. Keys already present are refused.
     */
    public LedgerWriter openWriter() throws IOException {
        return openWriter(LedgerWriter.fileTarget(path));
    }

    LedgerWriter openWriter(LedgerWriter.AppendTarget target) {
        return new LedgerWriter(path, codec, rows.keySet(), target);
    }

    /**
     * Read every row of a ledger without repairing it.
     */
    public static List<ResultRow> readRows(Path path) throws IOException {
        List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        if (lines.isEmpty()) {
            return List.of();
        }
        ResultRowCodec codec = new ResultRowCodec(ResultRowCodec.parseHeader(lines.get(0)));
        List<ResultRow> result = new ArrayList<>();
        for (String line : lines.subList(1, lines.size())) {
            if (!line.isBlank()) {
                result.add(codec.decode(line));
            }
        }
        return result;
    }

    private static String stripCr(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private static String abbreviate(String s) {
        return s.length() <= 120 ? s : s.substring(0, 120) + "...";
    }

    // ========================================================================
    // ACCESSORS
    // ========================================================================

    public Path getPath() { return path; }
    public List<String> getColumns() { return codec.getColumns(); }
    public Map<GridPoint, ResultRow> getRows() { return rows; }
    public int getDroppedLines() { return droppedLines; }

    public Set<GridPoint> persistedKeys() {
        return rows.keySet();
    }

    public int size() {
        return rows.size();
    }

    @Override
    public String toString() {
        return String.format("Ledger[%s, rows=%d, columns=%d]", path, rows.size(), codec.getColumns().size());
    }
}
