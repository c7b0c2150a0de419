package com.themeboard.kr.ledger;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvException;
import com.themeboard.utils.DateCodes;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 模块说明：RecordLedger（class）。
 * 主要职责：record.csv 的追加、读取、删除与表头迁移；所有写操作由同一把写锁串行化。
 * 使用建议：整文件重写一律先写 .tmp 再替换，保证读者不会看到写了一半的文件。
 */
public class RecordLedger {
    private static final Logger LOG = LogManager.getLogger(RecordLedger.class);
    private static final DateTimeFormatter SAVED_AT_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final char BOM = '\uFEFF';

    private final Path path;
    private final ForwardFieldBackfiller backfiller;
    private final boolean backfillOnAppend;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();

    public RecordLedger(Path path, ForwardFieldBackfiller backfiller, boolean backfillOnAppend, Clock clock) {
        this.path = path;
        this.backfiller = backfiller;
        this.backfillOnAppend = backfillOnAppend && backfiller != null;
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
    }

    public Path path() {
        return path;
    }

    /**
     * Appends one row and returns it as written (identifier and timestamp assigned when absent).
     */
    public LedgerRecord append(LedgerRecord input) throws IOException {
        validate(input);
        LedgerRecord record = input;
        if (backfillOnAppend) {
            record = backfiller.backfill(record);
        }
        if (record.isBlank(LedgerColumn.RECORD_ID)) {
            record = record.with(LedgerColumn.RECORD_ID, newId());
        }
        if (record.isBlank(LedgerColumn.SAVED_AT)) {
            record = record.with(LedgerColumn.SAVED_AT, SAVED_AT_FMT.format(LocalDateTime.now(clock)));
        }

        writeLock.lock();
        try {
            migrateLocked();
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            boolean newFile = !Files.exists(path) || Files.size(path) == 0L;
            String[] header = newFile ? LedgerColumn.headerRow() : readTable().header;
            boolean needsNewline = !newFile && !endsWithNewline(path);
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                 CSVWriter csv = new CSVWriter(writer)) {
                if (newFile) {
                    writer.write(BOM);
                    csv.writeNext(header, false);
                } else if (needsNewline) {
                    writer.write(CSVWriter.DEFAULT_LINE_END);
                }
                csv.writeNext(toRow(header, record, null), false);
            }
        } finally {
            writeLock.unlock();
        }
        LOG.info("ledger append id={} code={} date={}", record.get(LedgerColumn.RECORD_ID),
                record.get(LedgerColumn.CODE), record.get(LedgerColumn.DATE));
        return record;
    }

    /**
     * All records sorted by date; rows without a recognisable date come last in either direction.
     * With {@code runBackfill}, empty forward fields are filled and the file is rewritten when
     * anything changed.
     */
    public LedgerListing list(boolean ascending, boolean runBackfill) throws IOException {
        List<LedgerRecord> records = new ArrayList<>();
        int fixed = 0;
        writeLock.lock();
        try {
            migrateLocked();
            if (!Files.exists(path) || Files.size(path) == 0L) {
                return new LedgerListing(List.of(), ascending, 0);
            }
            Table table = readTable();
            Map<LedgerColumn, Integer> index = table.index();
            for (String[] row : table.rows) {
                records.add(fromRow(index, row));
            }
            if (runBackfill && backfiller != null) {
                for (int i = 0; i < records.size(); i++) {
                    LedgerRecord before = records.get(i);
                    LedgerRecord after = backfiller.backfill(before);
                    if (!after.equals(before)) {
                        records.set(i, after);
                        table.rows.set(i, toRow(table.header, after, table.rows.get(i)));
                        fixed++;
                    }
                }
                if (fixed > 0) {
                    writeAtomically(table);
                    LOG.info("ledger backfill fixed rows={}", fixed);
                }
            }
        } finally {
            writeLock.unlock();
        }
        return new LedgerListing(sortByDate(records, ascending), ascending, fixed);
    }

    /**
     * Removes every row carrying {@code recordId}; returns how many were removed.
     */
    public int delete(String recordId) throws IOException {
        String id = recordId == null ? "" : recordId.trim();
        if (id.isEmpty()) {
            throw new IllegalArgumentException("record id is empty");
        }
        writeLock.lock();
        try {
            migrateLocked();
            if (!Files.exists(path) || Files.size(path) == 0L) {
                throw new RecordNotFoundException("ledger file does not exist: " + path);
            }
            Table table = readTable();
            Integer idIndex = table.index().get(LedgerColumn.RECORD_ID);
            if (idIndex == null) {
                throw new IOException("ledger has no " + LedgerColumn.RECORD_ID.header() + " column");
            }
            int before = table.rows.size();
            table.rows.removeIf(row -> id.equals(cell(row, idIndex)));
            int deleted = before - table.rows.size();
            if (deleted <= 0) {
                throw new RecordNotFoundException("record not found: " + id);
            }
            writeAtomically(table);
            LOG.info("ledger delete id={} rows={}", id, deleted);
            return deleted;
        } finally {
            writeLock.unlock();
        }
    }

    public MigrationOutcome migrate() throws IOException {
        writeLock.lock();
        try {
            return migrateLocked();
        } finally {
            writeLock.unlock();
        }
    }

    static List<LedgerRecord> sortByDate(List<LedgerRecord> records, boolean ascending) {
        Comparator<String> keyOrder = ascending ? Comparator.naturalOrder() : Comparator.reverseOrder();
        List<LedgerRecord> out = new ArrayList<>(records);
        out.sort((a, b) -> {
            String ka = DateCodes.sortKey(a.get(LedgerColumn.DATE));
            String kb = DateCodes.sortKey(b.get(LedgerColumn.DATE));
            if (ka.isEmpty() || kb.isEmpty()) {
                return Boolean.compare(ka.isEmpty(), kb.isEmpty());
            }
            return keyOrder.compare(ka, kb);
        });
        return out;
    }

    private MigrationOutcome migrateLocked() throws IOException {
        if (!Files.exists(path) || Files.size(path) == 0L) {
            return MigrationOutcome.ABSENT;
        }
        Table table = readTable();
        String[] schema = LedgerColumn.headerRow();
        if (Arrays.equals(table.header, schema)) {
            return MigrationOutcome.CURRENT;
        }
        Set<String> known = new HashSet<>(Arrays.asList(schema));
        for (String h : table.header) {
            if (!known.contains(h)) {
                LOG.warn("ledger header has unknown column '{}'; migration skipped", h);
                return MigrationOutcome.FOREIGN;
            }
        }
        Map<LedgerColumn, Integer> index = table.index();
        List<String[]> rows = new ArrayList<>(table.rows.size());
        int generated = 0;
        for (String[] row : table.rows) {
            LedgerRecord record = fromRow(index, row);
            if (record.isBlank(LedgerColumn.RECORD_ID)) {
                record = record.with(LedgerColumn.RECORD_ID, newId());
                generated++;
            }
            rows.add(toRow(schema, record, null));
        }
        writeAtomically(new Table(schema, rows));
        LOG.info("ledger migrated columns {} -> {} generated_ids={}", table.header.length, schema.length, generated);
        return MigrationOutcome.MIGRATED;
    }

    private Table readTable() throws IOException {
        List<String[]> lines;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVReader csv = new CSVReaderBuilder(reader)
                     .withCSVParser(new RFC4180ParserBuilder().build())
                     .build()) {
            lines = csv.readAll();
        } catch (CsvException e) {
            throw new IOException("ledger is not valid csv: " + e.getMessage(), e);
        }
        if (lines.isEmpty()) {
            return new Table(LedgerColumn.headerRow(), new ArrayList<>());
        }
        String[] header = lines.get(0);
        for (int i = 0; i < header.length; i++) {
            String h = header[i] == null ? "" : header[i];
            if (i == 0 && !h.isEmpty() && h.charAt(0) == BOM) {
                h = h.substring(1);
            }
            header[i] = h.trim();
        }
        List<String[]> rows = new ArrayList<>(Math.max(0, lines.size() - 1));
        for (int i = 1; i < lines.size(); i++) {
            String[] row = lines.get(i);
            if (row.length == 1 && row[0].trim().isEmpty()) {
                continue;
            }
            rows.add(row);
        }
        return new Table(header, rows);
    }

    private void writeAtomically(Table table) throws IOException {
        Path tmp = path.resolveSibling(path.getFileName().toString() + ".tmp");
        try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8);
             CSVWriter csv = new CSVWriter(writer)) {
            writer.write(BOM);
            csv.writeNext(table.header, false);
            for (String[] row : table.rows) {
                csv.writeNext(row, false);
            }
        }
        try {
            Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static boolean endsWithNewline(Path file) throws IOException {
        try (SeekableByteChannel channel = Files.newByteChannel(file, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size == 0L) {
                return true;
            }
            ByteBuffer last = ByteBuffer.allocate(1);
            channel.position(size - 1);
            channel.read(last);
            return last.get(0) == '\n';
        }
    }

    private static LedgerRecord fromRow(Map<LedgerColumn, Integer> index, String[] row) {
        Map<LedgerColumn, String> values = new EnumMap<>(LedgerColumn.class);
        for (Map.Entry<LedgerColumn, Integer> e : index.entrySet()) {
            values.put(e.getKey(), cell(row, e.getValue()));
        }
        return LedgerRecord.of(values);
    }

    /**
     * Lays the record out under {@code header}; columns outside the schema keep their value from
     * {@code previous} (or stay empty).
     */
    private static String[] toRow(String[] header, LedgerRecord record, String[] previous) {
        String[] out = new String[header.length];
        for (int i = 0; i < header.length; i++) {
            LedgerColumn column = LedgerColumn.fromHeader(header[i]);
            if (column != null) {
                out[i] = record.get(column);
            } else {
                out[i] = previous == null ? "" : cell(previous, i);
            }
        }
        return out;
    }

    private static String cell(String[] row, int idx) {
        if (row == null || idx < 0 || idx >= row.length || row[idx] == null) {
            return "";
        }
        return row[idx].trim();
    }

    private static void validate(LedgerRecord record) {
        if (record.isBlank(LedgerColumn.NAME) || record.isBlank(LedgerColumn.CODE)) {
            throw new IllegalArgumentException("name and code are required");
        }
        String date = record.get(LedgerColumn.DATE);
        if (!date.isEmpty()
                && !DateCodes.YYMMDD.matcher(date).matches()
                && !DateCodes.YYYYMMDD.matcher(date).matches()) {
            throw new IllegalArgumentException("date must be yymmdd or yyyymmdd: " + date);
        }
    }

    private static String newId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    private static final class Table {
        private final String[] header;
        private final List<String[]> rows;

        private Table(String[] header, List<String[]> rows) {
            this.header = header;
            this.rows = rows;
        }

        private Map<LedgerColumn, Integer> index() {
            Map<LedgerColumn, Integer> out = new EnumMap<>(LedgerColumn.class);
            for (int i = 0; i < header.length; i++) {
                LedgerColumn column = LedgerColumn.fromHeader(header[i]);
                if (column != null && !out.containsKey(column)) {
                    out.put(column, i);
                }
            }
            return out;
        }
    }
}
