package com.themeboard.kr.theme;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvException;
import com.themeboard.kr.config.Config;
import com.themeboard.kr.model.InstrumentRow;
import com.themeboard.kr.model.ThemeSnapshot;
import com.themeboard.utils.DateCodes;
import com.themeboard.utils.InstrumentCodes;
import com.themeboard.utils.Numbers;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 模块说明：ThemeSnapshotStore（class）。
 * 主要职责：读取 {@code <root>/<yymmdd>/*.csv} 主题快照；按 (路径, 大小, 修改时间) 缓存解析结果。
 * 使用建议：刷新任务成功后调用 invalidateAll。
 */
public class ThemeSnapshotStore {
    private static final Logger LOG = LogManager.getLogger(ThemeSnapshotStore.class);

    private final Path root;
    private final boolean cacheEnabled;
    private final List<String> housekeepingPrefixes;
    private final ConcurrentHashMap<Path, CachedSnapshot> cache = new ConcurrentHashMap<>();

    public ThemeSnapshotStore(Config config) {
        this(
                config.getPath("theme.root"),
                config.getBoolean("theme.cache.enabled", true),
                config.getList("theme.housekeeping_prefixes")
        );
    }

    public ThemeSnapshotStore(Path root, boolean cacheEnabled, List<String> housekeepingPrefixes) {
        this.root = root;
        this.cacheEnabled = cacheEnabled;
        this.housekeepingPrefixes = housekeepingPrefixes == null ? List.of() : List.copyOf(housekeepingPrefixes);
    }

    public Path root() {
        return root;
    }

    /**
     * Day directories in ascending order.
     */
    public List<String> listDays() {
        if (root == null || !Files.isDirectory(root)) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(root)) {
            for (Path p : stream) {
                String name = p.getFileName().toString();
                if (Files.isDirectory(p) && DateCodes.isDayCode(name)) {
                    out.add(name);
                }
            }
        } catch (IOException e) {
            LOG.warn("failed to list theme root {}: {}", root, e.getMessage());
            return List.of();
        }
        Collections.sort(out);
        return out;
    }

    public Optional<String> latestDay() {
        List<String> days = listDays();
        return days.isEmpty() ? Optional.empty() : Optional.of(days.get(days.size() - 1));
    }

    public boolean hasDay(String dayCode) {
        return DateCodes.isDayCode(dayCode) && Files.isDirectory(root.resolve(dayCode));
    }

    /**
     * Theme file names for one day, sorted, housekeeping files excluded.
     */
    public List<String> listThemeFiles(String dayCode) {
        if (!hasDay(dayCode)) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(root.resolve(dayCode))) {
            for (Path p : stream) {
                String name = p.getFileName().toString();
                if (Files.isRegularFile(p) && ThemeFileNames.isThemeCsv(name, housekeepingPrefixes)) {
                    out.add(name);
                }
            }
        } catch (IOException e) {
            LOG.warn("failed to list day {}: {}", dayCode, e.getMessage());
            return List.of();
        }
        Collections.sort(out);
        return out;
    }

    /**
     * Every readable theme of one day; unreadable files are logged and skipped.
     */
    public List<ThemeSnapshot> readDay(String dayCode) {
        List<ThemeSnapshot> out = new ArrayList<>();
        for (String filename : listThemeFiles(dayCode)) {
            try {
                out.add(read(dayCode, filename));
            } catch (IOException e) {
                LOG.warn("skip unreadable theme file {}/{}: {}", dayCode, filename, e.getMessage());
            }
        }
        return out;
    }

    public ThemeSnapshot read(String dayCode, String filename) throws IOException {
        Path path = root.resolve(dayCode).resolve(filename);
        long size = Files.size(path);
        long modified = Files.getLastModifiedTime(path).toMillis();
        if (cacheEnabled) {
            CachedSnapshot cached = cache.get(path);
            if (cached != null && cached.size == size && cached.modified == modified) {
                return cached.snapshot;
            }
        }
        ThemeSnapshot snapshot = parse(dayCode, filename, path);
        if (cacheEnabled) {
            cache.put(path, new CachedSnapshot(size, modified, snapshot));
        }
        return snapshot;
    }

    public void invalidateAll() {
        int size = cache.size();
        cache.clear();
        LOG.info("theme snapshot cache invalidated entries={}", size);
    }

    int cachedEntries() {
        return cache.size();
    }

    private ThemeSnapshot parse(String dayCode, String filename, Path path) throws IOException {
        List<String[]> lines;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVReader csv = new CSVReaderBuilder(reader)
                     .withCSVParser(new RFC4180ParserBuilder().build())
                     .build()) {
            lines = csv.readAll();
        } catch (CsvException e) {
            throw new IOException("malformed csv " + path.getFileName() + ": " + e.getMessage(), e);
        }
        String title = ThemeFileNames.title(filename);
        if (lines.isEmpty()) {
            return new ThemeSnapshot(dayCode, filename, title, false, List.of(), 0);
        }
        String[] header = lines.get(0);
        if (header.length > 0 && header[0] != null && header[0].startsWith("\uFEFF")) {
            header[0] = header[0].substring(1);
        }
        ThemeColumns columns = ThemeColumns.resolve(header);
        List<InstrumentRow> rows = new ArrayList<>(lines.size() - 1);
        int malformed = 0;
        for (int i = 1; i < lines.size(); i++) {
            String[] line = lines.get(i);
            if (isBlank(line)) {
                continue;
            }
            Map<String, String> raw = new LinkedHashMap<>();
            for (int c = 0; c < header.length; c++) {
                raw.put(header[c], c < line.length ? line[c] : "");
            }
            String tradeValue = columns.cell(line, ThemeColumn.TRADE_VALUE);
            if (!tradeValue.isEmpty() && Numbers.parsePlain(tradeValue) == null) {
                malformed++;
            }
            rows.add(new InstrumentRow(
                    columns.cell(line, ThemeColumn.NAME),
                    InstrumentCodes.normalize(columns.cell(line, ThemeColumn.CODE)),
                    columns.cell(line, ThemeColumn.CHANGE_RATE),
                    columns.cell(line, ThemeColumn.PRICE),
                    tradeValue,
                    columns.cell(line, ThemeColumn.VOLUME),
                    columns.cell(line, ThemeColumn.MARKET_CAP),
                    columns.cell(line, ThemeColumn.CHART_URL),
                    raw,
                    null
            ));
        }
        if (malformed > 0) {
            LOG.debug("theme {}/{} malformed trade-value cells={}", dayCode, filename, malformed);
        }
        return new ThemeSnapshot(dayCode, filename, title, columns.tradeValueInMillions(), rows, malformed);
    }

    private static boolean isBlank(String[] line) {
        if (line == null || line.length == 0) {
            return true;
        }
        for (String cell : line) {
            if (cell != null && !cell.trim().isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private static final class CachedSnapshot {
        private final long size;
        private final long modified;
        private final ThemeSnapshot snapshot;

        private CachedSnapshot(long size, long modified, ThemeSnapshot snapshot) {
            this.size = size;
            this.modified = modified;
            this.snapshot = snapshot;
        }
    }
}
