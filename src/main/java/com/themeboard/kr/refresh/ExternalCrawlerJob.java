package com.themeboard.kr.refresh;

import com.themeboard.utils.DateCodes;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the configured crawler command for today's directory. Placeholders: {@code {out_dir}},
 * {@code {date}} (yymmdd) and {@code {root}}.
 */
public class ExternalCrawlerJob implements SnapshotIngestionJob {
    private static final Logger LOG = LogManager.getLogger(ExternalCrawlerJob.class);
    static final String CRAWLER_LOG = "00_crawler.log";

    private final Path themeRoot;
    private final List<String> commandTemplate;
    private final long timeoutSec;
    private final ZoneId zone;
    private final Clock clock;

    public ExternalCrawlerJob(Path themeRoot, List<String> commandTemplate, long timeoutSec, ZoneId zone, Clock clock) {
        this.themeRoot = themeRoot;
        this.commandTemplate = commandTemplate == null ? List.of() : List.copyOf(commandTemplate);
        this.timeoutSec = Math.max(1L, timeoutSec);
        this.zone = zone == null ? ZoneId.of("Asia/Seoul") : zone;
        this.clock = clock == null ? Clock.system(this.zone) : clock;
    }

    @Override
    public RefreshResult runOnce() throws IOException, InterruptedException {
        if (commandTemplate.isEmpty()) {
            throw new IllegalStateException("refresh command is not configured");
        }
        String dateTag = DateCodes.formatDay(LocalDate.now(clock.withZone(zone)));
        Path outDir = themeRoot.resolve(dateTag);
        Files.createDirectories(outDir);

        List<String> command = new ArrayList<>(commandTemplate.size());
        for (String part : commandTemplate) {
            command.add(part
                    .replace("{out_dir}", outDir.toString())
                    .replace("{date}", dateTag)
                    .replace("{root}", themeRoot.toString()));
        }
        long t0 = System.nanoTime();
        LOG.info("crawler start date={} cmd={}", dateTag, command);
        Process process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.appendTo(outDir.resolve(CRAWLER_LOG).toFile()))
                .start();
        boolean exited;
        try {
            exited = process.waitFor(timeoutSec, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            LOG.warn("crawler interrupted, child process killed date={}", dateTag);
            throw e;
        }
        if (!exited) {
            process.destroyForcibly();
            throw new IOException("crawler timed out after " + timeoutSec + "s");
        }
        int exit = process.exitValue();
        if (exit != 0) {
            throw new IOException("crawler exited with code " + exit);
        }
        double seconds = (System.nanoTime() - t0) / 1_000_000_000.0;
        int files = countCsv(outDir);
        LOG.info("crawler done date={} files={} seconds={}", dateTag, files, String.format("%.1f", seconds));
        return new RefreshResult(dateTag, outDir.toString(), Math.round(seconds * 100.0) / 100.0, files);
    }

    static int countCsv(Path dir) throws IOException {
        int count = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.csv")) {
            for (Path ignored : stream) {
                count++;
            }
        }
        return count;
    }
}
