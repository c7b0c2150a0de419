package com.themeboard.kr.refresh;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ExternalCrawlerJobTest {

    private static final ZoneId SEOUL = ZoneId.of("Asia/Seoul");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-05T06:30:00Z"), SEOUL);

    @TempDir
    Path root;

    @Test
    void runOnce_withoutCommandShouldFail() {
        ExternalCrawlerJob job = new ExternalCrawlerJob(root, List.of(), 5, SEOUL, CLOCK);

        assertThrows(IllegalStateException.class, job::runOnce);
    }

    @Test
    void runOnce_shouldExpandPlaceholdersAndCountCsvFiles() throws Exception {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")));
        ExternalCrawlerJob job = new ExternalCrawlerJob(root,
                List.of("/bin/sh", "-c", "echo a > '{out_dir}/1.A_1.csv'; echo b > '{out_dir}/2.B_{date}.csv'; echo done"),
                30, SEOUL, CLOCK);

        RefreshResult result = job.runOnce();

        assertEquals("240105", result.dateTag);
        assertEquals(root.resolve("240105").toString(), result.outDir);
        assertEquals(2, result.files);
        assertTrue(Files.exists(root.resolve("240105").resolve("2.B_240105.csv")));
        assertTrue(Files.readString(root.resolve("240105").resolve(ExternalCrawlerJob.CRAWLER_LOG)).contains("done"));
    }

    @Test
    void runOnce_nonZeroExitShouldFail() {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")));
        ExternalCrawlerJob job = new ExternalCrawlerJob(root, List.of("/bin/sh", "-c", "exit 3"), 30, SEOUL, CLOCK);

        IOException e = assertThrows(IOException.class, job::runOnce);
        assertTrue(e.getMessage().contains("code 3"));
    }

    @Test
    void runOnce_interruptedShouldKillChildProcess() throws Exception {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")));
        ExternalCrawlerJob job = new ExternalCrawlerJob(root,
                List.of("/bin/sh", "-c", "echo $$ > '{out_dir}/crawler.pid'; exec sleep 60"), 120, SEOUL, CLOCK);
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        Thread runner = new Thread(() -> {
            try {
                job.runOnce();
            } catch (Throwable t) {
                thrown.set(t);
            }
        });
        runner.start();

        Path pidFile = root.resolve("240105").resolve("crawler.pid");
        long deadline = System.currentTimeMillis() + 10_000L;
        while (System.currentTimeMillis() < deadline
                && (!Files.exists(pidFile) || Files.readString(pidFile).trim().isEmpty())) {
            Thread.sleep(20);
        }
        long pid = Long.parseLong(Files.readString(pidFile).trim());
        runner.interrupt();
        runner.join(10_000L);

        assertFalse(runner.isAlive());
        assertInstanceOf(InterruptedException.class, thrown.get());
        Optional<ProcessHandle> child = ProcessHandle.of(pid);
        if (child.isPresent()) {
            child.get().onExit().get(10, TimeUnit.SECONDS);
            assertFalse(child.get().isAlive());
        }
    }
}
