package com.themeboard.app;

import com.themeboard.app.properties.RefreshProperties;
import com.themeboard.kr.config.Config;
import com.themeboard.kr.ledger.RecordNotFoundException;
import com.themeboard.kr.query.SnapshotNotFoundException;
import com.themeboard.kr.query.ThemeQueryService;
import com.themeboard.kr.refresh.TriggerResult;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionGroup;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.boot.Banner;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 模块说明：ThemeBoardApplication（class）。
 * 主要职责：命令行入口；启动 Spring 上下文、安装 Log4j 输出路由、分发命令并以 JSON 打印结果。
 * 使用建议：退出码 0=成功 1=致命错误 2=参数错误 3=冲突/被拒绝 4=未找到。
 */
public final class ThemeBoardApplication {
    private static final Logger LOG = LogManager.getLogger(ThemeBoardApplication.class);
    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_CONFLICT = 3;
    static final int EXIT_NOT_FOUND = 4;

    private static volatile boolean LOG_ROUTE_INSTALLED = false;
    private final PrintStream resultOut;

    public ThemeBoardApplication() {
        this(System.out);
    }

    ThemeBoardApplication(PrintStream resultOut) {
        this.resultOut = resultOut;
    }

    public static void main(String[] args) {
        int exit = new ThemeBoardApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("themeboard", options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("themeboard", options);
            return EXIT_OK;
        }

        System.setProperty("org.springframework.boot.logging.LoggingSystem", "none");
        try (ConfigurableApplicationContext context = new SpringApplicationBuilder(ThemeBoardBootstrapConfig.class)
                .web(WebApplicationType.NONE)
                .bannerMode(Banner.Mode.OFF)
                .logStartupInfo(false)
                .run()) {
            Config config = context.getBean(Config.class);
            installLogRoutingIfNeeded(config);
            ThemeQueryService queries = context.getBean(ThemeQueryService.class);
            RefreshProperties refreshProperties = context.getBean(RefreshProperties.class);
            return dispatch(cmd, queries, refreshProperties.getTimeoutSec());
        } catch (IllegalArgumentException | JSONException e) {
            printError("bad_request", e.getMessage());
            return EXIT_USAGE;
        } catch (SnapshotNotFoundException | RecordNotFoundException e) {
            printError("not_found", e.getMessage());
            return EXIT_NOT_FOUND;
        } catch (Exception e) {
            LOG.error("command failed", e);
            printError("fatal", e.getMessage());
            return EXIT_FATAL;
        }
    }

    private int dispatch(CommandLine cmd, ThemeQueryService queries, long refreshTimeoutSec) throws Exception {
        boolean exclude = cmd.hasOption("exclude-dominant");
        String date = cmd.getOptionValue("date");
        String sort = cmd.getOptionValue("sort");

        if (cmd.hasOption("themes")) {
            print(queries.themes(date, exclude, sort, intOption(cmd, "limit"), intOption(cmd, "preview")));
            return EXIT_OK;
        }
        if (cmd.hasOption("theme-detail")) {
            int rank = Integer.parseInt(cmd.getOptionValue("theme-detail").trim());
            print(queries.themeDetail(rank, date, exclude, sort));
            return EXIT_OK;
        }
        if (cmd.hasOption("insights")) {
            print(queries.insightsSummary(intOption(cmd, "lookback"), intOption(cmd, "top-n"), exclude));
            return EXIT_OK;
        }
        if (cmd.hasOption("theme-history")) {
            print(queries.themeHistory(cmd.getOptionValue("theme-history"), intOption(cmd, "lookback"), exclude));
            return EXIT_OK;
        }
        if (cmd.hasOption("ledger")) {
            print(queries.ledger(cmd.getOptionValue("order", "desc"), cmd.hasOption("fix")));
            return EXIT_OK;
        }
        if (cmd.hasOption("ledger-add")) {
            JSONObject payload = new JSONObject(cmd.getOptionValue("ledger-add"));
            print(queries.addLedgerRecord(payload.toMap()));
            return EXIT_OK;
        }
        if (cmd.hasOption("ledger-delete")) {
            print(queries.deleteLedgerRecord(cmd.getOptionValue("ledger-delete")));
            return EXIT_OK;
        }
        if (cmd.hasOption("refresh")) {
            return runRefresh(cmd, queries, refreshTimeoutSec);
        }
        if (cmd.hasOption("refresh-status")) {
            print(queries.refreshStatus());
            return EXIT_OK;
        }
        print(queries.status());
        return EXIT_OK;
    }

    /**
     * The worker is a daemon thread, so the CLI waits for it before the JVM exits.
     */
    private int runRefresh(CommandLine cmd, ThemeQueryService queries, long refreshTimeoutSec) throws InterruptedException {
        TriggerResult result = queries.triggerRefresh(cmd.getOptionValue("token", ""));
        JSONObject out = new JSONObject();
        out.put("trigger", queries.refreshResponse(result));
        if (!result.started()) {
            out.put("state", queries.refreshStatus());
            print(out);
            return EXIT_CONFLICT;
        }
        long waitSec = cmd.hasOption("wait")
                ? Long.parseLong(cmd.getOptionValue("wait").trim())
                : refreshTimeoutSec;
        boolean idle = queries.refresh().awaitIdle(Math.max(1L, waitSec) * 1000L);
        out.put("finished", idle);
        out.put("state", queries.refreshStatus());
        print(out);
        if (!idle) {
            return EXIT_OK;
        }
        return queries.refresh().status().lastError.isEmpty() ? EXIT_OK : EXIT_FATAL;
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED || !config.getBoolean("app.log_routing", true)) {
            return;
        }
        synchronized (ThemeBoardApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("themeboard.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(ThemeBoardApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                LOG.info("Log4j routing enabled. dir={}", logDir.toAbsolutePath());
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private void print(JSONObject body) {
        resultOut.println(body.toString(2));
        resultOut.flush();
    }

    private void printError(String kind, String message) {
        JSONObject body = new JSONObject();
        body.put("ok", false);
        body.put("error", kind);
        body.put("message", message == null ? "" : message);
        print(body);
    }

    private static Integer intOption(CommandLine cmd, String name) {
        String raw = cmd.getOptionValue(name);
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        return Integer.parseInt(raw.trim());
    }

    private Options buildOptions() {
        Options options = new Options();
        OptionGroup commands = new OptionGroup();
        commands.addOption(Option.builder().longOpt("status").desc("theme root, snapshot days and refresh state (default)").build());
        commands.addOption(Option.builder().longOpt("themes").desc("ranked themes with preview rows").build());
        commands.addOption(Option.builder().longOpt("theme-detail").hasArg().argName("rank").desc("all rows of the theme at rank").build());
        commands.addOption(Option.builder().longOpt("insights").desc("hottest and rising themes over the lookback window").build());
        commands.addOption(Option.builder().longOpt("theme-history").hasArg().argName("title").desc("per-day rank of themes whose title contains the text").build());
        commands.addOption(Option.builder().longOpt("ledger").desc("list record ledger").build());
        commands.addOption(Option.builder().longOpt("ledger-add").hasArg().argName("json").desc("append one record (JSON payload)").build());
        commands.addOption(Option.builder().longOpt("ledger-delete").hasArg().argName("id").desc("delete record by id").build());
        commands.addOption(Option.builder().longOpt("refresh").desc("run snapshot ingestion (single-flight)").build());
        commands.addOption(Option.builder().longOpt("refresh-status").desc("current refresh state").build());
        options.addOptionGroup(commands);

        options.addOption(Option.builder().longOpt("date").hasArg().argName("yymmdd").desc("snapshot day; enables next-day returns").build());
        options.addOption(Option.builder().longOpt("exclude-dominant").desc("drop dominant large caps before ranking").build());
        options.addOption(Option.builder().longOpt("sort").hasArg().argName("key").desc("row sort: changerate, trade_value, volume").build());
        options.addOption(Option.builder().longOpt("limit").hasArg().argName("n").desc("number of themes").build());
        options.addOption(Option.builder().longOpt("preview").hasArg().argName("n").desc("preview rows per theme").build());
        options.addOption(Option.builder().longOpt("lookback").hasArg().argName("days").desc("snapshot days to analyse").build());
        options.addOption(Option.builder().longOpt("top-n").hasArg().argName("n").desc("rank cut-off for insights").build());
        options.addOption(Option.builder().longOpt("order").hasArg().argName("asc|desc").desc("ledger order by date").build());
        options.addOption(Option.builder().longOpt("fix").desc("backfill empty next-day fields while listing the ledger").build());
        options.addOption(Option.builder().longOpt("wait").hasArg().argName("sec").desc("max seconds to wait for a refresh").build());
        options.addOption(Option.builder().longOpt("token").hasArg().argName("token").desc("refresh token when one is configured").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
