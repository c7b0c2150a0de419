package com.themeboard.app;

import com.themeboard.app.properties.LedgerProperties;
import com.themeboard.app.properties.RefreshProperties;
import com.themeboard.kr.calendar.TradingCalendarResolver;
import com.themeboard.kr.config.Config;
import com.themeboard.kr.data.DailyBarSource;
import com.themeboard.kr.data.KrxDailyBarClient;
import com.themeboard.kr.forward.ForwardReturnJoiner;
import com.themeboard.kr.insight.ThemeInsightService;
import com.themeboard.kr.ledger.ForwardFieldBackfiller;
import com.themeboard.kr.ledger.RecordLedger;
import com.themeboard.kr.query.ThemeQueryService;
import com.themeboard.kr.refresh.ExternalCrawlerJob;
import com.themeboard.kr.refresh.RefreshOrchestrator;
import com.themeboard.kr.refresh.SnapshotIngestionJob;
import com.themeboard.kr.theme.DominantInstrumentFilter;
import com.themeboard.kr.theme.ThemeRanker;
import com.themeboard.kr.theme.ThemeSnapshotStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@EnableConfigurationProperties({LedgerProperties.class, RefreshProperties.class})
public class ThemeBoardBootstrapConfig {
    @Bean
    public Config themeBoardConfig(Environment environment) {
        Map<String, Object> rawProperties = new LinkedHashMap<>(Binder.get(environment)
                .bind("", Bindable.mapOf(String.class, Object.class))
                .orElseGet(Map::of));
        String themeRoot = firstNonBlank(System.getenv("THEMEBOARD_THEME_ROOT"));
        if (!themeRoot.isEmpty()) {
            rawProperties.put("theme.root", themeRoot);
        }
        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        return Config.fromConfigurationProperties(workingDir, rawProperties);
    }

    @Bean
    public Clock themeBoardClock(Config config) {
        return Clock.system(ZoneId.of(config.getString("app.zone", "Asia/Seoul")));
    }

    @Bean
    @Lazy
    public DailyBarSource dailyBarSource(Config config) {
        return new KrxDailyBarClient(config);
    }

    @Bean
    @Lazy
    public TradingCalendarResolver tradingCalendarResolver(DailyBarSource source, Config config) {
        return new TradingCalendarResolver(source, config);
    }

    @Bean
    @Lazy
    public ForwardReturnJoiner forwardReturnJoiner(DailyBarSource source, TradingCalendarResolver calendar, Config config) {
        return new ForwardReturnJoiner(source, calendar, config);
    }

    @Bean
    public ThemeSnapshotStore themeSnapshotStore(Config config) {
        return new ThemeSnapshotStore(config);
    }

    @Bean
    public ThemeRanker themeRanker(ThemeSnapshotStore store, Config config) {
        return new ThemeRanker(store, new DominantInstrumentFilter(config));
    }

    @Bean
    public ThemeInsightService themeInsightService(ThemeRanker ranker, Config config) {
        return new ThemeInsightService(ranker, config.getInt("query.insights.max_entries", 20));
    }

    @Bean
    @Lazy
    public ForwardFieldBackfiller forwardFieldBackfiller(TradingCalendarResolver calendar, ForwardReturnJoiner joiner) {
        return new ForwardFieldBackfiller(calendar, joiner);
    }

    @Bean
    public RecordLedger recordLedger(
            LedgerProperties ledgerProperties,
            Config config,
            ForwardFieldBackfiller backfiller,
            Clock clock
    ) {
        return new RecordLedger(
                readLedgerPath(ledgerProperties, config),
                backfiller,
                ledgerProperties == null || ledgerProperties.isBackfillOnAppend(),
                clock
        );
    }

    @Bean
    public SnapshotIngestionJob snapshotIngestionJob(RefreshProperties refreshProperties, Config config, Clock clock) {
        return new ExternalCrawlerJob(
                config.getPath("theme.root"),
                refreshProperties.getCommand(),
                refreshProperties.getTimeoutSec(),
                clock.getZone(),
                clock
        );
    }

    @Bean
    public RefreshOrchestrator refreshOrchestrator(
            SnapshotIngestionJob job,
            RefreshProperties refreshProperties,
            ThemeSnapshotStore store,
            Clock clock
    ) {
        return new RefreshOrchestrator(
                job,
                refreshProperties.isEnabled(),
                refreshProperties.getToken(),
                clock,
                store::invalidateAll
        );
    }

    @Bean
    public ThemeQueryService themeQueryService(
            Config config,
            ThemeSnapshotStore store,
            ThemeRanker ranker,
            ForwardReturnJoiner joiner,
            ThemeInsightService insights,
            RecordLedger ledger,
            RefreshOrchestrator refresh
    ) {
        return new ThemeQueryService(config, store, ranker, joiner, insights, ledger, refresh);
    }

    private Path readLedgerPath(LedgerProperties ledgerProperties, Config config) {
        String raw = firstNonBlank(
                System.getenv("THEMEBOARD_RECORD_PATH"),
                ledgerProperties == null ? null : ledgerProperties.getPath()
        );
        if (raw.isEmpty()) {
            return config.getPath("theme.root").resolve("record.csv");
        }
        return config.workingDir().resolve(raw).normalize();
    }

    private String firstNonBlank(String... values) {
        if (values == null) {
            return "";
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return "";
    }
}
