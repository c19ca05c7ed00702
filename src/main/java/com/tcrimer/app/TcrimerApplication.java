package com.tcrimer.app;

import com.tcrimer.backtest.BacktestFailedException;
import com.tcrimer.cache.CacheStats;
import com.tcrimer.config.Config;
import com.tcrimer.core.CauseCode;
import com.tcrimer.core.Outcome;
import com.tcrimer.core.Params;
import com.tcrimer.db.DatabaseMaintenance;
import com.tcrimer.db.FallbackReplicator;
import com.tcrimer.indicator.IndicatorKind;
import com.tcrimer.indicator.IndicatorValue;
import com.tcrimer.model.BacktestResult;
import com.tcrimer.model.Trade;
import com.tcrimer.strategy.StrategyRegistry;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.io.IoBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class TcrimerApplication {
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    public static void main(String[] args) {
        int exit = new TcrimerApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("tcrimer", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help") || args == null || args.length == 0) {
            new HelpFormatter().printHelp("tcrimer", options);
            return 0;
        }

        if (cmd.hasOption("list-strategies")) {
            for (StrategyRegistry.Preset preset : new StrategyRegistry().presets()) {
                System.out.println(String.format(Locale.ROOT, "%-22s %s", preset.label(), preset.strategy().id()));
            }
            return 0;
        }

        Params params;
        try {
            String[] raw = cmd.getOptionValues("param");
            params = Params.parse(raw == null ? List.of() : Arrays.asList(raw));
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        try {
            Path workingDir = Path.of(".").toAbsolutePath().normalize();
            Config config = Config.load(workingDir);
            installLogRoutingIfNeeded(config);

            try (DataLayer layer = DataLayer.open(config, Clock.systemUTC())) {
                System.out.println("backend authoritative=" + layer.selector().current());
                if (cmd.hasOption("sync-fallback")) {
                    FallbackReplicator.SyncStats stats = layer.replicator().sync();
                    System.out.println("fallback sync completed.");
                    System.out.println("bars=" + stats.bars());
                    System.out.println("backtest_results=" + stats.backtestResults());
                    System.out.println("since=" + stats.since());
                    return 0;
                }
                if (cmd.hasOption("maintenance")) {
                    DatabaseMaintenance.Report report = cmd.hasOption("vacuum")
                            ? layer.maintenance().run(true)
                            : layer.maintenance().runIfDue();
                    System.out.println(report.skipped()
                            ? "maintenance skipped, last run " + report.lastRun()
                            : "maintenance done on " + report.product() + ": " + String.join("; ", report.statements()));
                    return 0;
                }
                if (cmd.hasOption("indicator")) {
                    return runIndicator(cmd, layer, params);
                }
                if (cmd.hasOption("backtest")) {
                    return runBacktest(cmd, layer, params);
                }
                if (cmd.hasOption("cache-stats")) {
                    printCacheStats(layer.cache().stats());
                    return 0;
                }
                new HelpFormatter().printHelp("tcrimer", options);
                return 2;
            }
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    private int runBacktest(CommandLine cmd, DataLayer layer, Params params) {
        String strategy = cmd.getOptionValue("strategy", "ma_crossover");
        String symbol = cmd.getOptionValue("symbol");
        if (symbol == null || symbol.isBlank()) {
            System.err.println("ERROR: --symbol is required for --backtest.");
            return 2;
        }
        Instant start;
        Instant end;
        try {
            LocalDate endDate = cmd.hasOption("end") ? LocalDate.parse(cmd.getOptionValue("end")) : LocalDate.now(ZoneOffset.UTC);
            LocalDate startDate = cmd.hasOption("start") ? LocalDate.parse(cmd.getOptionValue("start")) : endDate.minusYears(1);
            start = startDate.atStartOfDay().toInstant(ZoneOffset.UTC);
            end = endDate.atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            System.err.println("ERROR: --start/--end must be yyyy-MM-dd: " + e.getParsedString());
            return 2;
        }

        BacktestResult result;
        try {
            result = layer.backtests().runBacktest(strategy, symbol, start, end, params);
        } catch (BacktestFailedException e) {
            System.err.println("Backtest failed (" + e.reason() + "): " + e.getMessage());
            return e.reason() == BacktestFailedException.Reason.INVALID_PARAMS ? 2 : 1;
        }
        System.out.println("strategy=" + result.getStrategyId());
        System.out.println("symbol=" + result.getSymbol() + " timeframe=" + result.getTimeframe().code()
                + " bars=" + result.getBarCount());
        System.out.println("window=" + result.getStartTime() + " .. " + result.getEndTime());
        System.out.println(String.format(Locale.ROOT, "total_return=%.2f%% market_return=%.2f%% max_drawdown=%.2f%%",
                result.getTotalReturnPct() * 100.0, result.getMarketReturnPct() * 100.0, result.getMaxDrawdownPct() * 100.0));
        System.out.println(String.format(Locale.ROOT, "trades=%d win_rate=%.1f%% sharpe=%s",
                result.getTrades().size(), result.getWinRatePct() * 100.0,
                result.isSharpeDefined() ? String.format(Locale.ROOT, "%.3f", result.getSharpeRatio()) : "n/a"));
        for (Trade trade : result.getTrades()) {
            System.out.println(String.format(Locale.ROOT, "  %s @ %.4f -> %s @ %.4f pnl=%.4f",
                    trade.getEntryTime(), trade.getEntryPrice(), trade.getExitTime(), trade.getExitPrice(), trade.getPnl()));
        }
        return 0;
    }

    private int runIndicator(CommandLine cmd, DataLayer layer, Params params) {
        String symbol = cmd.getOptionValue("symbol");
        if (symbol == null || symbol.isBlank()) {
            System.err.println("ERROR: --symbol is required for --indicator.");
            return 2;
        }
        IndicatorKind kind;
        try {
            kind = IndicatorKind.fromCode(cmd.getOptionValue("indicator"));
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }
        Outcome<IndicatorValue> out = layer.indicators().getIndicator(kind, symbol, params);
        if (!out.success) {
            System.err.println("Indicator unavailable: " + out.causeCode + " " + out.details);
            return out.causeCode == CauseCode.INVALID_PARAMS ? 2 : 1;
        }
        IndicatorValue value = out.value;
        System.out.println(kind.code() + " " + value.symbol() + " as_of=" + value.asOf());
        for (Map.Entry<String, Double> entry : value.components().entrySet()) {
            System.out.println(String.format(Locale.ROOT, "  %s=%.6f", entry.getKey(), entry.getValue()));
        }
        return 0;
    }

    private void printCacheStats(CacheStats stats) {
        for (Map.Entry<String, Object> entry : stats.toFields().entrySet()) {
            System.out.println(entry.getKey() + "=" + entry.getValue());
        }
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (TcrimerApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("tcrimer.log.dir", logDir.toAbsolutePath().toString());

                // Log4j context must exist before the swap so the console appender keeps the real streams.
                LogManager.getLogger(TcrimerApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("backtest").desc("run a backtest (or show the stored result) and print the summary").build());
        options.addOption(Option.builder().longOpt("strategy").hasArg().argName("id").desc("strategy name or canonical id, e.g. ma_crossover or rsi_threshold(period=7)").build());
        options.addOption(Option.builder().longOpt("symbol").hasArg().argName("symbol").desc("instrument symbol").build());
        options.addOption(Option.builder().longOpt("start").hasArg().argName("yyyy-MM-dd").desc("first day of the window (default: one year before end)").build());
        options.addOption(Option.builder().longOpt("end").hasArg().argName("yyyy-MM-dd").desc("last day of the window (default: today UTC)").build());
        options.addOption(Option.builder().longOpt("param").hasArg().argName("name=value").desc("strategy or indicator parameter, repeatable").build());
        options.addOption(Option.builder().longOpt("indicator").hasArg().argName("kind").desc("print the latest sma|ema|rsi|macd|bollinger|atr value").build());
        options.addOption(Option.builder().longOpt("list-strategies").desc("list preset strategies").build());
        options.addOption(Option.builder().longOpt("sync-fallback").desc("copy rows written to the fallback store back into the primary, then exit").build());
        options.addOption(Option.builder().longOpt("cache-stats").desc("print cache counters").build());
        options.addOption(Option.builder().longOpt("maintenance").desc("refresh planner statistics on the authoritative store unless done recently").build());
        options.addOption(Option.builder().longOpt("vacuum").desc("with --maintenance: run now and also reclaim space").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
