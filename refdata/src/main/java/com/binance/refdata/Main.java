package com.binance.refdata;

import com.binance.refdata.http.ExchangeInfoFetcher;
import com.binance.refdata.install.AssetFileInstaller;
import com.binance.refdata.model.InstrumentRecord;
import com.binance.refdata.model.SegmentProfile;
import com.binance.refdata.parse.DiagnosticSink;
import com.binance.refdata.parse.RefDataParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK      = 0;
    static final int EXIT_FAILED  = 1;
    static final int EXIT_USAGE   = 2;

    // Futures first, spot last
    private static final List<SegmentProfile> FETCH_ORDER = List.of(
            SegmentProfile.USD_FUTURES, SegmentProfile.COIN_FUTURES, SegmentProfile.SPOT);

    public static void main(String[] args) {
        System.exit(run(args, new Config()));
    }

    static int run(String[] args, Config config) {
        logPreamble(args);
        if (args.length != 1) {
            usage();
            return EXIT_USAGE;
        }
        try {
            switch (args[0]) {
                case "fetch":
                    fetch(config);
                    break;
                case "parse":
                    parse(config);
                    break;
                case "install":
                    install(config);
                    break;
                case "generate":
                    generate(config);
                    break;
                default:
                    usage();
                    return EXIT_USAGE;
            }
        } catch (RefDataException | UncheckedIOException e) {
            log.error("refdata.failed command={} error={}", args[0], e.getMessage(), e);
            return EXIT_FAILED;
        }
        log.info("refdata.done command={}", args[0]);
        return EXIT_OK;
    }

    static void fetch(Config config) {
        ExchangeInfoFetcher fetcher = new ExchangeInfoFetcher(config);
        for (SegmentProfile profile : FETCH_ORDER) {
            fetcher.fetchTo(profile, config.documentPath(profile));
        }
    }

    static List<InstrumentRecord> parse(Config config) {
        DiagnosticSink diagnostics = new DiagnosticSink();
        RefDataParser  parser      = new RefDataParser(diagnostics, config.csvDelimiter);
        List<InstrumentRecord> records = parser.run(config.tmpDir, config.assetsPath());
        log.info("refdata.parsed records={} diagnostics={}", records.size(), diagnostics.emitted().size());
        return records;
    }

    static Path install(Config config) {
        log.info("refdata.install apex_home={}", config.apexHome);
        return new AssetFileInstaller(config.apexHome).install(config.assetsPath(), LocalDate.now());
    }

    static void generate(Config config) {
        clean(config);
        fetch(config);
        parse(config);
        install(config);
    }

    // Stale inputs must not survive a failed fetch and get parsed again
    static void clean(Config config) {
        try {
            Files.createDirectories(config.tmpDir);
            for (SegmentProfile profile : FETCH_ORDER) {
                deleteStale(config.documentPath(profile));
            }
            deleteStale(config.assetsPath());
        } catch (IOException e) {
            throw new UncheckedIOException("failed cleaning " + config.tmpDir, e);
        }
    }

    private static void deleteStale(Path file) throws IOException {
        if (Files.deleteIfExists(file)) {
            log.info("refdata.removed path={}", file);
        }
    }

    private static void usage() {
        log.error("usage: refdata <fetch|parse|install|generate>");
    }

    private static void logPreamble(String[] args) {
        log.info("======================================================================");
        log.info("bin : refdata");
        log.info("args: {}", Arrays.toString(args));
        log.info("cwd : {}", Paths.get("").toAbsolutePath());
        log.info("pid : {}", ProcessHandle.current().pid());
        log.info("ppid: {}", ProcessHandle.current().parent().map(ProcessHandle::pid).orElse(-1L));
        log.info("======================================================================");
    }
}
