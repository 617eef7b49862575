package com.binance.refdata.install;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Publishes a generated assets CSV under
 * {@code <apexHome>/data/refdata/assets/<yyyyMMdd>/assets-<yyyyMMdd>.csv}
 * and repoints {@code assets-latest.csv} in the assets directory at it.
 */
public class AssetFileInstaller {

    private static final Logger log = LoggerFactory.getLogger(AssetFileInstaller.class);

    private static final DateTimeFormatter DAY = DateTimeFormatter.BASIC_ISO_DATE;

    static final String LATEST_LINK = "assets-latest.csv";

    private final Path assetsDir;

    public AssetFileInstaller(Path apexHome) {
        this.assetsDir = apexHome.resolve("data").resolve("refdata").resolve("assets");
    }

    public Path assetsDir() {
        return assetsDir;
    }

    /**
     * @return the installed dated copy
     */
    public Path install(Path csvFile, LocalDate date) {
        String day = date.format(DAY);
        Path target = assetsDir.resolve(day).resolve("assets-" + day + ".csv");
        Path latest = assetsDir.resolve(LATEST_LINK);
        try {
            Files.createDirectories(target.getParent());
            Files.copy(csvFile, target, StandardCopyOption.REPLACE_EXISTING);
            log.info("refdata.installed from={} to={}", csvFile, target);

            Files.deleteIfExists(latest);
            Files.createSymbolicLink(latest, target.toAbsolutePath());
            log.info("refdata.linked link={} target={}", latest, target);
        } catch (IOException e) {
            throw new UncheckedIOException("failed installing " + csvFile + " into " + assetsDir, e);
        }
        return target;
    }
}
