package com.binance.refdata.install;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class AssetFileInstallerTest {

    @Test
    void installsDatedCopyAndLinksLatest(@TempDir Path apexHome, @TempDir Path tmp) throws Exception {
        Path csv = Files.writeString(tmp.resolve("binance_assets.csv"), "instId\nBTC/USDT.BNC\n");
        AssetFileInstaller installer = new AssetFileInstaller(apexHome);

        Path installed = installer.install(csv, LocalDate.of(2024, 3, 22));

        assertThat(installed).isEqualTo(apexHome.resolve("data/refdata/assets/20240322/assets-20240322.csv"));
        assertThat(Files.readString(installed)).isEqualTo("instId\nBTC/USDT.BNC\n");

        Path latest = installer.assetsDir().resolve(AssetFileInstaller.LATEST_LINK);
        assertThat(Files.isSymbolicLink(latest)).isTrue();
        assertThat(Files.readString(latest)).isEqualTo("instId\nBTC/USDT.BNC\n");
    }

    @Test
    void laterInstallRepointsLatest(@TempDir Path apexHome, @TempDir Path tmp) throws Exception {
        AssetFileInstaller installer = new AssetFileInstaller(apexHome);
        Path csv = tmp.resolve("binance_assets.csv");

        Files.writeString(csv, "day1\n");
        installer.install(csv, LocalDate.of(2024, 3, 21));
        Files.writeString(csv, "day2\n");
        Path second = installer.install(csv, LocalDate.of(2024, 3, 22));

        Path latest = installer.assetsDir().resolve(AssetFileInstaller.LATEST_LINK);
        assertThat(Files.readSymbolicLink(latest)).isEqualTo(second.toAbsolutePath());
        assertThat(Files.readString(latest)).isEqualTo("day2\n");
        assertThat(Files.readString(installer.assetsDir().resolve("20240321/assets-20240321.csv"))).isEqualTo("day1\n");
    }
}
