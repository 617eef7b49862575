package com.binance.refdata;

import com.binance.refdata.model.SegmentProfile;

import java.nio.file.Path;
import java.util.Map;

public class Config {
    // ── Working files ─────────────────────────────────────────────────────────
    public final Path   tmpDir;
    public final String assetsFile;
    public final String csvDelimiter;

    // ── Install location ──────────────────────────────────────────────────────
    public final Path   apexHome;

    // ── Binance REST endpoints ────────────────────────────────────────────────
    public final String spotApi;
    public final String usdFuturesApi;
    public final String coinFuturesApi;
    public final int    httpTimeoutSec;

    public Config() {
        this(System.getenv());
    }

    public Config(Map<String, String> env) {
        this.tmpDir         = Path.of(env(env, "REFDATA_TMP_DIR", "tmp"));
        this.assetsFile     = env(env, "REFDATA_ASSETS_FILE", "binance_assets.csv");
        this.csvDelimiter   = env(env, "CSV_DELIMITER",       ",");
        this.apexHome       = Path.of(env(env, "APEX_HOME",   "."));
        this.spotApi        = env(env, "BINANCE_SPOT_API",    "https://api.binance.com");
        this.usdFuturesApi  = env(env, "BINANCE_USDFUT_API",  "https://fapi.binance.com");
        this.coinFuturesApi = env(env, "BINANCE_COINFUT_API", "https://dapi.binance.com");
        this.httpTimeoutSec = Integer.parseInt(env(env, "HTTP_TIMEOUT_S", "30"));
    }

    public String apiFor(SegmentProfile profile) {
        if (profile.equals(SegmentProfile.USD_FUTURES))  return usdFuturesApi;
        if (profile.equals(SegmentProfile.COIN_FUTURES)) return coinFuturesApi;
        return spotApi;
    }

    public Path documentPath(SegmentProfile profile) {
        return tmpDir.resolve(profile.documentFile());
    }

    public Path assetsPath() {
        return tmpDir.resolve(assetsFile);
    }

    private static String env(Map<String, String> env, String key, String defaultValue) {
        return env.getOrDefault(key, defaultValue);
    }
}
