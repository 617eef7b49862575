package com.binance.refdata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads exchangeInfo fixtures from {@code src/test/resources/binance}.
 */
public final class Fixtures {

    public static final String SPOT    = "/binance/binance_exchange-info.json";
    public static final String USDFUT  = "/binance/binance_usdfut_exchange-info.json";
    public static final String COINFUT = "/binance/binance_coinfut_exchange-info.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Fixtures() {}

    public static String text(String resource) {
        try (InputStream is = Fixtures.class.getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException("Resource not found on classpath: " + resource);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading " + resource, e);
        }
    }

    public static JsonNode json(String resource) {
        return parse(text(resource));
    }

    public static JsonNode parse(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed parsing inline fixture", e);
        }
    }

    /** Copies the three fixture documents into {@code dir} under their fetched file names. */
    public static void copyDocumentsTo(Path dir) throws IOException {
        Files.createDirectories(dir);
        for (String resource : new String[] {SPOT, USDFUT, COINFUT}) {
            String name = resource.substring(resource.lastIndexOf('/') + 1);
            Files.writeString(dir.resolve(name), text(resource), StandardCharsets.UTF_8);
        }
    }
}
