package com.pipeline.anomaly;

import com.pipeline.anomaly.exception.ConfigIncompleteException;
import com.pipeline.anomaly.exception.InsufficientDataException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class AnomalyDetectionApplicationTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path storage;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private AnomalyDetectionApplication app;

    @AfterEach
    void tearDown() {
        if (app != null) {
            app.shutdown();
        }
    }

    private AnomalyDetectionApplication newApp(Properties props) {
        app = new AnomalyDetectionApplication(AppConfig.fromProperties(props),
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
        return app;
    }

    private Properties sqliteProps() {
        Properties props = new Properties();
        props.setProperty("store.endpoint", "sqlite:" + storage);
        props.setProperty("store.token", "local");
        props.setProperty("store.org", "local");
        props.setProperty("store.bucket", "sensores");
        return props;
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void runGeneratesStoresAndReportsAnomalies() throws InterruptedException {
        AnomalyDetectionApplication app = newApp(sqliteProps());
        app.start(CLOCK);

        assertEquals(0, app.execute(List.of("run", "100", "2")));

        String out = output();
        assertTrue(out.contains("Generated and wrote 100 sample reading(s)."), out);
        assertTrue(out.contains("Readings analysed: 100"), out);
        assertTrue(out.contains("Total anomalies detected: "), out);
    }

    @Test
    void detectFiltersByLocation() throws InterruptedException {
        AnomalyDetectionApplication app = newApp(sqliteProps());
        app.start(CLOCK);
        app.execute(List.of("generate", "30"));

        assertEquals(0, app.execute(List.of("detect", "1", "Fabrica")));
        assertTrue(output().contains("Readings analysed: 30"), output());

        assertThrows(InsufficientDataException.class, () -> app.execute(List.of("detect", "1", "Oficina")));
    }

    @Test
    void detectListsEachFlaggedReading() throws InterruptedException {
        AnomalyDetectionApplication app = newApp(sqliteProps());
        app.start(CLOCK);
        app.execute(List.of("generate", "50"));
        buffer.reset();

        app.execute(List.of("detect", "1"));

        String out = output();
        Matcher total = Pattern.compile("Total anomalies detected: (\\d+)").matcher(out);
        assertTrue(total.find(), out);
        long listed = out.lines().filter(line -> line.startsWith("  Reading{")).count();
        assertEquals(Long.parseLong(total.group(1)), listed);
        assertTrue(listed > 0, out);
    }

    @Test
    void malformedConfigFileExitsWithReadableError() throws IOException {
        Path file = storage.resolve("bad.properties");
        Files.writeString(file, "store.endpoint=sqlite:" + storage.resolve("data") + "\n"
                + "store.token=local\nstore.org=local\nstore.bucket=sensores\n"
                + "generator.samples=many\n");
        ByteArrayOutputStream errBuffer = new ByteArrayOutputStream();

        int exitCode = AnomalyDetectionApplication.run(List.of("--config", file.toString(), "generate"),
                CLOCK, new PrintStream(buffer, true, StandardCharsets.UTF_8),
                new PrintStream(errBuffer, true, StandardCharsets.UTF_8));

        assertEquals(1, exitCode);
        String err = errBuffer.toString(StandardCharsets.UTF_8);
        assertTrue(err.startsWith("Error: "), err);
        assertTrue(err.contains("many"), err);
    }

    @Test
    void runEntryPointExecutesCommandAndReturnsZero() throws IOException {
        Path file = storage.resolve("app.properties");
        Files.writeString(file, "store.endpoint=sqlite:" + storage.resolve("data") + "\n"
                + "store.token=local\nstore.org=local\nstore.bucket=sensores\n");

        int exitCode = AnomalyDetectionApplication.run(List.of("--config", file.toString(), "run", "40", "1"),
                CLOCK, new PrintStream(buffer, true, StandardCharsets.UTF_8), System.err);

        assertEquals(0, exitCode);
        assertTrue(output().contains("Readings analysed: 40"), output());
    }

    @Test
    void unknownCommandPrintsUsage() throws InterruptedException {
        AnomalyDetectionApplication app = newApp(sqliteProps());
        app.start(CLOCK);

        assertEquals(2, app.execute(List.of("purge")));
        assertTrue(output().contains("Usage:"));
    }

    @Test
    void nonNumericArgumentIsRejected() {
        AnomalyDetectionApplication app = newApp(sqliteProps());
        app.start(CLOCK);

        assertThrows(IllegalArgumentException.class, () -> app.execute(List.of("generate", "lots")));
    }

    @Test
    void incompleteStoreConfigFailsAtStartup() {
        Properties props = sqliteProps();
        props.remove("store.token");

        ConfigIncompleteException e = assertThrows(ConfigIncompleteException.class,
                () -> newApp(props).start(CLOCK));
        assertEquals(List.of("credential"), e.getMissingFields());
    }

    @Test
    void invalidDetectorSettingFailsAtStartup() {
        Properties props = sqliteProps();
        props.setProperty("detector.contamination", "0.9");

        assertThrows(IllegalArgumentException.class, () -> newApp(props).start(CLOCK));
    }
}
