package com.pipeline.anomaly;

import com.pipeline.anomaly.collector.KafkaReadingCollector;
import com.pipeline.anomaly.core.AnomalyPipeline;
import com.pipeline.anomaly.core.TimeSeriesStore;
import com.pipeline.anomaly.core.impl.DefaultAnomalyPipeline;
import com.pipeline.anomaly.detector.IsolationForestDetector;
import com.pipeline.anomaly.exception.ConfigIncompleteException;
import com.pipeline.anomaly.exception.DetectionException;
import com.pipeline.anomaly.exception.StoreException;
import com.pipeline.anomaly.generator.SyntheticReadingGenerator;
import com.pipeline.anomaly.model.DetectionResult;
import com.pipeline.anomaly.model.GeneratedBatch;
import com.pipeline.anomaly.model.Reading;
import com.pipeline.anomaly.storage.TimeSeriesStoreFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;

/**
 * 系统启动引导类。
 * 按配置创建存储客户端、样例生成器和检测器，组装管道并执行一条命令。
 *
 * 用法：java -jar pipeline-anomaly.jar [--config 配置文件路径] 命令 [参数]
 * <pre>
 *   generate [n]               生成 n 条样例读数并写入存储
 *   detect [hours] [location]  查询回溯窗口并检测异常
 *   run [n] [hours]            生成并写入后立即检测
 *   collect                    启动Kafka实时采集，直到进程退出
 * </pre>
 */
public class AnomalyDetectionApplication {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionApplication.class);

    private final AppConfig config;
    private final PrintStream out;

    private TimeSeriesStore store;
    private AnomalyPipeline pipeline;
    private KafkaReadingCollector collector;

    public AnomalyDetectionApplication(AppConfig config, PrintStream out) {
        this.config = config;
        this.out = out;
    }

    /**
     * 组装管道。
     *
     * @throws ConfigIncompleteException 存储连接配置不完整
     * @throws IllegalArgumentException  检测器参数或存储地址不合法
     */
    public void start(Clock clock) {
        log.info("=== Sensor Telemetry Anomaly Detection ===");
        log.info("Starting with config: {}", config);

        // 1. 检测器
        IsolationForestDetector detector = IsolationForestDetector.fromParameters(config.toDetectorParameters());

        // 2. 存储客户端
        TimeSeriesStoreFactory storeFactory = new TimeSeriesStoreFactory(
                Duration.ofMillis(config.getStoreConnectTimeoutMs()),
                Duration.ofMillis(config.getStoreRequestTimeoutMs()),
                config.getSqliteTimeWindowMs(),
                clock);
        store = storeFactory.create(config.toStoreConfig());

        // 3. 样例生成器
        SyntheticReadingGenerator generator = new SyntheticReadingGenerator(
                new Random(), clock, config.getSensorLocation())
                .setInterval(Duration.ofSeconds(config.getGeneratorIntervalSeconds()))
                .setAnomalyCount(config.getGeneratorAnomalyCount())
                .setTemperature(config.getTemperatureBaseline(),
                        config.getTemperatureSpread(), config.getTemperatureAnomalySpread())
                .setHumidity(config.getHumidityBaseline(),
                        config.getHumiditySpread(), config.getHumidityAnomalySpread());

        pipeline = new DefaultAnomalyPipeline(generator, store, detector);
        log.info("Pipeline ready. Detector: {} v{}",
                detector.getMetadata().getName(), detector.getMetadata().getVersion());
    }

    public void shutdown() {
        if (collector != null) {
            collector.stop();
        }
        if (store != null) {
            store.close();
        }
        log.info("=== Shut down ===");
    }

    /**
     * 执行一条命令。
     *
     * @return 进程退出码
     */
    public int execute(List<String> command) throws InterruptedException {
        String name = command.isEmpty() ? "run" : command.get(0);
        List<String> args = command.isEmpty() ? List.of() : command.subList(1, command.size());

        switch (name) {
            case "generate":
                generate(intArg(args, 0, config.getGeneratorSamples()));
                return 0;

            case "detect":
                detect(args.size() > 1 ? args.get(1) : null, intArg(args, 0, config.getLookbackHours()));
                return 0;

            case "run":
                generate(intArg(args, 0, config.getGeneratorSamples()));
                detect(null, intArg(args, 1, config.getLookbackHours()));
                return 0;

            case "collect":
                collect();
                return 0;

            default:
                out.println("Unknown command: " + name);
                out.println("Usage: [--config <path>] generate [n] | detect [hours] [location] | run [n] [hours] | collect");
                return 2;
        }
    }

    private void generate(int sampleCount) {
        GeneratedBatch batch = pipeline.produceSampleBatch(sampleCount);
        out.println("Generated and wrote " + batch.size() + " sample reading(s).");
    }

    private void detect(String location, int lookbackHours) {
        DetectionResult result = pipeline.refresh(location, lookbackHours);
        out.println("Readings analysed: " + result.size());
        out.println("Total anomalies detected: " + result.getAnomalyCount());
        for (Reading anomaly : result.getAnomalies()) {
            out.println("  " + anomaly);
        }
    }

    private void collect() throws InterruptedException {
        collector = new KafkaReadingCollector(config.getKafkaBootstrapServers(),
                config.getKafkaInputTopic(), config.getKafkaGroupId(), pipeline);
        collector.start();
        out.println("Collecting from topic '" + config.getKafkaInputTopic() + "', press Ctrl+C to stop.");
        new CountDownLatch(1).await();
    }

    private static int intArg(List<String> args, int index, int defaultValue) {
        if (args.size() <= index) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(args.get(index));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected an integer argument, got: " + args.get(index), e);
        }
    }

    /**
     * 应用入口
     */
    public static void main(String[] args) {
        System.exit(run(Arrays.asList(args), Clock.systemUTC(), System.out, System.err));
    }

    /**
     * 解析 --config 参数、加载配置、组装并执行一条命令。
     *
     * @return 进程退出码：0 成功，1 配置或运行错误，2 未知命令，130 被中断
     */
    static int run(List<String> args, Clock clock, PrintStream out, PrintStream err) {
        List<String> command = new ArrayList<>(args);
        String configPath = null;
        int configFlag = command.indexOf("--config");
        if (configFlag >= 0 && configFlag + 1 < command.size()) {
            configPath = command.get(configFlag + 1);
            command.subList(configFlag, configFlag + 2).clear();
        }

        AnomalyDetectionApplication app = null;
        Thread shutdownHook = null;
        try {
            AppConfig config = AppConfig.load(configPath);
            app = new AnomalyDetectionApplication(config, out);

            AnomalyDetectionApplication running = app;
            shutdownHook = new Thread(() -> {
                log.info("Shutdown hook triggered, performing graceful shutdown...");
                running.shutdown();
            }, "shutdown-hook");
            Runtime.getRuntime().addShutdownHook(shutdownHook);

            app.start(clock);
            return app.execute(command);
        } catch (ConfigIncompleteException e) {
            log.error(e.getMessage());
            err.println("Configure the time-series store first: " + e.getMessage());
            return 1;
        } catch (StoreException | DetectionException | IllegalArgumentException e) {
            log.error("Command failed: {}", e.getMessage(), e);
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 130;
        } finally {
            if (shutdownHook != null) {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
                app.shutdown();
            }
        }
    }
}
