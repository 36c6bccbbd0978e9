package com.pipeline.anomaly.detector;

import com.pipeline.anomaly.core.AnomalyDetector;
import com.pipeline.anomaly.core.TimeSeriesStore;
import com.pipeline.anomaly.core.impl.ParameterValidator;
import com.pipeline.anomaly.exception.InsufficientDataException;
import com.pipeline.anomaly.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * 隔离森林窗口检测器。
 * 每次调用都只用当前窗口的 [温度, 湿度] 向量从头拟合模型，并对同一批数据打分；
 * 分数高于窗口内 (1 - contamination) 分位数的点判为异常。
 *
 * 两个特征默认不做缩放，量纲差异会直接影响灵敏度；
 * 开启 standardize 后按窗口做 z-score 标准化，判定结果会与默认行为不同。
 *
 * 参数：
 * - contamination: 预期异常比例 (NUMBER, (0, 0.5], 默认0.1)
 * - numTrees: 树的数量 (INTEGER, 默认100)
 * - maxSamples: 每棵树子采样上限 (INTEGER, 默认256)
 * - seed: 随机种子 (INTEGER, 默认42)
 * - standardize: 是否按窗口标准化特征 (BOOLEAN, 默认false)
 */
public class IsolationForestDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(IsolationForestDetector.class);

    public static final String FUNCTION_ID = "isolation_forest";
    public static final int MIN_WINDOW_SIZE = 2;

    private final double contamination;
    private final int numTrees;
    private final int maxSamples;
    private final Long seed;
    private final boolean standardize;

    public IsolationForestDetector() {
        this(0.1, 100, 256, 42L, false);
    }

    /**
     * @param seed 随机种子；为null时每次检测使用新的非确定性随机源
     */
    public IsolationForestDetector(double contamination, int numTrees, int maxSamples,
                                   Long seed, boolean standardize) {
        if (!(contamination > 0.0 && contamination <= 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got: " + contamination);
        }
        this.contamination = contamination;
        this.numTrees = numTrees;
        this.maxSamples = maxSamples;
        this.seed = seed;
        this.standardize = standardize;
    }

    /**
     * 按参数表构建检测器，参数先经元数据校验。
     *
     * @throws IllegalArgumentException 参数校验失败
     */
    public static IsolationForestDetector fromParameters(Map<String, Object> parameters) {
        if (parameters == null) {
            parameters = Map.of();
        }
        ValidationResult validation = ParameterValidator.validate(describe(), parameters);
        for (String warning : validation.getWarnings()) {
            log.warn(warning);
        }
        if (!validation.isValid()) {
            throw new IllegalArgumentException("Invalid detector parameters: "
                    + String.join("; ", validation.getErrors()));
        }

        double contamination = number(parameters, "contamination", 0.1).doubleValue();
        int numTrees = number(parameters, "numTrees", 100).intValue();
        int maxSamples = number(parameters, "maxSamples", 256).intValue();
        Number seed = (Number) parameters.get("seed");
        Object standardize = parameters.get("standardize");

        return new IsolationForestDetector(contamination, numTrees, maxSamples,
                seed != null ? seed.longValue() : null,
                Boolean.TRUE.equals(standardize));
    }

    private static Number number(Map<String, Object> parameters, String name, Number defaultValue) {
        Object value = parameters.get(name);
        return (value instanceof Number) ? (Number) value : defaultValue;
    }

    @Override
    public DetectionResult detect(Window window) {
        List<Reading> readings = window.getReadings();
        if (readings.size() < MIN_WINDOW_SIZE) {
            throw new InsufficientDataException(readings.size(), MIN_WINDOW_SIZE);
        }

        double[][] features = extractFeatures(readings);
        if (standardize) {
            standardizeColumns(features);
        }

        Random random = (seed != null) ? new Random(seed) : new Random();
        IsolationForest forest = IsolationForest.fit(features, numTrees, maxSamples, random);
        double[] scores = forest.scoreAll(features);
        double threshold = quantile(scores, 1.0 - contamination);

        List<LabeledReading> labeled = new ArrayList<>(readings.size());
        for (int i = 0; i < readings.size(); i++) {
            labeled.add(new LabeledReading(readings.get(i), scores[i] > threshold));
        }

        DetectionResult result = new DetectionResult(FUNCTION_ID, window.getRange(), labeled);
        log.debug("Isolation forest fitted on {} readings ({} trees, sample size {}), threshold {}, {} anomalies",
                readings.size(), forest.getTreeCount(), forest.getSampleSize(),
                String.format("%.4f", threshold), result.getAnomalyCount());
        return result;
    }

    static double[][] extractFeatures(List<Reading> readings) {
        double[][] features = new double[readings.size()][];
        for (int i = 0; i < readings.size(); i++) {
            Reading r = readings.get(i);
            features[i] = new double[]{r.getTemperature(), r.getHumidity()};
        }
        return features;
    }

    /** 按列 z-score 标准化；标准差为0的列置零 */
    static void standardizeColumns(double[][] features) {
        int rows = features.length;
        int cols = features[0].length;
        for (int c = 0; c < cols; c++) {
            double sum = 0;
            for (double[] row : features) sum += row[c];
            double mean = sum / rows;

            double sumSquares = 0;
            for (double[] row : features) {
                double diff = row[c] - mean;
                sumSquares += diff * diff;
            }
            double std = Math.sqrt(sumSquares / rows);

            for (double[] row : features) {
                row[c] = (std == 0.0) ? 0.0 : (row[c] - mean) / std;
            }
        }
    }

    /** 线性插值分位数，q 取值 [0, 1] */
    static double quantile(double[] values, double q) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double pos = q * (sorted.length - 1);
        int lower = (int) Math.floor(pos);
        if (lower >= sorted.length - 1) {
            return sorted[sorted.length - 1];
        }
        double fraction = pos - lower;
        return sorted[lower] + fraction * (sorted[lower + 1] - sorted[lower]);
    }

    public double getContamination() { return contamination; }
    public int getNumTrees() { return numTrees; }
    public int getMaxSamples() { return maxSamples; }
    public boolean isStandardize() { return standardize; }

    @Override
    public FunctionMetadata getMetadata() {
        return describe();
    }

    public static FunctionMetadata describe() {
        FunctionMetadata meta = new FunctionMetadata();
        meta.setFunctionId(FUNCTION_ID);
        meta.setName("隔离森林检测器");
        meta.setVersion("1.0.0");
        meta.setDescription("基于随机切分树的无监督离群点检测，每个窗口重新拟合，"
                + "按预期异常比例阈值化。适用于传感器毛刺等孤立型异常。");
        meta.setFeatureNames(Arrays.asList(TimeSeriesStore.TEMPERATURE_FIELD, TimeSeriesStore.HUMIDITY_FIELD));

        ParameterDefinition contaminationDef = ParameterDefinition.number("contamination", 0.1, 0.0, 0.5,
                "预期异常比例，窗口内分数高于 (1 - contamination) 分位数的点判为异常");
        contaminationDef.setMinExclusive(true);

        ParameterDefinition treesDef = ParameterDefinition.number("numTrees", 100, 1.0, 1000.0, "树的数量");
        treesDef.setType("INTEGER");

        ParameterDefinition samplesDef = ParameterDefinition.number("maxSamples", 256, 2.0, 4096.0,
                "每棵树的子采样上限，实际取 min(maxSamples, 窗口大小)");
        samplesDef.setType("INTEGER");

        ParameterDefinition seedDef = ParameterDefinition.number("seed", 42, null, null,
                "随机种子，缺省时每次检测使用非确定性随机源");
        seedDef.setType("INTEGER");

        ParameterDefinition standardizeDef = new ParameterDefinition();
        standardizeDef.setName("standardize");
        standardizeDef.setType("BOOLEAN");
        standardizeDef.setDefaultValue(false);
        standardizeDef.setDescription("按窗口对温度、湿度做z-score标准化");

        meta.setParameterDefinitions(Arrays.asList(contaminationDef, treesDef, samplesDef, seedDef, standardizeDef));
        return meta;
    }
}
