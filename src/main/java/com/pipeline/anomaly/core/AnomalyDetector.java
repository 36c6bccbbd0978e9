package com.pipeline.anomaly.core;

import com.pipeline.anomaly.model.DetectionResult;
import com.pipeline.anomaly.model.FunctionMetadata;
import com.pipeline.anomaly.model.Window;

/**
 * 窗口异常检测器接口。
 *
 * 每次调用仅基于当前窗口内的数据重新建模并打分，调用之间不保留任何模型状态。
 * 同一读数在不同窗口中的判定结果不可比较、不可合并。
 *
 * 实现约定：
 * - 输出与输入窗口等长且同序
 * - 窗口读数少于2条时抛出 InsufficientDataException，不返回全false
 * - 不向存储写回任何数据
 */
public interface AnomalyDetector {

    /**
     * 对窗口内每条读数给出异常判定。
     *
     * @param window 待检测窗口
     * @return 检测结果，包含逐条标记和异常总数
     * @throws com.pipeline.anomaly.exception.InsufficientDataException 窗口读数不足
     */
    DetectionResult detect(Window window);

    /**
     * 返回检测器元数据，包括名称、版本、特征和参数定义。
     *
     * @return 检测器元数据
     */
    FunctionMetadata getMetadata();
}
