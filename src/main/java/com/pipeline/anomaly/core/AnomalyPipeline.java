package com.pipeline.anomaly.core;

import com.pipeline.anomaly.model.DetectionResult;
import com.pipeline.anomaly.model.GeneratedBatch;
import com.pipeline.anomaly.model.Reading;

import java.util.List;

/**
 * 管道编排接口 —— 组合"生成→写入"与"查询→检测"两条相互独立的流程。
 *
 * 检测流程总是作用于存储中当前可查询到的数据，
 * 无论数据来自样例生成器还是外部实时采集源。
 * 本接口不包含调度循环，触发节奏由调用方决定（手动、定时器或外部调度器）。
 */
public interface AnomalyPipeline {

    /**
     * 生成一批样例读数并写入存储。
     *
     * @param sampleCount 样例数量，必须 &gt;= 1
     * @return 生成的批次（含注入异常的下标）
     */
    GeneratedBatch produceSampleBatch(int sampleCount);

    /**
     * 写入外部采集源产生的读数。
     *
     * @param location 位置标签
     * @param readings 读数序列
     */
    void ingest(String location, List<Reading> readings);

    /**
     * 查询回溯窗口内全部位置的读数并执行异常检测。
     *
     * @param lookbackHours 回溯小时数
     * @return 检测结果
     */
    DetectionResult refresh(int lookbackHours);

    /**
     * 查询指定位置的回溯窗口并执行异常检测。
     *
     * @param location      位置标签；为null表示不按位置过滤
     * @param lookbackHours 回溯小时数
     * @return 检测结果
     */
    DetectionResult refresh(String location, int lookbackHours);
}
