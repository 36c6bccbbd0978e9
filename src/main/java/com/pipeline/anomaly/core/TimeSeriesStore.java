package com.pipeline.anomaly.core;

import com.pipeline.anomaly.model.Reading;
import com.pipeline.anomaly.model.Window;

import java.util.List;

/**
 * 时序存储客户端接口 —— 对外部时序数据库写入与范围查询契约的薄封装。
 *
 * 所有读数写入固定的测量名下，以位置作为标签，温度、湿度作为两个数值字段。
 * 查询结果按时间戳透视为一行一读数，并合并底层返回的多个结果分片。
 *
 * 实现约定：
 * - 连接配置在构造时确定，之后不可修改；重新配置应创建新的客户端
 * - 不做自动重试，所有失败以 StoreException 同步抛给调用方
 * - 不保证多线程并发调用安全，并发场景应按连接串行化或每个调用方一个客户端
 */
public interface TimeSeriesStore extends AutoCloseable {

    /** 固定测量名 */
    String MEASUREMENT = "sensores";
    /** 位置标签名 */
    String LOCATION_TAG = "local";
    String TEMPERATURE_FIELD = "temperatura";
    String HUMIDITY_FIELD = "umidade";

    /**
     * 逐点写入一批读数。
     * 某个点失败时立即中止并抛出 PartialWriteException，已写入的点保留。
     *
     * @param location 位置标签值
     * @param readings 待写入读数，按给定顺序写入
     * @throws com.pipeline.anomaly.exception.PartialWriteException 某个点写入失败
     */
    void write(String location, List<Reading> readings);

    /**
     * 查询 [now - lookbackHours, now] 内全部位置的读数。
     *
     * @param lookbackHours 回溯小时数，必须 &gt;= 1
     * @return 按时间戳升序排列的窗口；范围内无数据时返回空窗口（非null）
     * @throws com.pipeline.anomaly.exception.StoreException 查询失败，operation 为 query
     */
    Window query(int lookbackHours);

    /**
     * 查询指定位置在 [now - lookbackHours, now] 内的读数。
     *
     * @param location      位置标签值；为null时等同于 {@link #query(int)}
     * @param lookbackHours 回溯小时数，必须 &gt;= 1
     * @return 按时间戳升序排列的窗口；范围内无数据时返回空窗口（非null）
     */
    Window query(String location, int lookbackHours);

    /**
     * 释放连接资源。
     */
    @Override
    void close();
}
