package com.example.streamhelper.config.properties;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.example.streamhelper.application.domain.stream.StreamNaming;

import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * 事件流輔助層的設定
 *
 * <pre>
 * stream-helper:
 *   snapshot-frequency: 5
 *   snapshot-stream-suffix: -snapshot
 *   current-event-version: 2
 *   aggregate-stream-prefix: account-
 *   entity-stream-prefixes:
 *     transaction: transaction
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "stream-helper")
public class StreamHelperProperties {

	/**
	 * 每 N 筆事件存一次快照，0 代表停用
	 */
	@Min(0)
	private int snapshotFrequency = 0;

	/**
	 * 快照 Stream 名稱後綴
	 */
	private String snapshotStreamSuffix = StreamNaming.DEFAULT_SNAPSHOT_SUFFIX;

	/**
	 * 目前寫入的事件結構版本
	 */
	@Min(1)
	private int currentEventVersion = 1;

	/**
	 * 聚合根 Stream 名稱前綴
	 */
	private String aggregateStreamPrefix = StreamNaming.DEFAULT_AGGREGATE_PREFIX;

	/**
	 * 實體類型 -> Stream 名稱前綴
	 */
	private Map<String, String> entityStreamPrefixes = new LinkedHashMap<>();
}
