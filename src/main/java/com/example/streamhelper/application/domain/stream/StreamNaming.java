package com.example.streamhelper.application.domain.stream;

import java.util.Map;

/**
 * Stream 命名規則
 *
 * <pre>
 * 聚合根  : {aggregatePrefix}{aggregateId}            例: account-42
 * 從屬實體: {entityPrefix}-{entityId}                 例: transaction-9f1c
 * 快照    : {streamId}{snapshotStreamSuffix}          例: account-42-snapshot
 * </pre>
 *
 * <p>
 * 未設定前綴的實體類型直接以類型名稱作為前綴。
 * </p>
 */
public class StreamNaming {

	public static final String DEFAULT_AGGREGATE_PREFIX = "aggregate-";
	public static final String DEFAULT_SNAPSHOT_SUFFIX = "-snapshot";

	private final String aggregatePrefix;
	private final Map<String, String> entityPrefixes;
	private final String snapshotSuffix;

	public StreamNaming(String aggregatePrefix, Map<String, String> entityPrefixes, String snapshotSuffix) {
		this.aggregatePrefix = aggregatePrefix != null ? aggregatePrefix : DEFAULT_AGGREGATE_PREFIX;
		this.entityPrefixes = entityPrefixes != null ? Map.copyOf(entityPrefixes) : Map.of();
		this.snapshotSuffix = snapshotSuffix != null && !snapshotSuffix.isEmpty() ? snapshotSuffix
				: DEFAULT_SNAPSHOT_SUFFIX;
	}

	public static StreamNaming defaults() {
		return new StreamNaming(DEFAULT_AGGREGATE_PREFIX, Map.of(), DEFAULT_SNAPSHOT_SUFFIX);
	}

	public String aggregateStream(String aggregateId) {
		return aggregatePrefix + aggregateId;
	}

	public String entityStream(String entityType, String entityId) {
		return entityPrefixes.getOrDefault(entityType, entityType) + "-" + entityId;
	}

	public String snapshotStream(String streamId) {
		return streamId + snapshotSuffix;
	}
}
