package com.example.streamhelper.application.domain.migration;

import java.util.function.UnaryOperator;

import com.example.streamhelper.application.domain.event.VersionedEvent;

import lombok.Builder;
import lombok.Value;

/**
 * 單一步驟的事件升級：將 {@code eventType} 事件從 {@code fromVersion} 升到 {@code toVersion}
 *
 * <p>
 * {@code migrate} 必須是純函式，相同輸入永遠產生相同輸出，不得有 I/O。
 * </p>
 */
@Value
@Builder
public class EventMigration {

	String eventType;

	int fromVersion;

	int toVersion;

	UnaryOperator<VersionedEvent> migrate;

	public VersionedEvent apply(VersionedEvent event) {
		return migrate.apply(event);
	}

	@Override
	public String toString() {
		return eventType + " v" + fromVersion + "->v" + toVersion;
	}
}
