package com.example.streamhelper.application.domain.migration;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.example.streamhelper.application.domain.event.VersionedEvent;
import com.example.streamhelper.application.shared.exception.EventMigrationException;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 事件升級鏈
 *
 * <p>
 * 以 {@code (eventType, fromVersion)} 為鍵串接多個 {@link EventMigration}，在同一次重播中把事件一路升到
 * {@code currentEventVersion}，例如 v1 -> v2 -> v3。
 * </p>
 *
 * <pre>
 * 1. 依事件目前的 type 與 version 尋找下一步 Migration
 * 2. 找到就套用並重複；找不到或已達目前版本就原樣回傳
 * 3. 任一步驟失敗即拋出 {@link EventMigrationException}，不會回傳升級到一半的事件
 * </pre>
 */
@Slf4j
public class EventMigrationChain {

	@Getter
	private final int currentEventVersion;

	private final Map<MigrationKey, EventMigration> migrations = new HashMap<>();

	public EventMigrationChain(int currentEventVersion, Collection<EventMigration> eventMigrations) {
		this.currentEventVersion = currentEventVersion;
		for (EventMigration migration : eventMigrations) {
			if (migration.getToVersion() <= migration.getFromVersion()) {
				throw new IllegalArgumentException("Migration 必須嚴格提升版本: " + migration);
			}
			MigrationKey key = new MigrationKey(migration.getEventType(), migration.getFromVersion());
			EventMigration existing = migrations.putIfAbsent(key, migration);
			if (existing != null) {
				throw new IllegalArgumentException("重複的 Migration 起點: " + existing + " 與 " + migration);
			}
		}
		log.info("EventMigrationChain 初始化完成：目前事件版本 v{}，共 {} 個 Migration", currentEventVersion,
				migrations.size());
	}

	/**
	 * 沒有任何 Migration 的升級鏈
	 */
	public static EventMigrationChain none(int currentEventVersion) {
		return new EventMigrationChain(currentEventVersion, List.of());
	}

	/**
	 * 將事件升級到目前版本
	 *
	 * @param event 從 Stream 讀出的原始事件
	 * @return 升級後的事件；已是目前版本或無可用 Migration 時回傳同一個實例
	 * @throws EventMigrationException Migration 本身失敗或未提升版本
	 */
	public VersionedEvent apply(VersionedEvent event) {
		VersionedEvent current = event;
		while (current.getVersion() < currentEventVersion) {
			EventMigration migration = migrations.get(new MigrationKey(current.getType(), current.getVersion()));
			if (migration == null) {
				return current;
			}
			VersionedEvent migrated;
			try {
				migrated = migration.apply(current);
			} catch (RuntimeException e) {
				throw new EventMigrationException("Migration 執行失敗: " + migration, e);
			}
			if (migrated == null || migrated.getVersion() <= current.getVersion()) {
				throw new EventMigrationException("Migration 未提升事件版本: " + migration);
			}
			log.debug("事件 {} 已由 v{} 升級至 v{}", current.getType(), current.getVersion(), migrated.getVersion());
			current = migrated;
		}
		return current;
	}

	private record MigrationKey(String eventType, int fromVersion) {
		MigrationKey {
			Objects.requireNonNull(eventType, "eventType");
		}
	}
}
