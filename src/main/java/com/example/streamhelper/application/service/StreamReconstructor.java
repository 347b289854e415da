package com.example.streamhelper.application.service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import com.example.streamhelper.application.domain.event.LoggedEvent;
import com.example.streamhelper.application.domain.event.VersionedEvent;
import com.example.streamhelper.application.domain.migration.EventMigrationChain;
import com.example.streamhelper.application.domain.snapshot.Snapshot;
import com.example.streamhelper.application.domain.snapshot.SnapshotPolicy;
import com.example.streamhelper.application.domain.stream.EventReducer;
import com.example.streamhelper.application.domain.stream.ExpectedStreamRevision;
import com.example.streamhelper.application.domain.stream.StreamState;
import com.example.streamhelper.application.port.EventLogPort;
import com.example.streamhelper.application.port.SnapshotRepositoryPort;
import com.example.streamhelper.application.shared.exception.EventLogException;
import com.example.streamhelper.application.shared.exception.EventStreamNotFoundException;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Stream 狀態重建器
 *
 * <p>
 * 編排快照查詢、事件重播、事件升級與狀態摺疊，並在版本落在快照頻率上時補存快照。
 * </p>
 *
 * <pre>
 * 1. 讀取最新快照 (不存在時 state=null, version=0)
 * 2. 從 Revision = 快照版本 開始讀取事件，讀到目前結尾為止
 * 3. 每筆事件：升級 -> 交給 Reducer 摺疊 -> version + 1
 * 4. 本次有套用新事件且 version 為快照頻率的倍數時，寫入新快照
 * 5. 回傳 {state, version}
 * </pre>
 *
 * <p>
 * version 只在摺疊步驟中遞增，快照邏輯不會另外計算。
 * </p>
 */
@Slf4j
public class StreamReconstructor {

	private final EventLogPort eventLog;

	private final SnapshotRepositoryPort snapshotRepository;

	@Getter
	private final EventMigrationChain migrationChain;

	@Getter
	private final SnapshotPolicy snapshotPolicy;

	private final Clock clock;

	public StreamReconstructor(EventLogPort eventLog, SnapshotRepositoryPort snapshotRepository,
			EventMigrationChain migrationChain, SnapshotPolicy snapshotPolicy, Clock clock) {
		this.eventLog = eventLog;
		this.snapshotRepository = snapshotRepository;
		this.migrationChain = migrationChain;
		this.snapshotPolicy = snapshotPolicy;
		this.clock = clock;
	}

	/**
	 * 重建 Stream 目前的狀態
	 *
	 * @param streamId   Stream 名稱
	 * @param stateType  狀態型別 (用於還原快照)
	 * @param applyEvent 呼叫端的 Reducer
	 * @return 重建結果；Stream 從未寫入過時回傳 {@link StreamState#empty()}
	 */
	public <S> StreamState<S> getCurrentState(String streamId, Class<S> stateType, EventReducer<S> applyEvent) {
		S state = null;
		long version = 0;

		Optional<Snapshot<S>> snapshotOpt = snapshotPolicy.isEnabled() ? loadSnapshot(streamId, stateType)
				: Optional.empty();
		if (snapshotOpt.isPresent()) {
			state = snapshotOpt.get().getState();
			version = snapshotOpt.get().getVersion();
			log.debug(">>> [Recovery] 發現快照！Stream={}，從 Revision {} 開始補齊後續事件", streamId, version);
		}

		List<LoggedEvent> events;
		try {
			events = eventLog.readStream(streamId, version);
		} catch (EventStreamNotFoundException e) {
			log.debug(">>> [Recovery] Stream {} 不存在，回傳空狀態", streamId);
			return StreamState.empty();
		}

		for (LoggedEvent logged : events) {
			VersionedEvent event = migrationChain.apply(logged.getEvent());
			state = applyEvent.apply(state, event);
			version++;
		}
		log.debug(">>> [Recovery] Stream={} 重播 {} 筆事件，目前版本 {}", streamId, events.size(), version);

		if (!events.isEmpty() && state != null && snapshotPolicy.shouldSnapshot(version)) {
			persistSnapshot(streamId, state, version);
		}
		return new StreamState<>(state, version);
	}

	/**
	 * 追加單一事件，不做任何版本檢查
	 */
	public void appendEvent(String streamId, VersionedEvent event) {
		appendEvent(streamId, event, ExpectedStreamRevision.any());
	}

	/**
	 * 追加單一事件
	 *
	 * <p>
	 * 未指定結構版本 (0) 的事件會標記為目前事件版本。版本衝突時原樣拋出
	 * {@link com.example.streamhelper.application.shared.exception.ConcurrencyConflictException}，不自動重試。
	 * </p>
	 *
	 * @param streamId         Stream 名稱
	 * @param event            事件
	 * @param expectedRevision 樂觀鎖條件，null 視為不檢查
	 */
	public void appendEvent(String streamId, VersionedEvent event, ExpectedStreamRevision expectedRevision) {
		VersionedEvent versioned = withCurrentVersion(event);
		eventLog.appendToStream(streamId, List.of(versioned),
				expectedRevision != null ? expectedRevision : ExpectedStreamRevision.any());
		log.debug("事件已寫入: Stream={}, Type={}, v{}", streamId, versioned.getType(), versioned.getVersion());
	}

	/**
	 * 取得 Stream 最新的快照
	 */
	public <S> Optional<Snapshot<S>> getLatestSnapshot(String streamId, Class<S> stateType) {
		return snapshotRepository.findLatest(streamId, stateType);
	}

	VersionedEvent withCurrentVersion(VersionedEvent event) {
		if (event.getVersion() > 0) {
			return event;
		}
		return event.toBuilder().version(migrationChain.getCurrentEventVersion()).build();
	}

	private <S> Optional<Snapshot<S>> loadSnapshot(String streamId, Class<S> stateType) {
		try {
			return snapshotRepository.findLatest(streamId, stateType);
		} catch (EventLogException e) {
			// 快照損毀或讀取失敗時從頭重播
			log.warn("讀取快照失敗，將從頭重播 Stream {} (原因: {})", streamId, e.getMessage());
			return Optional.empty();
		}
	}

	private <S> void persistSnapshot(String streamId, S state, long version) {
		Snapshot<S> snapshot = Snapshot.<S>builder().state(state).version(version)
				.timestamp(clock.instant().toString()).build();
		try {
			snapshotRepository.save(streamId, snapshot);
			log.info("[Snapshot] 快照已建立: Stream={}, Version={}", streamId, version);
		} catch (RuntimeException e) {
			log.warn("[Snapshot] 快照寫入失敗，不影響本次重建結果: Stream={}, Version={}", streamId, version, e);
		}
	}
}
