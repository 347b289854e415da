package com.example.streamhelper.infra.adapter;

import java.util.List;
import java.util.Optional;

import com.example.streamhelper.application.domain.event.LoggedEvent;
import com.example.streamhelper.application.domain.event.VersionedEvent;
import com.example.streamhelper.application.domain.snapshot.Snapshot;
import com.example.streamhelper.application.domain.stream.ExpectedStreamRevision;
import com.example.streamhelper.application.domain.stream.StreamNaming;
import com.example.streamhelper.application.port.EventLogPort;
import com.example.streamhelper.application.port.SnapshotRepositoryPort;
import com.example.streamhelper.application.shared.exception.EventStreamNotFoundException;
import com.example.streamhelper.infra.event.codec.EventJsonCodec;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 以獨立 Stream 保存快照的轉接器
 *
 * <p>
 * 每個聚合根對應一條 {@code {streamId}{suffix}} 快照 Stream，每次存快照就追加一筆 {@value #SNAPSHOT_EVENT_TYPE}
 * 事件；讀取時只取最後一筆，較舊的紀錄保留在 Log 中但不再被讀取。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class StreamSnapshotAdapter implements SnapshotRepositoryPort {

	public static final String SNAPSHOT_EVENT_TYPE = "snapshot";

	private static final int SNAPSHOT_EVENT_VERSION = 1;

	private final EventLogPort eventLog;

	private final EventJsonCodec jsonCodec;

	private final StreamNaming naming;

	@Override
	public void save(String streamId, Snapshot<?> snapshot) {
		VersionedEvent event = VersionedEvent.of(SNAPSHOT_EVENT_TYPE, SNAPSHOT_EVENT_VERSION,
				jsonCodec.toObjectNode(snapshot));
		eventLog.appendToStream(naming.snapshotStream(streamId), List.of(event), ExpectedStreamRevision.any());
		log.debug("[Snapshot] 快照已寫入: Stream={}, Version={}", naming.snapshotStream(streamId), snapshot.getVersion());
	}

	@Override
	public <S> Optional<Snapshot<S>> findLatest(String streamId, Class<S> stateType) {
		String snapshotStream = naming.snapshotStream(streamId);
		Optional<LoggedEvent> last;
		try {
			last = eventLog.readLastEvent(snapshotStream);
		} catch (EventStreamNotFoundException e) {
			// 第一次執行或尚未存過快照
			return Optional.empty();
		}
		if (last.isEmpty()) {
			return Optional.empty();
		}

		VersionedEvent event = last.get().getEvent();
		if (!SNAPSHOT_EVENT_TYPE.equals(event.getType())) {
			log.warn("[Snapshot] Stream {} 的最後一筆事件不是快照 ({})，忽略", snapshotStream, event.getType());
			return Optional.empty();
		}
		Snapshot<S> snapshot = jsonCodec.convert(event.getData(), Snapshot.class, stateType);
		return Optional.of(snapshot);
	}
}
