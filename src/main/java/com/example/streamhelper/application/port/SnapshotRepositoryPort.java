package com.example.streamhelper.application.port;

import java.util.Optional;

import com.example.streamhelper.application.domain.snapshot.Snapshot;

/**
 * 快照儲存埠 (Snapshot Repository Port)
 *
 * <p>
 * 負責快照的持久化與檢索，只讀取最新的一份。
 * </p>
 */
public interface SnapshotRepositoryPort {

	/**
	 * 儲存一個新的快照
	 *
	 * @param streamId 被快照的 Stream
	 * @param snapshot 快照
	 */
	void save(String streamId, Snapshot<?> snapshot);

	/**
	 * 取得最新的快照
	 *
	 * @param streamId  被快照的 Stream
	 * @param stateType 狀態型別
	 * @return 最新的快照，若無快照則回傳 Optional.empty()
	 */
	<S> Optional<Snapshot<S>> findLatest(String streamId, Class<S> stateType);
}
