package com.example.streamhelper.application.port;

import java.util.List;
import java.util.Optional;

import com.example.streamhelper.application.domain.event.LoggedEvent;
import com.example.streamhelper.application.domain.event.VersionedEvent;
import com.example.streamhelper.application.domain.stream.ExpectedStreamRevision;
import com.example.streamhelper.application.shared.exception.ConcurrencyConflictException;
import com.example.streamhelper.application.shared.exception.EventStreamNotFoundException;

/**
 * 僅可追加的事件日誌埠 (Event Log Outbound Port)
 *
 * <p>
 * 每個 Stream 的 Revision 單調遞增。所有讀取都是有界的掃描，讀到目前結尾即結束，不是即時訂閱。
 * </p>
 */
public interface EventLogPort {

	/**
	 * 依 Revision 順序讀取事件
	 *
	 * @param streamId     Stream 名稱
	 * @param fromRevision 起始 Revision (含)
	 * @return 從 fromRevision 到目前結尾的事件
	 * @throws EventStreamNotFoundException Stream 從未寫入過
	 */
	List<LoggedEvent> readStream(String streamId, long fromRevision);

	/**
	 * 讀取 Stream 的最後一筆事件
	 *
	 * @param streamId Stream 名稱
	 * @return 最後一筆事件，Stream 存在但為空時回傳 Optional.empty()
	 * @throws EventStreamNotFoundException Stream 從未寫入過
	 */
	Optional<LoggedEvent> readLastEvent(String streamId);

	/**
	 * 追加一批事件
	 *
	 * @param streamId         Stream 名稱
	 * @param events           依序寫入的事件
	 * @param expectedRevision 樂觀鎖條件
	 * @throws ConcurrencyConflictException Stream 目前版本與 expectedRevision 不符
	 */
	void appendToStream(String streamId, List<VersionedEvent> events, ExpectedStreamRevision expectedRevision);
}
