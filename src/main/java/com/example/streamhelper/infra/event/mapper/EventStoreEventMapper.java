package com.example.streamhelper.infra.event.mapper;

import java.util.UUID;

import com.eventstore.dbclient.EventData;
import com.eventstore.dbclient.RecordedEvent;
import com.eventstore.dbclient.ResolvedEvent;
import com.example.streamhelper.application.domain.event.LoggedEvent;
import com.example.streamhelper.application.domain.event.VersionedEvent;
import com.example.streamhelper.application.shared.exception.EventLogException;
import com.example.streamhelper.infra.event.codec.EventJsonCodec;

import lombok.RequiredArgsConstructor;
import tools.jackson.databind.node.JsonNodeFactory;
import tools.jackson.databind.node.ObjectNode;

/**
 * EventStore 專用的事件映射器 (Event Mapper)
 *
 * <p>
 * 負責 {@link VersionedEvent} 與 EventStoreDB 資料格式之間的轉換，屬於 Infrastructure / Adapter 層，避免上層依賴
 * EventStoreDB 專屬結構。
 * </p>
 *
 * <p>
 * 儲存格式：
 * <ul>
 * <li>EventStore 事件型別 = {@code type}</li>
 * <li>事件內容 = {@code data}</li>
 * <li>metadata = 呼叫端的 metadata 再加上 {@value #EVENT_VERSION_KEY} 欄位</li>
 * </ul>
 * 讀回時會把 {@value #EVENT_VERSION_KEY} 從 metadata 移除；沒有此欄位的事件視為第 {@value #DEFAULT_EVENT_VERSION}
 * 版。
 * </p>
 */
@RequiredArgsConstructor
public class EventStoreEventMapper {

	public static final String EVENT_VERSION_KEY = "eventVersion";

	public static final int DEFAULT_EVENT_VERSION = 1;

	/**
	 * JSON 編解碼器
	 */
	private final EventJsonCodec jsonCodec;

	/**
	 * 將事件封裝為 EventStoreDB 可寫入的 {@link EventData}
	 *
	 * @param event 事件
	 * @return 帶有唯一事件 ID 的 {@link EventData}
	 */
	public EventData toEventData(VersionedEvent event) {
		ObjectNode metadata = event.getMetadata() != null ? event.getMetadata().deepCopy()
				: JsonNodeFactory.instance.objectNode();
		metadata.put(EVENT_VERSION_KEY, event.getVersion());

		ObjectNode data = event.getData() != null ? event.getData() : JsonNodeFactory.instance.objectNode();
		return EventData.builderAsJson(UUID.randomUUID(), event.getType(), jsonCodec.serialize(data))
				.metadataAsBytes(jsonCodec.serialize(metadata)).build();
	}

	/**
	 * 將 EventStore {@link ResolvedEvent} 還原為帶 Revision 的事件
	 *
	 * @param resolvedEvent EventStore 讀回的事件
	 * @return 事件與其 Revision
	 * @throws EventLogException 事件內容或 metadata 不是 JSON 物件
	 */
	public LoggedEvent toLoggedEvent(ResolvedEvent resolvedEvent) {
		RecordedEvent recorded = resolvedEvent.getEvent();
		ObjectNode data = jsonCodec.readObject(recorded.getEventData());

		int version = DEFAULT_EVENT_VERSION;
		ObjectNode metadata = null;
		byte[] rawMetadata = recorded.getUserMetadata();
		if (rawMetadata != null && rawMetadata.length > 0) {
			metadata = jsonCodec.readObject(rawMetadata);
			version = metadata.path(EVENT_VERSION_KEY).asInt(DEFAULT_EVENT_VERSION);
			metadata.remove(EVENT_VERSION_KEY);
			if (metadata.isEmpty()) {
				metadata = null;
			}
		}

		VersionedEvent event = VersionedEvent.builder().type(recorded.getEventType()).version(version).data(data)
				.metadata(metadata).build();
		return new LoggedEvent(event, recorded.getRevision());
	}
}
