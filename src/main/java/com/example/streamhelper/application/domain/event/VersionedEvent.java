package com.example.streamhelper.application.domain.event;

import lombok.Builder;
import lombok.Value;
import tools.jackson.databind.node.ObjectNode;

/**
 * 帶有結構版本的領域事件
 *
 * <p>
 * {@code type} 決定 Reducer 的分支，{@code version} 決定 Migration 的起點。傳輸與儲存層只把
 * {@code data}、{@code metadata} 當成不透明的 JSON 物件，具體結構只在 Reducer 與 Migration 中解碼。
 * </p>
 *
 * <p>
 * 事件寫入後不可變；Migration 透過 {@link #toBuilder()} 產生新的實例。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class VersionedEvent {

	/**
	 * 事件類型，例如 "MoneyDeposited"
	 */
	String type;

	/**
	 * 事件結構版本，0 代表尚未指定
	 */
	int version;

	/**
	 * 事件內容
	 */
	ObjectNode data;

	/**
	 * 附加資訊 (可為 null)
	 */
	ObjectNode metadata;

	public static VersionedEvent of(String type, int version, ObjectNode data) {
		return VersionedEvent.builder().type(type).version(version).data(data).build();
	}
}
