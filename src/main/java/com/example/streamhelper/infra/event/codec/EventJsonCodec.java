package com.example.streamhelper.infra.event.codec;

import com.example.streamhelper.application.shared.exception.EventLogException;

import tools.jackson.databind.JavaType;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.ObjectNode;

/**
 * 事件 JSON 編解碼器
 *
 * <p>
 * 負責 JSON byte[]、Jackson 樹狀結構與具體型別之間的轉換，完全獨立於 EventStore。事件內容與 metadata 一律必須是 JSON
 * 物件；不符時視為資料損毀並拋出 {@link EventLogException}。
 * </p>
 */
public class EventJsonCodec {

	private final ObjectMapper objectMapper;

	/**
	 * @param objectMapper Jackson ObjectMapper
	 */
	public EventJsonCodec(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * 將 JSON 節點序列化為 byte[]
	 */
	public byte[] serialize(JsonNode node) {
		try {
			return objectMapper.writeValueAsBytes(node);
		} catch (Exception e) {
			throw new EventLogException("JSON 序列化失敗", e);
		}
	}

	/**
	 * 將 JSON byte[] 解析為 JSON 物件
	 *
	 * @param data JSON byte[]
	 * @return JSON 物件
	 * @throws EventLogException 內容無法解析或不是 JSON 物件
	 */
	public ObjectNode readObject(byte[] data) {
		JsonNode node;
		try {
			node = objectMapper.readTree(data);
		} catch (Exception e) {
			throw new EventLogException("JSON 反序列化失敗", e);
		}
		if (node == null || !node.isObject()) {
			throw new EventLogException("事件內容必須是 JSON 物件");
		}
		return (ObjectNode) node;
	}

	/**
	 * 將任意物件轉為 JSON 物件
	 */
	public ObjectNode toObjectNode(Object value) {
		JsonNode node;
		try {
			node = objectMapper.valueToTree(value);
		} catch (Exception e) {
			throw new EventLogException(value.getClass().getSimpleName() + " 無法轉為 JSON", e);
		}
		if (node == null || !node.isObject()) {
			throw new EventLogException(value.getClass().getSimpleName() + " 必須序列化為 JSON 物件");
		}
		return (ObjectNode) node;
	}

	/**
	 * 將 JSON 節點轉為指定型別
	 */
	public <T> T convert(JsonNode node, Class<T> type) {
		return convert(node, objectMapper.getTypeFactory().constructType(type));
	}

	/**
	 * 將 JSON 節點轉為泛型型別，例如 {@code Snapshot<BankAccount>}
	 */
	public <T> T convert(JsonNode node, Class<?> rawType, Class<?>... parameterTypes) {
		return convert(node, objectMapper.getTypeFactory().constructParametricType(rawType, parameterTypes));
	}

	private <T> T convert(JsonNode node, JavaType type) {
		try {
			return objectMapper.convertValue(node, type);
		} catch (Exception e) {
			throw new EventLogException("JSON 無法轉為 " + type, e);
		}
	}
}
