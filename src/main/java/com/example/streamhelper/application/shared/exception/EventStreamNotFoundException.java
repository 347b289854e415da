package com.example.streamhelper.application.shared.exception;

import lombok.Getter;

/**
 * 指定的 Stream 從未被寫入過
 *
 * <p>
 * 主重建流程會將其轉為 {@code state=null, version=0}；讀取快照時則完全吞掉 (代表尚無快照)。
 * </p>
 */
@Getter
public class EventStreamNotFoundException extends EventStoreHelperException {

	private static final long serialVersionUID = 1L;

	private final String streamId;

	public EventStreamNotFoundException(String streamId) {
		super("Stream 不存在: " + streamId);
		this.streamId = streamId;
	}

	public EventStreamNotFoundException(String streamId, Throwable cause) {
		super("Stream 不存在: " + streamId, cause);
		this.streamId = streamId;
	}
}
