package com.example.streamhelper.application.shared.exception;

import lombok.Getter;

/**
 * 樂觀鎖衝突：追加事件時 Stream 的實際版本與預期版本不符
 *
 * <p>
 * 原始的 Event Log 例外保留於 cause，本層不做自動重試。
 * </p>
 */
@Getter
public class ConcurrencyConflictException extends EventStoreHelperException {

	private static final long serialVersionUID = 1L;

	private final String streamId;

	public ConcurrencyConflictException(String streamId, String message, Throwable cause) {
		super("Stream " + streamId + " 版本衝突: " + message, cause);
		this.streamId = streamId;
	}
}
