package com.example.streamhelper.application.shared.exception;

/**
 * 事件流輔助層的根例外
 *
 * <p>
 * 本層所有例外皆為非受檢例外，直接往上拋給呼叫端，不做任何靜默重試。
 * </p>
 */
public class EventStoreHelperException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public EventStoreHelperException(String message) {
		super(message);
	}

	public EventStoreHelperException(String message, Throwable cause) {
		super(message, cause);
	}
}
