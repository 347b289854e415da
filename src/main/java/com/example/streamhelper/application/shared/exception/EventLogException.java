package com.example.streamhelper.application.shared.exception;

/**
 * Event Log 存取失敗 (網路、逾時或資料損毀)
 */
public class EventLogException extends EventStoreHelperException {

	private static final long serialVersionUID = 1L;

	public EventLogException(String message) {
		super(message);
	}

	public EventLogException(String message, Throwable cause) {
		super(message, cause);
	}
}
