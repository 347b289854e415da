package com.example.streamhelper.application.shared.exception;

/**
 * 事件升級 (Migration) 失敗，整個重建流程隨之中止
 */
public class EventMigrationException extends EventStoreHelperException {

	private static final long serialVersionUID = 1L;

	public EventMigrationException(String message) {
		super(message);
	}

	public EventMigrationException(String message, Throwable cause) {
		super(message, cause);
	}
}
