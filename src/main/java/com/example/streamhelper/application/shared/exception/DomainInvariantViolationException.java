package com.example.streamhelper.application.shared.exception;

/**
 * 業務規則違反，由呼叫端的 Reducer 或應用服務拋出
 *
 * <p>
 * 重建流程不會攔截或包裝此例外，原樣往上傳遞。
 * </p>
 */
public class DomainInvariantViolationException extends EventStoreHelperException {

	private static final long serialVersionUID = 1L;

	public DomainInvariantViolationException(String message) {
		super(message);
	}
}
