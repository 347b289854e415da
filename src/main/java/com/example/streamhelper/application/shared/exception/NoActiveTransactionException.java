package com.example.streamhelper.application.shared.exception;

import lombok.Getter;

/**
 * 未先呼叫 beginTransaction 就對聚合根操作交易
 */
@Getter
public class NoActiveTransactionException extends EventStoreHelperException {

	private static final long serialVersionUID = 1L;

	private final String aggregateId;

	public NoActiveTransactionException(String aggregateId) {
		super("聚合根 " + aggregateId + " 沒有進行中的交易，請先呼叫 beginTransaction");
		this.aggregateId = aggregateId;
	}
}
