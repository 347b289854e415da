package com.example.streamhelper.application.domain.account.event;

import java.util.Arrays;
import java.util.Optional;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 帳戶事件類型，{@code typeName} 即寫入 EventStore 的事件型別
 */
@Getter
@AllArgsConstructor
public enum AccountEventType {
	ACCOUNT_CREATED("AccountCreated"), // 開戶
	MONEY_DEPOSITED("MoneyDeposited"), // 存款
	MONEY_WITHDRAWN("MoneyWithdrawn"); // 提款

	/**
	 * 目前寫入的事件結構版本
	 */
	public static final int CURRENT_VERSION = 2;

	private final String typeName;

	public static Optional<AccountEventType> fromTypeName(String typeName) {
		return Arrays.stream(values()).filter(type -> type.typeName.equals(typeName)).findFirst();
	}
}
