package com.example.streamhelper.application.domain.account.aggregate;

/**
 * 帳戶類型
 */
public final class AccountType {

	public static final String SAVINGS = "savings"; // 儲蓄帳戶
	public static final String CHECKING = "checking"; // 支票帳戶，亦為舊版事件的預設值

	private AccountType() {
	}

	public static boolean isValid(String accountType) {
		return SAVINGS.equals(accountType) || CHECKING.equals(accountType);
	}
}
