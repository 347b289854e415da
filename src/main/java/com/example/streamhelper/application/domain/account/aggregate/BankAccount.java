package com.example.streamhelper.application.domain.account.aggregate;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 銀行帳戶聚合狀態
 *
 * <p>
 * 由 {@link AccountEventReducer} 依事件摺疊產生，也會原樣序列化進快照。
 * </p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BankAccount {

	/**
	 * 帳戶識別碼
	 */
	private String id;

	/**
	 * 戶名
	 */
	private String owner;

	/**
	 * 目前餘額
	 */
	private double balance;

	/**
	 * 帳戶類型：savings / checking
	 */
	private String accountType;

	/**
	 * 開戶時間 (ISO-8601)
	 */
	private String createdAt;

	/**
	 * 最後異動時間 (ISO-8601)
	 */
	private String updatedAt;
}
