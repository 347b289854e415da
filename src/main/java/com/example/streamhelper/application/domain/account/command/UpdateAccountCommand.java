package com.example.streamhelper.application.domain.account.command;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 帳戶存提款指令
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateAccountCommand {

	/**
	 * 執行操作的目標帳戶 ID
	 */
	private String accountId;

	/**
	 * 交易金額 (需正數)
	 */
	private double amount;

	/**
	 * 業務備註
	 */
	private String description;

	/**
	 * 發起操作的使用者
	 */
	private String userId;
}
