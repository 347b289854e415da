package com.example.streamhelper.application.domain.account.command;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 開戶指令
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateAccountCommand {

	private String owner;

	private double initialBalance;

	/**
	 * savings / checking，未填時為 checking
	 */
	private String accountType;

	/**
	 * 發起操作的使用者
	 */
	private String userId;
}
