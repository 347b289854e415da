package com.example.streamhelper.application.domain.account.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 隨帳戶事件寫入的追蹤資訊
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionMetadata {

	/**
	 * 發起操作的使用者
	 */
	private String userId;

	/**
	 * 來源，例如 "api"
	 */
	private String source;

	/**
	 * 交易追蹤 ID，同時作為 transaction 實體 Stream 的 ID
	 */
	private String transactionId;
}
