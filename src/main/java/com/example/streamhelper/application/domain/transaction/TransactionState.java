package com.example.streamhelper.application.domain.transaction;

/**
 * 聚合根交易的生命週期
 *
 * <pre>
 * NO_TRANSACTION -> OPEN -> (COMMITTED | ROLLED_BACK) -> NO_TRANSACTION
 * </pre>
 */
public enum TransactionState {
	NO_TRANSACTION, // 尚未開始或已結束
	OPEN, // beginTransaction 之後，可加入事件
	COMMITTED, // 已寫入 Event Log
	ROLLED_BACK // 已捨棄，未寫入任何資料
}
