package com.example.streamhelper.application.domain.snapshot;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 聚合狀態快照
 *
 * <p>
 * 快照是衍生且可丟棄的資料：全部刪除只會讓重建變慢，不會改變結果。每個聚合根只有最新的一份有意義。
 * </p>
 *
 * @param <S> 狀態型別
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Snapshot<S> {

	/**
	 * 快照當下的聚合狀態
	 */
	private S state;

	/**
	 * 快照涵蓋的事件數，重播時從 Revision = version 開始讀取
	 */
	private long version;

	/**
	 * 快照建立時間 (ISO-8601)
	 */
	private String timestamp;
}
