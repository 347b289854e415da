package com.example.streamhelper.application.domain.stream;

import lombok.Value;

/**
 * 重建結果：狀態與已套用的事件數
 *
 * <p>
 * {@code state == null && version == 0} 是「聚合根不存在」的標準訊號。
 * </p>
 *
 * @param <S> 聚合狀態型別
 */
@Value
public class StreamState<S> {

	S state;

	long version;

	public static <S> StreamState<S> empty() {
		return new StreamState<>(null, 0);
	}

	public boolean exists() {
		return state != null;
	}
}
