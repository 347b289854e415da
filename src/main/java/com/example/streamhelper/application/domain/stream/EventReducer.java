package com.example.streamhelper.application.domain.stream;

import com.example.streamhelper.application.domain.event.VersionedEvent;

/**
 * 由呼叫端提供的狀態摺疊函式 (applyEvent)
 *
 * <p>
 * 必須是純函式：不得修改傳入的 state，而是回傳新的值。業務規則違反時可直接拋出例外，重建流程會原樣傳遞。
 * </p>
 *
 * @param <S> 聚合狀態型別
 */
@FunctionalInterface
public interface EventReducer<S> {

	/**
	 * @param state 目前狀態，第一個事件時為 null
	 * @param event 已升級至目前版本的事件
	 * @return 新狀態
	 */
	S apply(S state, VersionedEvent event);
}
