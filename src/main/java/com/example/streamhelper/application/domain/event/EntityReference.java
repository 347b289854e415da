package com.example.streamhelper.application.domain.event;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 交易內事件所影響的從屬實體
 *
 * <p>
 * 提交時事件會複製一份寫入該實體的 Stream。{@code version} 僅記錄呼叫端聲稱的版本，協調器不會拿它去比對實體 Stream
 * 的實際 Revision。
 * </p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EntityReference {

	private String id;

	private String type;

	private long version;
}
