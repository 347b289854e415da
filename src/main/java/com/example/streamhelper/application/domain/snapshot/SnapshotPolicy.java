package com.example.streamhelper.application.domain.snapshot;

import lombok.Getter;

/**
 * 快照頻率策略
 *
 * <p>
 * 每累積 {@code frequency} 筆事件存一次快照；{@code frequency == 0} 代表完全停用快照，每次重建都從頭重播。
 * </p>
 */
@Getter
public class SnapshotPolicy {

	private final int frequency;

	public SnapshotPolicy(int frequency) {
		if (frequency < 0) {
			throw new IllegalArgumentException("快照頻率不可為負數: " + frequency);
		}
		this.frequency = frequency;
	}

	public static SnapshotPolicy disabled() {
		return new SnapshotPolicy(0);
	}

	public boolean isEnabled() {
		return frequency > 0;
	}

	public boolean shouldSnapshot(long version) {
		return shouldSnapshot(version, frequency);
	}

	public static boolean shouldSnapshot(long version, int frequency) {
		return frequency > 0 && version > 0 && version % frequency == 0;
	}
}
