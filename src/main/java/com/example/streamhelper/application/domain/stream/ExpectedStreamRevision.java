package com.example.streamhelper.application.domain.stream;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 追加事件時的樂觀鎖條件
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ExpectedStreamRevision {

	public enum Kind {
		ANY, // 不檢查
		NO_STREAM, // Stream 必須尚未存在
		EXACT // 最後一筆事件的 Revision 必須相符
	}

	private static final ExpectedStreamRevision ANY = new ExpectedStreamRevision(Kind.ANY, -1);
	private static final ExpectedStreamRevision NO_STREAM = new ExpectedStreamRevision(Kind.NO_STREAM, -1);

	private final Kind kind;

	private final long revision;

	public static ExpectedStreamRevision any() {
		return ANY;
	}

	public static ExpectedStreamRevision noStream() {
		return NO_STREAM;
	}

	public static ExpectedStreamRevision exactly(long revision) {
		if (revision < 0) {
			throw new IllegalArgumentException("Revision 不可為負數: " + revision);
		}
		return new ExpectedStreamRevision(Kind.EXACT, revision);
	}

	/**
	 * 依據已重建的事件數換算條件：0 筆代表 Stream 尚不存在，否則最後一筆的 Revision 為 version - 1
	 */
	public static ExpectedStreamRevision afterVersion(long version) {
		return version == 0 ? NO_STREAM : exactly(version - 1);
	}

	@Override
	public String toString() {
		return kind == Kind.EXACT ? "EXACT(" + revision + ")" : kind.name();
	}
}
