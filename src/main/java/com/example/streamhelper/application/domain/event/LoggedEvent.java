package com.example.streamhelper.application.domain.event;

import lombok.Value;

/**
 * 從 Event Log 讀回的事件與其在 Stream 中的位置 (Revision，從 0 起算)
 */
@Value
public class LoggedEvent {

	VersionedEvent event;

	long revision;
}
