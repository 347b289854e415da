package com.example.streamhelper.support;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

import com.example.streamhelper.application.domain.event.LoggedEvent;
import com.example.streamhelper.application.domain.event.VersionedEvent;
import com.example.streamhelper.application.domain.stream.ExpectedStreamRevision;
import com.example.streamhelper.application.port.EventLogPort;
import com.example.streamhelper.application.shared.exception.ConcurrencyConflictException;
import com.example.streamhelper.application.shared.exception.EventLogException;
import com.example.streamhelper.application.shared.exception.EventStreamNotFoundException;

/**
 * 測試用的記憶體 Event Log，行為比照 EventStoreDB：從未寫入的 Stream 讀取時拋出 not found，追加時檢查 expected
 * revision。
 */
public class InMemoryEventLog implements EventLogPort {

	private final Map<String, List<VersionedEvent>> streams = new HashMap<>();

	private final List<String> appendedStreams = new ArrayList<>();

	private Predicate<String> failingStreams = stream -> false;

	@Override
	public List<LoggedEvent> readStream(String streamId, long fromRevision) {
		List<VersionedEvent> events = require(streamId);
		List<LoggedEvent> result = new ArrayList<>();
		for (int revision = (int) fromRevision; revision < events.size(); revision++) {
			result.add(new LoggedEvent(copy(events.get(revision)), revision));
		}
		return result;
	}

	@Override
	public Optional<LoggedEvent> readLastEvent(String streamId) {
		List<VersionedEvent> events = require(streamId);
		if (events.isEmpty()) {
			return Optional.empty();
		}
		int last = events.size() - 1;
		return Optional.of(new LoggedEvent(copy(events.get(last)), last));
	}

	@Override
	public void appendToStream(String streamId, List<VersionedEvent> events, ExpectedStreamRevision expectedRevision) {
		if (failingStreams.test(streamId)) {
			throw new EventLogException("模擬寫入失敗: " + streamId);
		}
		List<VersionedEvent> existing = streams.get(streamId);
		switch (expectedRevision.getKind()) {
		case NO_STREAM -> {
			if (existing != null) {
				throw new ConcurrencyConflictException(streamId, "預期 Stream 不存在", null);
			}
		}
		case EXACT -> {
			long actual = existing == null ? -1 : existing.size() - 1;
			if (actual != expectedRevision.getRevision()) {
				throw new ConcurrencyConflictException(streamId,
						"預期 " + expectedRevision.getRevision() + " 實際 " + actual, null);
			}
		}
		case ANY -> {
		}
		}
		List<VersionedEvent> target = streams.computeIfAbsent(streamId, id -> new ArrayList<>());
		events.forEach(event -> target.add(copy(event)));
		appendedStreams.add(streamId);
	}

	/**
	 * 直接寫入事件，不經過任何檢查也不計入 append 次數 (用來佈置舊版本事件)
	 */
	public void seed(String streamId, VersionedEvent... events) {
		List<VersionedEvent> target = streams.computeIfAbsent(streamId, id -> new ArrayList<>());
		for (VersionedEvent event : events) {
			target.add(copy(event));
		}
	}

	public void failAppendsTo(Predicate<String> streams) {
		this.failingStreams = streams;
	}

	public List<VersionedEvent> events(String streamId) {
		return List.copyOf(streams.getOrDefault(streamId, List.of()));
	}

	public boolean exists(String streamId) {
		return streams.containsKey(streamId);
	}

	/**
	 * 依序記錄每次 append 的目標 Stream
	 */
	public List<String> appendedStreams() {
		return List.copyOf(appendedStreams);
	}

	public long appendCount(String streamId) {
		return appendedStreams.stream().filter(streamId::equals).count();
	}

	private List<VersionedEvent> require(String streamId) {
		List<VersionedEvent> events = streams.get(streamId);
		if (events == null) {
			throw new EventStreamNotFoundException(streamId);
		}
		return events;
	}

	private static VersionedEvent copy(VersionedEvent event) {
		return event.toBuilder().data(event.getData() != null ? event.getData().deepCopy() : null)
				.metadata(event.getMetadata() != null ? event.getMetadata().deepCopy() : null).build();
	}
}
