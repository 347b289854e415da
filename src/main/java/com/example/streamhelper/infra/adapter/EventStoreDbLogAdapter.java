package com.example.streamhelper.infra.adapter;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.eventstore.dbclient.AppendToStreamOptions;
import com.eventstore.dbclient.EventData;
import com.eventstore.dbclient.EventStoreDBClient;
import com.eventstore.dbclient.ExpectedRevision;
import com.eventstore.dbclient.ReadResult;
import com.eventstore.dbclient.ReadStreamOptions;
import com.eventstore.dbclient.StreamNotFoundException;
import com.eventstore.dbclient.WrongExpectedVersionException;
import com.example.streamhelper.application.domain.event.LoggedEvent;
import com.example.streamhelper.application.domain.event.VersionedEvent;
import com.example.streamhelper.application.domain.stream.ExpectedStreamRevision;
import com.example.streamhelper.application.port.EventLogPort;
import com.example.streamhelper.application.shared.exception.ConcurrencyConflictException;
import com.example.streamhelper.application.shared.exception.EventLogException;
import com.example.streamhelper.application.shared.exception.EventStoreHelperException;
import com.example.streamhelper.application.shared.exception.EventStreamNotFoundException;
import com.example.streamhelper.infra.event.mapper.EventStoreEventMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * EventStoreDB 事件日誌轉接器 (Infrastructure Adapter)
 *
 * <p>
 * 以 {@link EventStoreDBClient} 實作 {@link EventLogPort}。所有呼叫都以同步方式等待結果，並受設定的逾時限制。
 * </p>
 *
 * <p>
 * 例外轉換：
 * <ul>
 * <li>{@link StreamNotFoundException} -> {@link EventStreamNotFoundException}</li>
 * <li>{@link WrongExpectedVersionException} -> {@link ConcurrencyConflictException}</li>
 * <li>其餘錯誤與逾時 -> {@link EventLogException}</li>
 * </ul>
 * </p>
 */
@Slf4j
public class EventStoreDbLogAdapter implements EventLogPort {

	private final EventStoreDBClient client;

	private final EventStoreEventMapper mapper;

	private final Duration timeout;

	public EventStoreDbLogAdapter(EventStoreDBClient client, EventStoreEventMapper mapper, Duration timeout) {
		this.client = client;
		this.mapper = mapper;
		this.timeout = timeout;
	}

	@Override
	public List<LoggedEvent> readStream(String streamId, long fromRevision) {
		ReadStreamOptions options = ReadStreamOptions.get().forwards().fromRevision(fromRevision);
		ReadResult result = await(streamId, client.readStream(streamId, options));
		log.debug(">>> [EventStore] Stream={} 從 Revision {} 讀取到 {} 筆事件", streamId, fromRevision,
				result.getEvents().size());
		return result.getEvents().stream().map(mapper::toLoggedEvent).toList();
	}

	@Override
	public Optional<LoggedEvent> readLastEvent(String streamId) {
		ReadStreamOptions options = ReadStreamOptions.get().backwards().fromEnd().maxCount(1);
		ReadResult result = await(streamId, client.readStream(streamId, options));
		return result.getEvents().stream().findFirst().map(mapper::toLoggedEvent);
	}

	@Override
	public void appendToStream(String streamId, List<VersionedEvent> events, ExpectedStreamRevision expectedRevision) {
		if (events.isEmpty()) {
			return;
		}
		AppendToStreamOptions options = AppendToStreamOptions.get().expectedRevision(toClientRevision(expectedRevision));
		List<EventData> batch = events.stream().map(mapper::toEventData).toList();

		await(streamId, client.appendToStream(streamId, options, batch.iterator()));
		log.debug("EventStore 寫入成功: Stream={}, 筆數={}, Expected={}", streamId, batch.size(), expectedRevision);
	}

	private ExpectedRevision toClientRevision(ExpectedStreamRevision expected) {
		return switch (expected.getKind()) {
		case ANY -> ExpectedRevision.any();
		case NO_STREAM -> ExpectedRevision.noStream();
		case EXACT -> ExpectedRevision.expectedRevision(expected.getRevision());
		};
	}

	private <T> T await(String streamId, CompletableFuture<T> future) {
		try {
			return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
		} catch (ExecutionException e) {
			throw translate(streamId, e.getCause());
		} catch (TimeoutException e) {
			throw new EventLogException("EventStore 操作逾時 (" + timeout + "): Stream=" + streamId, e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new EventLogException("EventStore 操作被中斷: Stream=" + streamId, e);
		}
	}

	private RuntimeException translate(String streamId, Throwable cause) {
		Throwable root = cause;
		while (root instanceof CompletionException && root.getCause() != null) {
			root = root.getCause();
		}
		if (root instanceof StreamNotFoundException) {
			return new EventStreamNotFoundException(streamId, root);
		}
		if (root instanceof WrongExpectedVersionException) {
			return new ConcurrencyConflictException(streamId, String.valueOf(root.getMessage()), root);
		}
		if (root instanceof EventStoreHelperException helperException) {
			return helperException;
		}
		return new EventLogException("EventStore 存取失敗: Stream=" + streamId, root);
	}
}
