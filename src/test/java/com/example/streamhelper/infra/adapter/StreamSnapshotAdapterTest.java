package com.example.streamhelper.infra.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.example.streamhelper.application.domain.account.aggregate.BankAccount;
import com.example.streamhelper.application.domain.snapshot.Snapshot;
import com.example.streamhelper.application.domain.stream.StreamNaming;
import com.example.streamhelper.application.shared.exception.EventLogException;
import com.example.streamhelper.infra.event.codec.EventJsonCodec;
import com.example.streamhelper.support.InMemoryEventLog;
import com.example.streamhelper.support.TestEvents;

import tools.jackson.databind.json.JsonMapper;

class StreamSnapshotAdapterTest {

	private InMemoryEventLog eventLog;

	private StreamSnapshotAdapter adapter;

	@BeforeEach
	void setUp() {
		eventLog = new InMemoryEventLog();
		adapter = new StreamSnapshotAdapter(eventLog, new EventJsonCodec(JsonMapper.builder().build()),
				StreamNaming.defaults());
	}

	@Test
	void noSnapshotStreamMeansNoSnapshot() {
		assertThat(adapter.findLatest("aggregate-1", BankAccount.class)).isEmpty();
	}

	@Test
	void latestSnapshotWins() {
		adapter.save("aggregate-1", snapshot(100, 5));
		adapter.save("aggregate-1", snapshot(250, 10));

		Optional<Snapshot<BankAccount>> latest = adapter.findLatest("aggregate-1", BankAccount.class);

		assertThat(eventLog.events("aggregate-1-snapshot")).hasSize(2)
				.allMatch(event -> StreamSnapshotAdapter.SNAPSHOT_EVENT_TYPE.equals(event.getType()));
		assertThat(latest).isPresent();
		assertThat(latest.get().getVersion()).isEqualTo(10);
		assertThat(latest.get().getState()).isEqualTo(account(250));
		assertThat(latest.get().getTimestamp()).isEqualTo("2026-01-01T00:00:00Z");
	}

	@Test
	void ignoresForeignLastEvent() {
		adapter.save("aggregate-1", snapshot(100, 5));
		eventLog.seed("aggregate-1-snapshot", TestEvents.valueUpdated(1));

		assertThat(adapter.findLatest("aggregate-1", BankAccount.class)).isEmpty();
	}

	@Test
	void undecodableSnapshotIsReportedAsEventLogFailure() {
		adapter.save("aggregate-1", Snapshot.<Integer>builder().state(3).version(5).timestamp("t").build());

		assertThatThrownBy(() -> adapter.findLatest("aggregate-1", BankAccount.class))
				.isInstanceOf(EventLogException.class);
	}

	private static Snapshot<BankAccount> snapshot(double balance, long version) {
		return Snapshot.<BankAccount>builder().state(account(balance)).version(version)
				.timestamp("2026-01-01T00:00:00Z").build();
	}

	private static BankAccount account(double balance) {
		return BankAccount.builder().id("1").owner("Alice").balance(balance).accountType("savings")
				.createdAt("2026-01-01T00:00:00Z").updatedAt("2026-01-01T00:00:00Z").build();
	}
}
