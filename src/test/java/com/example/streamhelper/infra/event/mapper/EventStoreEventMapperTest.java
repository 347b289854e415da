package com.example.streamhelper.infra.event.mapper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import com.eventstore.dbclient.EventData;
import com.eventstore.dbclient.RecordedEvent;
import com.eventstore.dbclient.ResolvedEvent;
import com.example.streamhelper.application.domain.event.LoggedEvent;
import com.example.streamhelper.application.domain.event.VersionedEvent;
import com.example.streamhelper.application.shared.exception.EventLogException;
import com.example.streamhelper.infra.event.codec.EventJsonCodec;

import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.JsonNodeFactory;
import tools.jackson.databind.node.ObjectNode;

class EventStoreEventMapperTest {

	private final JsonMapper objectMapper = JsonMapper.builder().build();

	private final EventStoreEventMapper mapper = new EventStoreEventMapper(new EventJsonCodec(objectMapper));

	@Test
	void writesSchemaVersionIntoMetadata() {
		ObjectNode data = JsonNodeFactory.instance.objectNode();
		data.put("amount", 5.0);
		ObjectNode metadata = JsonNodeFactory.instance.objectNode();
		metadata.put("userId", "u-1");

		EventData eventData = mapper.toEventData(VersionedEvent.builder().type("MoneyDeposited").version(2).data(data)
				.metadata(metadata).build());

		assertThat(eventData.getEventType()).isEqualTo("MoneyDeposited");
		assertThat(eventData.getEventId()).isNotNull();
		JsonNode storedMetadata = objectMapper.readTree(eventData.getUserMetadata());
		assertThat(storedMetadata.path(EventStoreEventMapper.EVENT_VERSION_KEY).asInt()).isEqualTo(2);
		assertThat(storedMetadata.has("userId")).isTrue();
		assertThat(objectMapper.readTree(eventData.getEventData())).isEqualTo(data);
		// 呼叫端的 metadata 不被修改
		assertThat(metadata.has(EventStoreEventMapper.EVENT_VERSION_KEY)).isFalse();
	}

	@Test
	void readsVersionAndStripsItFromMetadata() {
		ResolvedEvent resolved = resolved("MoneyDeposited", "{\"amount\":5.0}",
				"{\"eventVersion\":2,\"userId\":\"u-1\"}", 7);

		LoggedEvent logged = mapper.toLoggedEvent(resolved);

		assertThat(logged.getRevision()).isEqualTo(7);
		assertThat(logged.getEvent().getType()).isEqualTo("MoneyDeposited");
		assertThat(logged.getEvent().getVersion()).isEqualTo(2);
		assertThat(logged.getEvent().getData().path("amount").asDouble()).isEqualTo(5.0);
		assertThat(logged.getEvent().getMetadata().has(EventStoreEventMapper.EVENT_VERSION_KEY)).isFalse();
		assertThat(logged.getEvent().getMetadata().has("userId")).isTrue();
	}

	@Test
	void eventWithoutVersionIsVersionOne() {
		LoggedEvent withoutMetadata = mapper.toLoggedEvent(resolved("AccountCreated", "{\"id\":\"a\"}", null, 0));
		LoggedEvent onlyVersionless = mapper
				.toLoggedEvent(resolved("AccountCreated", "{\"id\":\"a\"}", "{\"userId\":\"u\"}", 0));

		assertThat(withoutMetadata.getEvent().getVersion()).isEqualTo(EventStoreEventMapper.DEFAULT_EVENT_VERSION);
		assertThat(withoutMetadata.getEvent().getMetadata()).isNull();
		assertThat(onlyVersionless.getEvent().getVersion()).isEqualTo(1);
	}

	@Test
	void metadataWithOnlyVersionBecomesNull() {
		LoggedEvent logged = mapper.toLoggedEvent(resolved("AccountCreated", "{}", "{\"eventVersion\":3}", 0));

		assertThat(logged.getEvent().getVersion()).isEqualTo(3);
		assertThat(logged.getEvent().getMetadata()).isNull();
	}

	@Test
	void nonObjectBodyIsRejected() {
		assertThatThrownBy(() -> mapper.toLoggedEvent(resolved("AccountCreated", "[1,2]", null, 0)))
				.isInstanceOf(EventLogException.class);
		assertThatThrownBy(() -> mapper.toLoggedEvent(resolved("AccountCreated", "{}", "\"v2\"", 0)))
				.isInstanceOf(EventLogException.class);
	}

	private static ResolvedEvent resolved(String type, String data, String metadata, long revision) {
		RecordedEvent recorded = mock(RecordedEvent.class);
		when(recorded.getEventType()).thenReturn(type);
		when(recorded.getEventData()).thenReturn(data.getBytes(StandardCharsets.UTF_8));
		when(recorded.getUserMetadata())
				.thenReturn(metadata != null ? metadata.getBytes(StandardCharsets.UTF_8) : new byte[0]);
		when(recorded.getRevision()).thenReturn(revision);

		ResolvedEvent resolved = mock(ResolvedEvent.class);
		when(resolved.getEvent()).thenReturn(recorded);
		return resolved;
	}
}
