package com.example.streamhelper.config.config;

import java.time.Clock;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.streamhelper.application.domain.migration.EventMigration;
import com.example.streamhelper.application.domain.migration.EventMigrationChain;
import com.example.streamhelper.application.domain.snapshot.SnapshotPolicy;
import com.example.streamhelper.application.domain.stream.StreamNaming;
import com.example.streamhelper.application.port.EventLogPort;
import com.example.streamhelper.application.port.SnapshotRepositoryPort;
import com.example.streamhelper.application.service.AggregateTransactionCoordinator;
import com.example.streamhelper.application.service.StreamReconstructor;
import com.example.streamhelper.config.properties.StreamHelperProperties;
import com.example.streamhelper.infra.adapter.StreamSnapshotAdapter;
import com.example.streamhelper.infra.event.codec.EventJsonCodec;

/**
 * 事件重建與交易協調的組裝
 * <p>
 * 所有元件皆以建構子注入 {@link EventLogPort}，不使用任何全域共享的客戶端。容器中所有 {@link EventMigration} Bean
 * 會被收集成同一條升級鏈。
 * </p>
 */
@Configuration
@EnableConfigurationProperties(StreamHelperProperties.class)
public class StreamHelperConfiguration {

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	public StreamNaming streamNaming(StreamHelperProperties properties) {
		return new StreamNaming(properties.getAggregateStreamPrefix(), properties.getEntityStreamPrefixes(),
				properties.getSnapshotStreamSuffix());
	}

	@Bean
	public EventMigrationChain eventMigrationChain(StreamHelperProperties properties,
			ObjectProvider<EventMigration> eventMigrations) {
		return new EventMigrationChain(properties.getCurrentEventVersion(), eventMigrations.orderedStream().toList());
	}

	@Bean
	public SnapshotPolicy snapshotPolicy(StreamHelperProperties properties) {
		return new SnapshotPolicy(properties.getSnapshotFrequency());
	}

	@Bean
	public SnapshotRepositoryPort snapshotRepositoryPort(EventLogPort eventLogPort, EventJsonCodec eventJsonCodec,
			StreamNaming streamNaming) {
		return new StreamSnapshotAdapter(eventLogPort, eventJsonCodec, streamNaming);
	}

	@Bean
	public StreamReconstructor streamReconstructor(EventLogPort eventLogPort,
			SnapshotRepositoryPort snapshotRepositoryPort, EventMigrationChain eventMigrationChain,
			SnapshotPolicy snapshotPolicy, Clock clock) {
		return new StreamReconstructor(eventLogPort, snapshotRepositoryPort, eventMigrationChain, snapshotPolicy,
				clock);
	}

	@Bean
	public AggregateTransactionCoordinator aggregateTransactionCoordinator(StreamReconstructor streamReconstructor,
			EventLogPort eventLogPort, StreamNaming streamNaming) {
		return new AggregateTransactionCoordinator(streamReconstructor, eventLogPort, streamNaming);
	}
}
