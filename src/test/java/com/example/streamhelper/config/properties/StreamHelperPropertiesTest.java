package com.example.streamhelper.config.properties;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.streamhelper.application.domain.snapshot.SnapshotPolicy;
import com.example.streamhelper.application.domain.stream.StreamNaming;
import com.example.streamhelper.config.config.StreamHelperConfiguration;

import jakarta.validation.Validation;
import jakarta.validation.Validator;

/**
 * 不啟動 Spring Context，直接驗證設定值的預設、限制與組裝結果
 */
@DisplayName("StreamHelperProperties")
class StreamHelperPropertiesTest {

	private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

	private final StreamHelperConfiguration configuration = new StreamHelperConfiguration();

	@Test
	@DisplayName("預設值：停用快照、事件版本 1、aggregate- 前綴")
	void defaults() {
		StreamHelperProperties properties = new StreamHelperProperties();

		assertThat(validator.validate(properties)).isEmpty();
		assertThat(configuration.snapshotPolicy(properties).isEnabled()).isFalse();

		StreamNaming naming = configuration.streamNaming(properties);
		assertThat(naming.aggregateStream("1")).isEqualTo("aggregate-1");
		assertThat(naming.snapshotStream("aggregate-1")).isEqualTo("aggregate-1-snapshot");
	}

	@Test
	@DisplayName("依設定值組裝快照策略與 Stream 命名")
	void wiresConfiguredValues() {
		StreamHelperProperties properties = new StreamHelperProperties();
		properties.setSnapshotFrequency(3);
		properties.setCurrentEventVersion(2);
		properties.setAggregateStreamPrefix("account-");
		properties.setEntityStreamPrefixes(Map.of("transaction", "tx"));

		SnapshotPolicy policy = configuration.snapshotPolicy(properties);
		StreamNaming naming = configuration.streamNaming(properties);

		assertThat(policy.shouldSnapshot(3)).isTrue();
		assertThat(policy.shouldSnapshot(5)).isFalse();
		assertThat(naming.aggregateStream("1")).isEqualTo("account-1");
		assertThat(naming.entityStream("transaction", "9")).isEqualTo("tx-9");
	}

	@Test
	@DisplayName("拒絕負數快照頻率與小於 1 的事件版本")
	void rejectsOutOfRangeValues() {
		StreamHelperProperties properties = new StreamHelperProperties();
		properties.setSnapshotFrequency(-1);
		properties.setCurrentEventVersion(0);

		assertThat(validator.validate(properties)).extracting(v -> v.getPropertyPath().toString())
				.containsExactlyInAnyOrder("snapshotFrequency", "currentEventVersion");
	}
}
