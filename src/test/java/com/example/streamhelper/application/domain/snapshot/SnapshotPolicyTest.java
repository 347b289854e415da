package com.example.streamhelper.application.domain.snapshot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.stream.LongStream;

import org.junit.jupiter.api.Test;

class SnapshotPolicyTest {

	@Test
	void triggersOnlyOnPositiveMultiplesOfFrequency() {
		SnapshotPolicy policy = new SnapshotPolicy(5);

		assertThat(LongStream.rangeClosed(0, 20).filter(policy::shouldSnapshot).toArray())
				.containsExactly(5, 10, 15, 20);
	}

	@Test
	void zeroFrequencyDisablesSnapshots() {
		SnapshotPolicy policy = SnapshotPolicy.disabled();

		assertThat(policy.isEnabled()).isFalse();
		assertThat(LongStream.rangeClosed(0, 20).anyMatch(policy::shouldSnapshot)).isFalse();
	}

	@Test
	void rejectsNegativeFrequency() {
		assertThatThrownBy(() -> new SnapshotPolicy(-1)).isInstanceOf(IllegalArgumentException.class);
	}
}
