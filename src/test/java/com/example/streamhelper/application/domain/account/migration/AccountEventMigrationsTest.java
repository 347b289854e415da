package com.example.streamhelper.application.domain.account.migration;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import com.example.streamhelper.application.domain.account.aggregate.AccountType;
import com.example.streamhelper.application.domain.account.event.AccountEventType;
import com.example.streamhelper.application.domain.event.VersionedEvent;
import com.example.streamhelper.application.domain.migration.EventMigrationChain;

import tools.jackson.databind.node.JsonNodeFactory;
import tools.jackson.databind.node.ObjectNode;

class AccountEventMigrationsTest {

	private final EventMigrationChain chain = new EventMigrationChain(AccountEventType.CURRENT_VERSION,
			AccountEventMigrations.all());

	@Test
	void accountCreatedGetsDefaultAccountType() {
		ObjectNode data = JsonNodeFactory.instance.objectNode();
		data.put("id", "acc-1").put("initialBalance", 10.0);
		VersionedEvent v1 = VersionedEvent.of(AccountEventType.ACCOUNT_CREATED.getTypeName(), 1, data);

		VersionedEvent v2 = chain.apply(v1);

		assertThat(v2.getVersion()).isEqualTo(2);
		assertThat(v2.getData().get("accountType")).isEqualTo(JsonNodeFactory.instance.objectNode()
				.put("v", AccountType.CHECKING).get("v"));
		assertThat(v1.getData().has("accountType")).isFalse();
	}

	@Test
	void moneyMovedGetsMigratedDescriptionButKeepsExistingOne() {
		ObjectNode bare = JsonNodeFactory.instance.objectNode();
		bare.put("amount", 5.0);
		ObjectNode described = bare.deepCopy();
		described.put("description", "ATM");

		VersionedEvent deposit = chain.apply(VersionedEvent.of(AccountEventType.MONEY_DEPOSITED.getTypeName(), 1, bare));
		VersionedEvent withdrawal = chain
				.apply(VersionedEvent.of(AccountEventType.MONEY_WITHDRAWN.getTypeName(), 1, described));

		assertThat(deposit.getData().get("description")).isEqualTo(JsonNodeFactory.instance.objectNode()
				.put("v", AccountEventMigrations.MIGRATED_DESCRIPTION).get("v"));
		assertThat(withdrawal.getData().get("description")).isEqualTo(described.get("description"));
		assertThat(withdrawal.getVersion()).isEqualTo(2);
	}
}
