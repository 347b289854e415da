package com.example.streamhelper.application.domain.account.migration;

import java.util.List;

import com.example.streamhelper.application.domain.account.aggregate.AccountType;
import com.example.streamhelper.application.domain.account.event.AccountEventType;
import com.example.streamhelper.application.domain.event.VersionedEvent;
import com.example.streamhelper.application.domain.migration.EventMigration;

import tools.jackson.databind.node.ObjectNode;

/**
 * 帳戶事件 v1 -> v2 的升級定義
 *
 * <ul>
 * <li>AccountCreated：補上 accountType，舊帳戶一律視為 checking</li>
 * <li>MoneyDeposited / MoneyWithdrawn：補上 description</li>
 * </ul>
 */
public final class AccountEventMigrations {

	public static final String MIGRATED_DESCRIPTION = "Migrated from V1";

	private AccountEventMigrations() {
	}

	public static List<EventMigration> all() {
		return List.of(accountCreatedV1ToV2(), moneyDepositedV1ToV2(), moneyWithdrawnV1ToV2());
	}

	public static EventMigration accountCreatedV1ToV2() {
		return v1ToV2(AccountEventType.ACCOUNT_CREATED, "accountType", AccountType.CHECKING);
	}

	public static EventMigration moneyDepositedV1ToV2() {
		return v1ToV2(AccountEventType.MONEY_DEPOSITED, "description", MIGRATED_DESCRIPTION);
	}

	public static EventMigration moneyWithdrawnV1ToV2() {
		return v1ToV2(AccountEventType.MONEY_WITHDRAWN, "description", MIGRATED_DESCRIPTION);
	}

	private static EventMigration v1ToV2(AccountEventType type, String field, String defaultValue) {
		return EventMigration.builder().eventType(type.getTypeName()).fromVersion(1).toVersion(2)
				.migrate(event -> withDefault(event, field, defaultValue, 2)).build();
	}

	private static VersionedEvent withDefault(VersionedEvent event, String field, String defaultValue, int toVersion) {
		ObjectNode data = event.getData().deepCopy();
		if (!data.hasNonNull(field)) {
			data.put(field, defaultValue);
		}
		return event.toBuilder().version(toVersion).data(data).build();
	}
}
