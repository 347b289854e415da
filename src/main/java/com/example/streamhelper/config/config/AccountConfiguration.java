package com.example.streamhelper.config.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.streamhelper.application.domain.account.aggregate.AccountEventReducer;
import com.example.streamhelper.application.domain.account.migration.AccountEventMigrations;
import com.example.streamhelper.application.domain.migration.EventMigration;

import tools.jackson.databind.ObjectMapper;

/**
 * 範例銀行帳戶的 Reducer 與事件升級配置
 */
@Configuration
public class AccountConfiguration {

	@Bean
	public AccountEventReducer accountEventReducer(ObjectMapper objectMapper) {
		return new AccountEventReducer(objectMapper);
	}

	@Bean
	public EventMigration accountCreatedV1ToV2() {
		return AccountEventMigrations.accountCreatedV1ToV2();
	}

	@Bean
	public EventMigration moneyDepositedV1ToV2() {
		return AccountEventMigrations.moneyDepositedV1ToV2();
	}

	@Bean
	public EventMigration moneyWithdrawnV1ToV2() {
		return AccountEventMigrations.moneyWithdrawnV1ToV2();
	}
}
