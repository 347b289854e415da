package com.example.streamhelper.application.service;

import java.util.Optional;

import org.springframework.stereotype.Service;

import com.example.streamhelper.application.domain.account.aggregate.AccountEventReducer;
import com.example.streamhelper.application.domain.account.aggregate.BankAccount;
import com.example.streamhelper.application.domain.stream.StreamState;

import lombok.AllArgsConstructor;

/**
 * 帳戶查詢服務，直接由事件重建目前狀態
 */
@Service
@AllArgsConstructor
public class AccountQueryService {

	private final AggregateTransactionCoordinator coordinator;
	private final AccountEventReducer reducer;

	public Optional<BankAccount> getAccount(String accountId) {
		return Optional.ofNullable(getAccountState(accountId).getState());
	}

	/**
	 * 帳戶狀態與版本 (已套用的事件數)
	 */
	public StreamState<BankAccount> getAccountState(String accountId) {
		return coordinator.getAggregateState(accountId, BankAccount.class, reducer);
	}
}
