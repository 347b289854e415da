package com.example.streamhelper.application.domain.account.aggregate;

import com.example.streamhelper.application.domain.account.event.AccountCreatedPayload;
import com.example.streamhelper.application.domain.account.event.AccountEventType;
import com.example.streamhelper.application.domain.account.event.MoneyMovedPayload;
import com.example.streamhelper.application.domain.event.VersionedEvent;
import com.example.streamhelper.application.domain.stream.EventReducer;
import com.example.streamhelper.application.shared.exception.DomainInvariantViolationException;

import lombok.RequiredArgsConstructor;
import tools.jackson.databind.ObjectMapper;

/**
 * 帳戶狀態 Reducer
 *
 * <p>
 * 事件內容只在這裡解碼為具體型別。規則：
 * <ul>
 * <li>AccountCreated 只能是第一筆事件</li>
 * <li>其他事件之前必須已有 AccountCreated</li>
 * <li>提款不可超過餘額</li>
 * </ul>
 * 違反時拋出 {@link DomainInvariantViolationException}，重建流程隨之中止。
 * </p>
 */
@RequiredArgsConstructor
public class AccountEventReducer implements EventReducer<BankAccount> {

	private final ObjectMapper objectMapper;

	@Override
	public BankAccount apply(BankAccount state, VersionedEvent event) {
		AccountEventType type = AccountEventType.fromTypeName(event.getType())
				.orElseThrow(() -> new DomainInvariantViolationException("未知事件類型: " + event.getType()));

		return switch (type) {
		case ACCOUNT_CREATED -> created(state, objectMapper.treeToValue(event.getData(), AccountCreatedPayload.class));
		case MONEY_DEPOSITED -> deposited(state, objectMapper.treeToValue(event.getData(), MoneyMovedPayload.class));
		case MONEY_WITHDRAWN -> withdrawn(state, objectMapper.treeToValue(event.getData(), MoneyMovedPayload.class));
		};
	}

	private BankAccount created(BankAccount state, AccountCreatedPayload payload) {
		if (state != null) {
			throw new DomainInvariantViolationException("AccountCreated 只能是第一筆事件");
		}
		return BankAccount.builder().id(payload.getId()).owner(payload.getOwner())
				.balance(payload.getInitialBalance())
				.accountType(payload.getAccountType() != null ? payload.getAccountType() : AccountType.CHECKING)
				.createdAt(payload.getTimestamp()).updatedAt(payload.getTimestamp()).build();
	}

	private BankAccount deposited(BankAccount state, MoneyMovedPayload payload) {
		requireCreated(state);
		return state.toBuilder().balance(state.getBalance() + payload.getAmount()).updatedAt(payload.getTimestamp())
				.build();
	}

	private BankAccount withdrawn(BankAccount state, MoneyMovedPayload payload) {
		requireCreated(state);
		if (state.getBalance() < payload.getAmount()) {
			throw new DomainInvariantViolationException("帳戶 " + state.getId() + " 餘額不足！");
		}
		return state.toBuilder().balance(state.getBalance() - payload.getAmount()).updatedAt(payload.getTimestamp())
				.build();
	}

	private void requireCreated(BankAccount state) {
		if (state == null) {
			throw new DomainInvariantViolationException("第一筆事件必須是 AccountCreated");
		}
	}
}
