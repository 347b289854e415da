package com.example.streamhelper.application.service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.example.streamhelper.application.domain.account.aggregate.AccountEventReducer;
import com.example.streamhelper.application.domain.account.aggregate.AccountType;
import com.example.streamhelper.application.domain.account.aggregate.BankAccount;
import com.example.streamhelper.application.domain.account.command.CreateAccountCommand;
import com.example.streamhelper.application.domain.account.command.UpdateAccountCommand;
import com.example.streamhelper.application.domain.account.event.AccountCreatedPayload;
import com.example.streamhelper.application.domain.account.event.AccountEventType;
import com.example.streamhelper.application.domain.account.event.MoneyMovedPayload;
import com.example.streamhelper.application.domain.account.event.TransactionMetadata;
import com.example.streamhelper.application.domain.event.EntityReference;
import com.example.streamhelper.application.domain.event.VersionedEvent;
import com.example.streamhelper.application.domain.stream.StreamState;
import com.example.streamhelper.application.shared.exception.DomainInvariantViolationException;
import com.example.streamhelper.application.shared.exception.EventStreamNotFoundException;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.ObjectNode;

/**
 * 帳戶指令服務
 *
 * <p>
 * 每個指令都是一筆協調器交易：先重建目前狀態並檢查業務規則，再以「載入時的版本」開始交易，寫入帳戶事件與一個 transaction
 * 實體副本。提交時若帳戶已被其他請求異動，Event Log 會回報版本衝突。
 * </p>
 */
@Slf4j
@Service
@AllArgsConstructor
public class AccountCommandService {

	/**
	 * 帳戶事件影響的實體類型
	 */
	public static final String TRANSACTION_ENTITY = "transaction";

	private static final String SOURCE = "api";

	private final AggregateTransactionCoordinator coordinator;
	private final AccountEventReducer reducer;
	private final ObjectMapper objectMapper;
	private final Clock clock;

	/**
	 * 開戶
	 *
	 * @param command 開戶指令
	 * @return 開戶後的帳戶狀態
	 */
	public BankAccount createAccount(CreateAccountCommand command) {
		String accountType = command.getAccountType() != null ? command.getAccountType() : AccountType.CHECKING;
		if (!AccountType.isValid(accountType)) {
			throw new DomainInvariantViolationException("不支援的帳戶類型: " + accountType);
		}
		if (command.getInitialBalance() < 0) {
			throw new DomainInvariantViolationException("初始餘額不可為負數");
		}

		String accountId = UUID.randomUUID().toString();
		AccountCreatedPayload payload = AccountCreatedPayload.builder().id(accountId).owner(command.getOwner())
				.initialBalance(command.getInitialBalance()).accountType(accountType).timestamp(now()).build();

		execute(accountId, 0, AccountEventType.ACCOUNT_CREATED, payload, command.getUserId());
		log.info("帳戶已開立: {} ({}, 初始餘額 {})", accountId, accountType, command.getInitialBalance());
		return load(accountId).getState();
	}

	/**
	 * 存款
	 */
	public BankAccount deposit(UpdateAccountCommand command) {
		requirePositive(command.getAmount());
		StreamState<BankAccount> current = loadExisting(command.getAccountId());

		MoneyMovedPayload payload = MoneyMovedPayload.builder().amount(command.getAmount())
				.description(command.getDescription()).timestamp(now()).build();
		execute(command.getAccountId(), current.getVersion(), AccountEventType.MONEY_DEPOSITED, payload,
				command.getUserId());
		return load(command.getAccountId()).getState();
	}

	/**
	 * 提款，餘額不足時不寫入任何事件
	 */
	public BankAccount withdraw(UpdateAccountCommand command) {
		requirePositive(command.getAmount());
		StreamState<BankAccount> current = loadExisting(command.getAccountId());
		if (current.getState().getBalance() < command.getAmount()) {
			throw new DomainInvariantViolationException("帳戶 " + command.getAccountId() + " 餘額不足！");
		}

		MoneyMovedPayload payload = MoneyMovedPayload.builder().amount(command.getAmount())
				.description(command.getDescription()).timestamp(now()).build();
		execute(command.getAccountId(), current.getVersion(), AccountEventType.MONEY_WITHDRAWN, payload,
				command.getUserId());
		return load(command.getAccountId()).getState();
	}

	/**
	 * 以單一交易寫入帳戶事件，失敗時清除交易並原樣拋出例外
	 */
	private void execute(String accountId, long expectedVersion, AccountEventType type, Object payload,
			String userId) {
		String transactionId = UUID.randomUUID().toString();
		TransactionMetadata metadata = TransactionMetadata.builder().userId(userId != null ? userId : "anonymous")
				.source(SOURCE).transactionId(transactionId).build();
		VersionedEvent event = VersionedEvent.builder().type(type.getTypeName())
				.version(AccountEventType.CURRENT_VERSION).data(objectMapper.valueToTree(payload))
				.metadata(objectMapper.<ObjectNode>valueToTree(metadata)).build();

		coordinator.beginTransaction(accountId, expectedVersion);
		try {
			coordinator.addEvent(accountId, event,
					List.of(new EntityReference(transactionId, TRANSACTION_ENTITY, 1)));
			coordinator.commitTransaction(accountId);
		} catch (RuntimeException e) {
			coordinator.rollbackTransaction(accountId);
			throw e;
		}
	}

	private StreamState<BankAccount> loadExisting(String accountId) {
		StreamState<BankAccount> current = load(accountId);
		if (!current.exists()) {
			throw new EventStreamNotFoundException(accountId);
		}
		return current;
	}

	private StreamState<BankAccount> load(String accountId) {
		return coordinator.getAggregateState(accountId, BankAccount.class, reducer);
	}

	private void requirePositive(double amount) {
		if (amount <= 0) {
			throw new DomainInvariantViolationException("金額必須大於 0");
		}
	}

	private String now() {
		return clock.instant().toString();
	}
}
