package com.example.streamhelper.iface.rest;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.streamhelper.application.domain.account.aggregate.BankAccount;
import com.example.streamhelper.application.domain.account.command.CreateAccountCommand;
import com.example.streamhelper.application.domain.account.command.UpdateAccountCommand;
import com.example.streamhelper.application.service.AccountCommandService;
import com.example.streamhelper.application.service.AccountQueryService;
import com.example.streamhelper.application.shared.exception.EventStreamNotFoundException;
import com.example.streamhelper.iface.dto.req.BaseTransactionResource;
import com.example.streamhelper.iface.dto.req.CreateAccountResource;
import com.example.streamhelper.iface.dto.res.AccountResource;

import jakarta.validation.Valid;
import lombok.AllArgsConstructor;

/**
 * 帳戶控制器
 *
 * <p>
 * 寫入經由 {@link AccountCommandService} 以交易方式同步寫入 EventStore，查詢則每次由事件 (與快照) 重建帳戶狀態。錯誤碼對應由
 * {@link com.example.streamhelper.iface.advice.GlobalExceptionHandler} 統一處理。
 * </p>
 */
@RestController
@AllArgsConstructor
@RequestMapping("/accounts")
public class AccountController {

	private static final String USER_HEADER = "X-User-Id";

	private final AccountCommandService commandService;
	private final AccountQueryService queryService;

	/**
	 * 開戶
	 */
	@PostMapping
	public ResponseEntity<AccountResource> create(@Valid @RequestBody CreateAccountResource request,
			@RequestHeader(value = USER_HEADER, required = false) String userId) {
		CreateAccountCommand command = CreateAccountCommand.builder().owner(request.getOwner())
				.initialBalance(request.getInitialBalance()).accountType(request.getAccountType()).userId(userId)
				.build();
		BankAccount account = commandService.createAccount(command);
		return ResponseEntity.status(HttpStatus.CREATED).body(new AccountResource("201", "開戶成功", account));
	}

	/**
	 * 查詢帳戶
	 */
	@GetMapping("/{id}")
	public ResponseEntity<AccountResource> get(@PathVariable String id) {
		BankAccount account = queryService.getAccount(id).orElseThrow(() -> new EventStreamNotFoundException(id));
		return ResponseEntity.ok(new AccountResource("200", "查詢成功", account));
	}

	/**
	 * 存款
	 */
	@PostMapping("/{id}/deposit")
	public ResponseEntity<AccountResource> deposit(@PathVariable String id,
			@Valid @RequestBody BaseTransactionResource request,
			@RequestHeader(value = USER_HEADER, required = false) String userId) {
		BankAccount account = commandService.deposit(toCommand(id, request, userId, "API Deposit"));
		return ResponseEntity.ok(new AccountResource("200", "存款成功", account));
	}

	/**
	 * 提款
	 */
	@PostMapping("/{id}/withdraw")
	public ResponseEntity<AccountResource> withdraw(@PathVariable String id,
			@Valid @RequestBody BaseTransactionResource request,
			@RequestHeader(value = USER_HEADER, required = false) String userId) {
		BankAccount account = commandService.withdraw(toCommand(id, request, userId, "API Withdrawal"));
		return ResponseEntity.ok(new AccountResource("200", "提款成功", account));
	}

	private UpdateAccountCommand toCommand(String id, BaseTransactionResource request, String userId,
			String defaultDescription) {
		return UpdateAccountCommand.builder().accountId(id).amount(request.getAmount())
				.description(request.getDescription() != null ? request.getDescription() : defaultDescription)
				.userId(userId).build();
	}
}
