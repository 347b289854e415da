package com.example.streamhelper.application.domain.account.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * AccountCreated 事件內容 (v2)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AccountCreatedPayload {

	private String id;

	private String owner;

	private double initialBalance;

	/**
	 * v2 新增欄位
	 */
	private String accountType;

	private String timestamp;
}
