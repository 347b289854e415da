package com.example.streamhelper.application.domain.account.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * MoneyDeposited / MoneyWithdrawn 共用的事件內容 (v2)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MoneyMovedPayload {

	private double amount;

	/**
	 * v2 新增欄位
	 */
	private String description;

	private String timestamp;
}
