package com.example.streamhelper.iface.dto.req;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

/**
 * 開戶請求資源 (API Request DTO)
 */
@Data
public class CreateAccountResource {

	@NotBlank(message = "戶名不可為空")
	private String owner;

	@NotNull(message = "初始餘額不可為空")
	@Min(value = 0, message = "初始餘額不可為負數")
	private Double initialBalance;

	/**
	 * savings / checking，可選填
	 */
	@Pattern(regexp = "savings|checking", message = "帳戶類型僅限 savings 或 checking")
	private String accountType;
}
