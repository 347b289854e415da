package com.example.streamhelper.iface.dto.res;

import com.example.streamhelper.application.domain.account.aggregate.BankAccount;

public record AccountResource(String code, String message, BankAccount data) {

}
