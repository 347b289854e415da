package com.example.streamhelper.iface.advice;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.URI;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

import com.example.streamhelper.application.shared.exception.ConcurrencyConflictException;
import com.example.streamhelper.application.shared.exception.DomainInvariantViolationException;
import com.example.streamhelper.application.shared.exception.EventLogException;
import com.example.streamhelper.application.shared.exception.EventStreamNotFoundException;

class GlobalExceptionHandlerTest {

	private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

	@Test
	void notFoundMapsTo404() {
		ProblemDetail problem = handler.handleNotFound(new EventStreamNotFoundException("acc-1"));

		assertThat(problem.getStatus()).isEqualTo(HttpStatus.NOT_FOUND.value());
		assertThat(problem.getDetail()).contains("acc-1");
		assertThat(problem.getType()).isEqualTo(URI.create("urn:stream-helper:errors:not-found"));
		assertThat(problem.getProperties()).containsKey("timestamp");
	}

	@Test
	void conflictMapsTo409() {
		ProblemDetail problem = handler
				.handleConflict(new ConcurrencyConflictException("account-1", "expected 2", null));

		assertThat(problem.getStatus()).isEqualTo(HttpStatus.CONFLICT.value());
	}

	@Test
	void domainViolationMapsTo400WithMessage() {
		ProblemDetail problem = handler.handleDomainViolation(new DomainInvariantViolationException("帳戶 1 餘額不足！"));

		assertThat(problem.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
		assertThat(problem.getDetail()).isEqualTo("帳戶 1 餘額不足！");
	}

	@Test
	void unexpectedErrorsHideInternals() {
		ProblemDetail problem = handler.handleGeneric(new EventLogException("EventStore 存取失敗: secret"));

		assertThat(problem.getStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR.value());
		assertThat(problem.getDetail()).doesNotContain("secret");
	}
}
