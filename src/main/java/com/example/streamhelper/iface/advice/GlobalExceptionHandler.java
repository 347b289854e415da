package com.example.streamhelper.iface.advice;

import java.net.URI;
import java.time.Instant;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.example.streamhelper.application.shared.exception.ConcurrencyConflictException;
import com.example.streamhelper.application.shared.exception.DomainInvariantViolationException;
import com.example.streamhelper.application.shared.exception.EventStreamNotFoundException;

import lombok.extern.slf4j.Slf4j;

/**
 * 全域例外處理，將例外轉為 RFC 7807 {@link ProblemDetail}
 *
 * <pre>
 * 聚合根不存在    -> 404
 * 版本衝突        -> 409
 * 業務規則 / 驗證 -> 400
 * 其他            -> 500
 * </pre>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

	private static final String ERROR_TYPE_PREFIX = "urn:stream-helper:errors:";

	@ExceptionHandler(EventStreamNotFoundException.class)
	public ProblemDetail handleNotFound(EventStreamNotFoundException ex) {
		log.info("查無資料: {}", ex.getStreamId());
		return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", "找不到 " + ex.getStreamId());
	}

	@ExceptionHandler(ConcurrencyConflictException.class)
	public ProblemDetail handleConflict(ConcurrencyConflictException ex) {
		log.warn("版本衝突: {}", ex.getMessage());
		return problem(HttpStatus.CONFLICT, "Conflict", "conflict", ex.getMessage());
	}

	@ExceptionHandler(DomainInvariantViolationException.class)
	public ProblemDetail handleDomainViolation(DomainInvariantViolationException ex) {
		log.warn("業務規則違反: {}", ex.getMessage());
		return problem(HttpStatus.BAD_REQUEST, "Bad Request", "domain-invariant", ex.getMessage());
	}

	@ExceptionHandler(MethodArgumentNotValidException.class)
	public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
		String detail = ex.getBindingResult().getFieldErrors().stream()
				.map(fe -> fe.getField() + ": " + fe.getDefaultMessage()).reduce((a, b) -> a + "; " + b)
				.orElse("Validation failed");
		log.warn("請求格式錯誤: {}", detail);
		return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
	}

	@ExceptionHandler(Exception.class)
	public ProblemDetail handleGeneric(Exception ex) {
		log.error("未預期的錯誤", ex);
		return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
				"An unexpected error occurred");
	}

	private ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
		ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
		problem.setTitle(title);
		problem.setType(URI.create(ERROR_TYPE_PREFIX + type));
		problem.setProperty("timestamp", Instant.now().toString());
		return problem;
	}
}
