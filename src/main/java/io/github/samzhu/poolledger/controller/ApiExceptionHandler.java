package io.github.samzhu.poolledger.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import io.github.samzhu.poolledger.exception.AlreadyResolvedException;
import io.github.samzhu.poolledger.exception.InsufficientQuotaException;
import io.github.samzhu.poolledger.exception.LedgerException;
import io.github.samzhu.poolledger.exception.PoolUnknownException;

/**
 * API 異常處理。
 *
 * <p>回應格式為 RFC 7807 {@link ProblemDetail}，並帶出 {@code code} 欄位：
 * <ul>
 *   <li>429 {@code QUOTA_EXHAUSTED} - 額度不足或無法確認額度</li>
 *   <li>404 {@code POOL_UNKNOWN} / {@code RESERVATION_NOT_FOUND}</li>
 *   <li>409 {@code POOL_EXISTS} / {@code ALREADY_RESOLVED} / {@code CONCURRENT_UPDATE}</li>
 *   <li>503 {@code STORE_UNAVAILABLE}</li>
 *   <li>400 {@code INVALID_REQUEST}</li>
 * </ul>
 * 管理金鑰錯誤的 401 由攔截器回應，不經過此處。
 *
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807 Problem Details</a>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InsufficientQuotaException.class)
    public ProblemDetail handleInsufficientQuota(InsufficientQuotaException e) {
        ProblemDetail problem = problem(HttpStatus.TOO_MANY_REQUESTS, e.getCode().name(), e.getMessage());
        problem.setProperty("pool_id", e.getPoolId());
        problem.setProperty("reason", e.getReason().name());
        problem.setProperty("requested", e.getRequested().toPlainString());
        if (e.getRemaining() != null) {
            problem.setProperty("remaining", e.getRemaining().toPlainString());
        }
        return problem;
    }

    @ExceptionHandler(AlreadyResolvedException.class)
    public ProblemDetail handleAlreadyResolved(AlreadyResolvedException e) {
        ProblemDetail problem = problem(HttpStatus.CONFLICT, e.getCode().name(), e.getMessage());
        problem.setProperty("reservation_id", e.getReservationId());
        problem.setProperty("state", e.getState().name());
        problem.setProperty("same_commit", e.isSameCommit());
        return problem;
    }

    @ExceptionHandler(LedgerException.class)
    public ProblemDetail handleLedger(LedgerException e) {
        HttpStatus status = switch (e.getCode()) {
            case POOL_UNKNOWN, RESERVATION_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case POOL_EXISTS, ALREADY_RESOLVED -> HttpStatus.CONFLICT;
            case QUOTA_EXHAUSTED -> HttpStatus.TOO_MANY_REQUESTS;
            case STORE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
        if (status == HttpStatus.SERVICE_UNAVAILABLE) {
            log.warn("Store unavailable: {}", e.getMessage());
        }
        ProblemDetail problem = problem(status, e.getCode().name(), e.getMessage());
        if (e instanceof PoolUnknownException unknown) {
            problem.setProperty("pool_id", unknown.getPoolId());
        }
        return problem;
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ProblemDetail handleOptimisticLock(OptimisticLockingFailureException e) {
        return problem(HttpStatus.CONFLICT, "CONCURRENT_UPDATE", "Pool was modified concurrently, retry the request");
    }

    @ExceptionHandler(DataAccessException.class)
    public ProblemDetail handleDataAccess(DataAccessException e) {
        log.warn("Data access failed: {}", e.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, LedgerException.ErrorCode.STORE_UNAVAILABLE.name(),
            "Storage temporarily unavailable");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException e) {
        return problem(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getDefaultMessage())
            .findFirst()
            .orElse("Invalid request");
        return problem(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", detail);
    }

    private static ProblemDetail problem(HttpStatus status, String code, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setProperty("code", code);
        return problem;
    }
}
