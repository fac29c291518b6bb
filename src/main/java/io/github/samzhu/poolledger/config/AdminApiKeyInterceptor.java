package io.github.samzhu.poolledger.config;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * 管理 API 金鑰檢查。
 *
 * <p>金鑰可放在 {@code X-Admin-Key} header，或 {@code Authorization: Bearer <key>}。
 * 與 {@code pool-ledger.admin.api-key} 不符時回應 401；未設定金鑰時所有管理端點都回應 401。
 *
 * <p>比對使用 {@link MessageDigest#isEqual(byte[], byte[])}，耗時與內容無關。
 *
 * <p>401 回應與其他錯誤相同，為帶 {@code code} 欄位的 {@link ProblemDetail}。
 */
@Component
public class AdminApiKeyInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(AdminApiKeyInterceptor.class);

    public static final String ADMIN_KEY_HEADER = "X-Admin-Key";
    private static final String BEARER_PREFIX = "Bearer ";

    private final PoolLedgerProperties.AdminConfig admin;
    private final ObjectMapper objectMapper;

    public AdminApiKeyInterceptor(PoolLedgerProperties properties, ObjectMapper objectMapper) {
        this.admin = properties.admin();
        this.objectMapper = objectMapper;
        if (!admin.enabled()) {
            log.warn("pool-ledger.admin.api-key is not set, admin endpoints are disabled");
        }
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws Exception {
        String presented = presentedKey(request);
        if (admin.enabled() && presented != null && matches(presented, admin.apiKey())) {
            return true;
        }

        log.warn("Admin request rejected: method={}, uri={}, remote={}, keyPresent={}",
            request.getMethod(), request.getRequestURI(), request.getRemoteAddr(), presented != null);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.UNAUTHORIZED, "Invalid admin key");
        problem.setProperty("code", "UNAUTHORIZED");

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), problem);
        return false;
    }

    private static String presentedKey(HttpServletRequest request) {
        String header = request.getHeader(ADMIN_KEY_HEADER);
        if (header != null && !header.isBlank()) {
            return header.trim();
        }
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            return authorization.substring(BEARER_PREFIX.length()).trim();
        }
        return null;
    }

    private static boolean matches(String presented, String expected) {
        return MessageDigest.isEqual(
            presented.getBytes(StandardCharsets.UTF_8),
            expected.getBytes(StandardCharsets.UTF_8));
    }
}
