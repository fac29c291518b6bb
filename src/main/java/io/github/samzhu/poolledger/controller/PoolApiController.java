package io.github.samzhu.poolledger.controller;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.poolledger.dto.api.PoolStatusResponse;
import io.github.samzhu.poolledger.service.PoolService;

/**
 * 配額池狀態查詢 API 控制器（唯讀）。
 */
@RestController
@RequestMapping("/api/v1/pools")
public class PoolApiController {

    private static final Logger log = LoggerFactory.getLogger(PoolApiController.class);

    private final PoolService poolService;

    public PoolApiController(PoolService poolService) {
        this.poolService = poolService;
    }

    @GetMapping
    public ResponseEntity<List<PoolStatusResponse>> listPools() {
        log.debug("API request: listPools");
        return ResponseEntity.ok(poolService.list());
    }

    @GetMapping("/{poolId}")
    public ResponseEntity<PoolStatusResponse> getPool(@PathVariable String poolId) {
        log.debug("API request: getPool poolId={}", poolId);
        return ResponseEntity.ok(poolService.status(poolId));
    }
}
