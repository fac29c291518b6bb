package io.github.samzhu.poolledger.cache;

/**
 * 計數器重建結果（微單位）。
 *
 * @param applied false 表示 onlyIfAbsent 且計數器已存在，未修改
 * @param remainingUnits 重建後（或既有）的剩餘額度
 * @param pendingUnits pending 表合計
 * @param committingUnits committing 表合計（已移除 settled 項目）
 */
public record RebuildResult(boolean applied, long remainingUnits, long pendingUnits, long committingUnits) {}
