/*
 * どこで: 共通ユーティリティのテスト
 * 何を: trace_id の MDC 設定と復元を検証する
 * なぜ: スレッドプール再利用時に前回実行の trace_id が残る回帰を防ぐため
 */
package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class TraceIdsTest {

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void runWithNewTraceIdSetsAndRemovesMdcValue() {
    final AtomicReference<String> seen = new AtomicReference<>();

    TraceIds.runWithNewTraceId(() -> seen.set(MDC.get(TraceIds.MDC_KEY)));

    assertThat(seen.get()).isNotBlank();
    assertThat(MDC.get(TraceIds.MDC_KEY)).isNull();
  }

  @Test
  void runWithNewTraceIdRestoresPreviousValue() {
    MDC.put(TraceIds.MDC_KEY, "outer");
    final AtomicReference<String> seen = new AtomicReference<>();

    TraceIds.runWithNewTraceId(() -> seen.set(MDC.get(TraceIds.MDC_KEY)));

    assertThat(seen.get()).isNotEqualTo("outer");
    assertThat(MDC.get(TraceIds.MDC_KEY)).isEqualTo("outer");
  }
}
