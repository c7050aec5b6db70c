/*
 * どこで: 共通ユーティリティ
 * 何を: trace_id を採番し、処理単位で MDC に載せる
 * なぜ: 非同期に走るタスク実行のログを 1 実行単位で追えるようにするため
 */
package com.example.common;

import java.util.UUID;
import org.slf4j.MDC;

public final class TraceIds {

  public static final String MDC_KEY = "trace_id";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  // 呼び出し元スレッドの MDC を汚さないよう、終了時に元の値へ戻す
  public static void runWithNewTraceId(Runnable action) {
    final String previous = MDC.get(MDC_KEY);
    MDC.put(MDC_KEY, newTraceId());
    try {
      action.run();
    } finally {
      if (previous == null) {
        MDC.remove(MDC_KEY);
      } else {
        MDC.put(MDC_KEY, previous);
      }
    }
  }
}
