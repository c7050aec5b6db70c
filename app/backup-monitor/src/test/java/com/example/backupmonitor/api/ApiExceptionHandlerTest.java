package com.example.backupmonitor.api;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpStatus;

class ApiExceptionHandlerTest {

  private final ApiExceptionHandler handler = new ApiExceptionHandler();

  @Test
  void handleStoreUnavailableReturns503() {
    final var response = handler.handleStoreUnavailable(new QueryTimeoutException("slow"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(response.getBody())
        .isEqualTo(new ApiErrorResponse(ApiErrorCode.STORE_UNAVAILABLE, "store is unavailable"));
  }

  @Test
  void handleRuntimeReturns500WithoutLeakingMessage() {
    final var response = handler.handleRuntime(new IllegalStateException("secret detail"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().code()).isEqualTo(ApiErrorCode.INTERNAL_ERROR);
    assertThat(response.getBody().message()).doesNotContain("secret");
  }
}
