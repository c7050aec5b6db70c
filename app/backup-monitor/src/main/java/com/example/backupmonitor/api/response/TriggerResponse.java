package com.example.backupmonitor.api.response;

import com.example.backupmonitor.task.TriggerResult;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TriggerResponse(boolean accepted, String reason) {

  public static TriggerResponse from(TriggerResult result) {
    return new TriggerResponse(result.accepted(), result.reason());
  }
}
