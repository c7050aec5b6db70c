package com.example.backupmonitor.task;

import com.example.backupmonitor.config.OverdueCheckProperties;
import com.example.backupmonitor.service.OverdueCheckService;
import java.time.Duration;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class OverdueCheckTask implements ScheduledTask {

  public static final String NAME = "overdue-check";

  private final OverdueCheckService overdueCheckService;
  private final OverdueCheckProperties properties;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Duration interval() {
    return properties.checkInterval();
  }

  @Override
  public boolean enabled() {
    return properties.enabled();
  }

  @Override
  public Map<String, Object> run() {
    return overdueCheckService.runCheck().toDetail();
  }
}
