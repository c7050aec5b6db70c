package com.example.backupmonitor.service.channel;

import java.time.Duration;

/** Waits between delivery attempts. Tests replace it to avoid real sleeps. */
@FunctionalInterface
public interface BackoffSleeper {

  void sleep(Duration duration) throws InterruptedException;
}
