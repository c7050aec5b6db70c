/*
 * どこで: Backup monitor アプリケーション
 * 何を: Spring Boot の起動エントリポイント
 * なぜ: 遅延検知と通知配信のバックグラウンドプロセスを起動するため
 */
package com.example.backupmonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BackupMonitorApplication {

  public static void main(String[] args) {
    SpringApplication.run(BackupMonitorApplication.class, args);
  }
}
