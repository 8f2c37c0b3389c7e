package io.intellixity.semgate.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class SemgateApplication {
  public static void main(String[] args) {
    SpringApplication.run(SemgateApplication.class, args);
  }
}
