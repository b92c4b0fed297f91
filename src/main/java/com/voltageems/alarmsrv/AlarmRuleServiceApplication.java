package com.voltageems.alarmsrv;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AlarmRuleServiceApplication {
  public static void main(String[] args) {
    SpringApplication.run(AlarmRuleServiceApplication.class, args);
  }
}
