package com.gnovoa.liveops;

import com.gnovoa.liveops.runner.LiveOpsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/** The Main app */
@SpringBootApplication
@EnableConfigurationProperties(LiveOpsProperties.class)
public class LiveOpsApplication {

  public static void main(String[] args) {
    SpringApplication.run(LiveOpsApplication.class, args);
  }
}
