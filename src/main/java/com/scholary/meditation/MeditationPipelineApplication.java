package com.scholary.meditation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Profiles;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class MeditationPipelineApplication {

  public static void main(String[] args) {
    ConfigurableApplicationContext context =
        SpringApplication.run(MeditationPipelineApplication.class, args);
    if (context.getEnvironment().acceptsProfiles(Profiles.of("cli"))) {
      System.exit(SpringApplication.exit(context));
    }
  }
}
