package io.whalewatcher.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WhaleWatcherApplication {

  public static void main(String[] args) {
    SpringApplication.run(WhaleWatcherApplication.class, args);
  }
}
