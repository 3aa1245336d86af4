package io.b2mash.batchflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

@SpringBootApplication
@EnableRetry
public class BatchflowApplication {

  public static void main(String[] args) {
    SpringApplication.run(BatchflowApplication.class, args);
  }
}
