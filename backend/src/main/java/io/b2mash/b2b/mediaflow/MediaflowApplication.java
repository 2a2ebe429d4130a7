package io.b2mash.b2b.mediaflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MediaflowApplication {

  public static void main(String[] args) {
    SpringApplication.run(MediaflowApplication.class, args);
  }
}
