package com.scholary.audio.upload;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AudioUploadApplication {

  public static void main(String[] args) {
    SpringApplication.run(AudioUploadApplication.class, args);
  }
}
