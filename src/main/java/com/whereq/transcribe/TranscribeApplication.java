package com.whereq.transcribe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for WhereQ Transcribe.
 * This service queues long media resources for transcription by an external
 * asynchronous service and drives each job to a persisted transcript document.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
@EnableScheduling
public class TranscribeApplication {

    public static void main(String[] args) {
        SpringApplication.run(TranscribeApplication.class, args);
    }
}
