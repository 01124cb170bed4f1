package com.cadence;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Cadence continuous behavioral authentication engine.
 *
 * Cadence verifies, during an already-authenticated session, that the person at
 * the keyboard and mouse is still the person who logged in.
 *
 * Key Features:
 * - Windowed keystroke and mouse feature extraction
 * - Six-model scoring ensemble with per-user calibration
 * - Drift tracking that separates habit change from intrusion
 * - Per-session trust state machine with a decision stream
 */
@SpringBootApplication
public class CadenceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CadenceApplication.class, args);
    }
}
