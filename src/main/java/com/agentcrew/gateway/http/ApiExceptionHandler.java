package com.agentcrew.gateway.http;

import com.agentcrew.capability.EmptyCrewException;
import com.agentcrew.orchestrator.TaskAlreadyTerminalException;
import com.agentcrew.persistence.CrewNotFoundException;
import com.agentcrew.persistence.TaskNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps engine exceptions to HTTP statuses for every controller.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({TaskNotFoundException.class, CrewNotFoundException.class})
    public ResponseEntity<Map<String, String>> notFound(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler({TaskAlreadyTerminalException.class, EmptyCrewException.class})
    public ResponseEntity<Map<String, String>> conflict(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
