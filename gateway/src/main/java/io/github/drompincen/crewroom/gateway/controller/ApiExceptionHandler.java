package io.github.drompincen.crewroom.gateway.controller;

import io.github.drompincen.crewroom.persistence.PersistenceException;
import io.github.drompincen.crewroom.protocol.api.ErrorResponse;
import io.github.drompincen.crewroom.runtime.room.DuplicateRoomException;
import io.github.drompincen.crewroom.runtime.room.InvalidRoomTypeException;
import io.github.drompincen.crewroom.runtime.room.RoomCapacityException;
import io.github.drompincen.crewroom.runtime.room.RoomNotFoundException;
import io.github.drompincen.crewroom.runtime.worklog.SealedLogException;
import io.github.drompincen.crewroom.runtime.worklog.WorkLogNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Turns the core's typed failures into precise HTTP answers.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({RoomNotFoundException.class, WorkLogNotFoundException.class})
    public ResponseEntity<ErrorResponse> notFound(RuntimeException e) {
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({DuplicateRoomException.class, RoomCapacityException.class, SealedLogException.class})
    public ResponseEntity<ErrorResponse> conflict(RuntimeException e) {
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler({InvalidRoomTypeException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> badRequest(RuntimeException e) {
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<ErrorResponse> persistence(PersistenceException e) {
        log.error("Room store failure: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, RuntimeException e) {
        return ResponseEntity.status(status).body(new ErrorResponse(errorKind(e), e.getMessage()));
    }

    static String errorKind(RuntimeException e) {
        String name = e.getClass().getSimpleName();
        return name.endsWith("Exception") ? name.substring(0, name.length() - "Exception".length()) : name;
    }
}
