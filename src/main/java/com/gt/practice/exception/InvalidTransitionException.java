package com.gt.practice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when a session command is issued in a state that does not accept it. The session is left untouched.
@ResponseStatus(value = HttpStatus.CONFLICT)
public class InvalidTransitionException extends RuntimeException {

    public InvalidTransitionException(String msg) {
        super(msg);
    }

    public InvalidTransitionException(String msg, Exception ex) {
        super(msg, ex);
    }
}
