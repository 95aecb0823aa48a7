package com.gt.practice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when a submission does not fit the variant of the task it answers
@ResponseStatus(value = HttpStatus.BAD_REQUEST)
public class InvalidSubmissionShapeException extends RuntimeException {

    public InvalidSubmissionShapeException(String msg) {
        super(msg);
    }

    public InvalidSubmissionShapeException(String msg, Exception ex) {
        super(msg, ex);
    }
}
