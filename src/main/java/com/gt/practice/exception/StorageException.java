package com.gt.practice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when the backing store could not be reached or rejected a write. Pending writes are kept for a later sync.
@ResponseStatus(value = HttpStatus.SERVICE_UNAVAILABLE)
public class StorageException extends RuntimeException {

    public StorageException(String msg) {
        super(msg);
    }

    public StorageException(String msg, Exception ex) {
        super(msg, ex);
    }
}
