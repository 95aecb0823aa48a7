package com.gt.practice.exception;

public class MappingException extends RuntimeException {

    public MappingException(String msg) {
        super(msg);
    }

    public MappingException(String msg, Exception ex) {
        super(msg, ex);
    }
}
