package com.campost.faraid.exceptionHandler;

public class InvalidInheritanceCaseException extends RuntimeException {

    public InvalidInheritanceCaseException(String message) {
        super(message);
    }
}
