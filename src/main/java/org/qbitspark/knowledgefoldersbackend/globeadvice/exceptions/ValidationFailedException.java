package org.qbitspark.knowledgefoldersbackend.globeadvice.exceptions;

public class ValidationFailedException extends Exception {
    public ValidationFailedException(String message) {
        super(message);
    }
}
