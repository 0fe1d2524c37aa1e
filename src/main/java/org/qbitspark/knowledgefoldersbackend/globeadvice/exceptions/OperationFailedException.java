package org.qbitspark.knowledgefoldersbackend.globeadvice.exceptions;

public class OperationFailedException extends Exception {
    public OperationFailedException(String message) {
        super(message);
    }
}
