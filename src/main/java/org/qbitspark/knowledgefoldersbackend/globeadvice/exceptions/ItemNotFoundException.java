package org.qbitspark.knowledgefoldersbackend.globeadvice.exceptions;

public class ItemNotFoundException extends Exception {
    public ItemNotFoundException(String message) {
        super(message);
    }
}
