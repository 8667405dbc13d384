package com.openapi.simpleDeref.reference.exceptions;

public class RemoteReferenceException extends ReferenceException {
    private final String locator;

    public RemoteReferenceException(String locator) {
        super("Cannot resolve remote reference '" + locator + "'; only references into this document's components are followed");
        this.locator = locator;
    }

    public String getLocator() {
        return locator;
    }
}
