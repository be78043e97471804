package org.netpreserve.webrequest;

public class RegistryAlreadyExistsException extends WebRequestException {
    public RegistryAlreadyExistsException(Object context) {
        super("WebRequest already created for " + context);
    }
}
