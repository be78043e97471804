package org.netpreserve.webrequest;

public class RegistryNotFoundException extends WebRequestException {
    public RegistryNotFoundException(Object context) {
        super("No WebRequest registered for " + context);
    }
}
