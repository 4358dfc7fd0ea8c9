package org.relua.resolver.discovery;

import java.io.IOException;

/**
 * The root file of a discovery run could not be read, so no graph can be built.
 */
public class RootModuleException extends IOException {

    private final String rootKey;

    public RootModuleException(String rootKey, Throwable cause) {
        super("Could not read root module " + rootKey + ": " + cause.getMessage(), cause);
        this.rootKey = rootKey;
    }

    public String rootKey() {
        return rootKey;
    }
}
