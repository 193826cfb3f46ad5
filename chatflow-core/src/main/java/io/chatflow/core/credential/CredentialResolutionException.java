package io.chatflow.core.credential;

import java.io.Serial;

public class CredentialResolutionException extends Exception {
    @Serial private static final long serialVersionUID = 6150934208178421537L;

    public CredentialResolutionException(String message) {
        super(message);
    }
}
