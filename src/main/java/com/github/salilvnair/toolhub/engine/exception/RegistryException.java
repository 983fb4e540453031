package com.github.salilvnair.toolhub.engine.exception;

import lombok.Getter;

@Getter
public class RegistryException extends RuntimeException {

    private final RegistryErrorCode errorCode;

    public RegistryException(RegistryErrorCode code) {
        super(code.defaultMessage());
        this.errorCode = code;
    }

    public RegistryException(RegistryErrorCode code, String overrideMessage) {
        super(overrideMessage);
        this.errorCode = code;
    }
}
