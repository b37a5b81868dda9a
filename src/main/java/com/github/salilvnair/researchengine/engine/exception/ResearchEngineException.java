package com.github.salilvnair.researchengine.engine.exception;

import lombok.Getter;

@Getter
public class ResearchEngineException extends RuntimeException {

    private final ResearchEngineErrorCode errorCode;
    private final boolean recoverable;

    public ResearchEngineException(ResearchEngineErrorCode code) {
        super(code.defaultMessage());
        this.errorCode = code;
        this.recoverable = code.recoverable();
    }

    public ResearchEngineException(ResearchEngineErrorCode code, String overrideMessage) {
        super(overrideMessage);
        this.errorCode = code;
        this.recoverable = code.recoverable();
    }

    public ResearchEngineException(ResearchEngineErrorCode code, String overrideMessage, Throwable cause) {
        super(overrideMessage, cause);
        this.errorCode = code;
        this.recoverable = code.recoverable();
    }
}
