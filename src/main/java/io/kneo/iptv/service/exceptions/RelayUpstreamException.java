package io.kneo.iptv.service.exceptions;

import lombok.Getter;

@Getter
public class RelayUpstreamException extends RuntimeException {

    @Getter
    public enum ErrorType {
        BAD_ORIGIN_URL("Origin URL is not a valid http(s) URL", 400),
        ORIGIN_UNREACHABLE("Stream origin unreachable", 502),
        TOO_MANY_REDIRECTS("Stream origin redirected too many times", 502),
        TIMEOUT("Stream origin timed out", 504);

        private final String defaultMessage;
        private final int httpStatus;

        ErrorType(String defaultMessage, int httpStatus) {
            this.defaultMessage = defaultMessage;
            this.httpStatus = httpStatus;
        }
    }

    private final ErrorType errorType;

    public RelayUpstreamException(ErrorType errorType) {
        super(errorType.getDefaultMessage());
        this.errorType = errorType;
    }

    public RelayUpstreamException(ErrorType errorType, String msg) {
        super(msg);
        this.errorType = errorType;
    }

    public RelayUpstreamException(ErrorType errorType, Throwable failure) {
        super(errorType.getDefaultMessage(), failure);
        this.errorType = errorType;
    }
}
