package io.kneo.iptv.service.exceptions;

public class SourceParseException extends RuntimeException {

    public SourceParseException(String msg) {
        super(msg);
    }

    public SourceParseException(String msg, Throwable failure) {
        super(msg, failure);
    }
}
