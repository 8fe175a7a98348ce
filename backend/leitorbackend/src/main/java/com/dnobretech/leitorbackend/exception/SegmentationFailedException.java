package com.dnobretech.leitorbackend.exception;

public class SegmentationFailedException extends RuntimeException {

    public SegmentationFailedException(String language, Throwable cause) {
        super("falha ao segmentar texto (lang=" + language + "): " + cause.getMessage(), cause);
    }
}
