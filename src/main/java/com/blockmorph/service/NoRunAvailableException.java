package com.blockmorph.service;

public class NoRunAvailableException extends IllegalStateException {

    public NoRunAvailableException() {
        super("No morph has been run yet");
    }
}
