package com.blockmorph.morph;

public class ExportCancelledException extends IllegalStateException {

    public ExportCancelledException(int framesWritten, int framesTotal) {
        super("Export cancelled after " + framesWritten + " of " + framesTotal + " frames");
    }
}
