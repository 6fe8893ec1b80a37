package com.libragraph.nsm.formats.api;

import java.io.IOException;
import java.io.OutputStream;

public interface FrameEncoder extends CodecState {

    /**
     * Opens a stream that compresses everything written to it into one
     * independent frame on {@code sink}. Closing the returned stream completes
     * the frame and flushes it; it never closes {@code sink}.
     */
    OutputStream open(OutputStream sink) throws IOException;
}
