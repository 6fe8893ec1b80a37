package com.libragraph.nsm.formats.api;

import java.io.IOException;
import java.io.InputStream;

public interface FrameDecoder extends CodecState {

    /**
     * Opens a stream that decodes exactly one frame read from {@code source}.
     * Closing the returned stream never closes {@code source}.
     */
    InputStream open(InputStream source) throws IOException;
}
