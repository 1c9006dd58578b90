package com.containermgmt.streamagent.codec;

/**
 * A frame that does not match the gateway wire format. The frame is dropped;
 * the session keeps running.
 */
public class CodecException extends RuntimeException {

    private static final int MAX_FRAME_IN_MESSAGE = 256;

    private final String reason;
    private final String rawFrame;

    public CodecException(String reason, String rawFrame) {
        this(reason, rawFrame, null);
    }

    public CodecException(String reason, String rawFrame, Throwable cause) {
        super(reason, cause);
        this.reason = reason;
        this.rawFrame = rawFrame;
    }

    public String getReason() {
        return reason;
    }

    public String getRawFrame() {
        return rawFrame;
    }

    /** Frame text cut down for log lines. */
    public String abbreviatedFrame() {
        if (rawFrame == null) {
            return "<null>";
        }
        if (rawFrame.length() <= MAX_FRAME_IN_MESSAGE) {
            return rawFrame;
        }
        return rawFrame.substring(0, MAX_FRAME_IN_MESSAGE) + "...(" + rawFrame.length() + " chars)";
    }
}
