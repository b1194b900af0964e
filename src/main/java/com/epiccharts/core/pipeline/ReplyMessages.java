package com.epiccharts.core.pipeline;

/**
 * Fixed reply texts posted back to the requester.
 */
public final class ReplyMessages {

    private ReplyMessages() {}

    public static final String SUCCESS = "Here's your epic chart! 📊✨";
    public static final String NO_REPLY_TARGET = "I couldn't find the tweet you're replying to!";
    public static final String NO_IMAGE =
            "I couldn't find an image in that tweet! Please reply to a tweet that contains a chart image.";
    public static final String NO_DATA =
            "I couldn't extract chart data from that image. Make sure it contains a clear chart, table, or data visualization!";
    public static final String INVALID_STRUCTURE =
            "I had trouble understanding the data in that image. Try with a clearer chart!";
}
