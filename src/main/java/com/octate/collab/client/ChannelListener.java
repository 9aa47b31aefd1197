package com.octate.collab.client;

public interface ChannelListener {

    void onText(String frame);

    void onClosed(int code, String reason);

    void onError(Throwable failure);
}
