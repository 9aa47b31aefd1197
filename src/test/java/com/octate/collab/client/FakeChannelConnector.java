package com.octate.collab.client;

import com.octate.collab.message.Envelope;
import com.octate.collab.message.MessageCodec;
import com.octate.collab.message.MessageType;
import io.smallrye.mutiny.Uni;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/** In-memory connector; every open either yields a {@link FakeChannel} or fails. */
class FakeChannelConnector implements ChannelConnector {

    final List<FakeChannel> channels = new ArrayList<>();
    int openCalls;
    int failuresToInject;

    @Override
    public Uni<DuplexChannel> open(URI endpoint, ChannelListener listener) {
        openCalls++;
        if (failuresToInject > 0) {
            failuresToInject--;
            return Uni.createFrom().failure(new IOException("connection refused"));
        }
        FakeChannel channel = new FakeChannel(listener);
        channels.add(channel);
        return Uni.createFrom().item(channel);
    }

    FakeChannel last() {
        return channels.get(channels.size() - 1);
    }

    static final class FakeChannel implements DuplexChannel {

        private final ChannelListener listener;
        private final List<String> sent = new ArrayList<>();
        private boolean open = true;

        private FakeChannel(ChannelListener listener) {
            this.listener = listener;
        }

        @Override
        public void send(String frame) {
            if (!open) {
                throw new TransportDisconnectedException("channel closed");
            }
            sent.add(frame);
        }

        @Override
        public void close() {
            open = false;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        List<Envelope> sent() {
            return sent.stream().map(MessageCodec::decode).toList();
        }

        List<Envelope> sent(MessageType type) {
            return sent().stream().filter(e -> e.type() == type).toList();
        }

        Envelope lastSent() {
            List<Envelope> all = sent();
            return all.get(all.size() - 1);
        }

        void receive(Envelope envelope) {
            listener.onText(MessageCodec.encode(envelope));
        }

        void receiveRaw(String frame) {
            listener.onText(frame);
        }

        void dropFromServer(int code) {
            open = false;
            listener.onClosed(code, "closed by test");
        }
    }
}
