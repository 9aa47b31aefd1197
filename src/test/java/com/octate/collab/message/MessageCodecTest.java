package com.octate.collab.message;

import com.octate.collab.message.Payloads.PeerData;
import com.octate.collab.message.Payloads.SyncData;
import com.octate.collab.ot.Operation;
import com.octate.collab.ot.OperationType;
import com.octate.collab.presence.PresenceUpdate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MessageCodecTest {

    @Test
    void encodesWireNamesAndOmitsNulls() {
        String json = MessageCodec.encode(Envelope.of(MessageType.SYNC_REQUEST, "r1", "alice", null));

        assertTrue(json.contains("\"type\":\"sync-request\""));
        assertFalse(json.contains("\"data\""));
        assertFalse(json.contains("\"userName\""));
    }

    @Test
    void decodesOperationFrame() {
        String frame = "{\"type\":\"operation\",\"roomId\":\"r1\",\"userId\":\"bob\",\"data\":"
            + "{\"id\":\"op-1\",\"userId\":\"bob\",\"type\":\"delete\",\"position\":3,\"length\":2,"
            + "\"timestamp\":99,\"version\":4,\"extra\":true}}";

        Envelope envelope = MessageCodec.decode(frame);
        Operation op = MessageCodec.payload(envelope, Operation.class);

        assertEquals(MessageType.OPERATION, envelope.type());
        assertEquals(OperationType.DELETE, op.type());
        assertEquals(2, op.length());
        assertEquals("bob-99", op.originKey());
    }

    @Test
    void booleanFlagsKeepTheirWireNames() {
        String peer = MessageCodec.toData(new PeerData("bob", "Bob", true, "#fff", 1L)).toString();
        String presence = MessageCodec.toData(PresenceUpdate.activity("bob", "Bob", false)).toString();

        assertTrue(peer.contains("\"isHost\":true"));
        assertTrue(presence.contains("\"isActive\":false"));
    }

    @Test
    void syncCarriesAppliedOrigins() {
        Envelope envelope = MessageCodec.decode(MessageCodec.encode(
            Envelope.of(MessageType.SYNC, new SyncData("abc", 3, "r1", List.of("alice-1")))));

        SyncData sync = MessageCodec.payload(envelope, SyncData.class);

        assertEquals(List.of("alice-1"), sync.applied());
        assertEquals(3, sync.version());
    }

    @Test
    void rejectsBrokenFrames() {
        assertThrows(ProtocolException.class, () -> MessageCodec.decode(""));
        assertThrows(ProtocolException.class, () -> MessageCodec.decode("[1,2"));
        assertThrows(ProtocolException.class, () -> MessageCodec.decode("{\"roomId\":\"r1\"}"));
        assertThrows(ProtocolException.class, () -> MessageCodec.decode("{\"type\":\"teleport\"}"));
    }

    @Test
    void payloadErrorsAreProtocolErrors() {
        Envelope empty = Envelope.of(MessageType.OPERATION, null);
        Envelope invalid = MessageCodec.decode(
            "{\"type\":\"operation\",\"data\":{\"userId\":\"bob\",\"type\":\"insert\",\"position\":-4,\"content\":\"x\"}}");

        ProtocolException missing = assertThrows(ProtocolException.class,
            () -> MessageCodec.payload(empty, Operation.class));
        assertEquals("operation requires data", missing.getMessage());
        assertThrows(ProtocolException.class, () -> MessageCodec.payload(invalid, Operation.class));
        assertNull(MessageCodec.optionalPayload(empty, Operation.class));
    }
}
