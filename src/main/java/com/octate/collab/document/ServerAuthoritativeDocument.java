package com.octate.collab.document;

import com.octate.collab.ot.Operation;
import org.jboss.logging.Logger;

import java.util.function.LongSupplier;

/**
 * Document replica whose version is the last one assigned by the relay.
 * Local operations are stamped with the version they expect to receive
 * ({@code version + 1}); remote operations must be strictly ahead of the
 * current version, anything else has already been superseded.
 */
public class ServerAuthoritativeDocument extends AbstractDocumentState {

    private static final Logger LOG = Logger.getLogger(ServerAuthoritativeDocument.class);

    public ServerAuthoritativeDocument(String ownerId) {
        this(ownerId, "", 0, System::currentTimeMillis);
    }

    public ServerAuthoritativeDocument(String ownerId, String content, long version, LongSupplier clock) {
        super(ownerId, content, version, clock);
    }

    @Override
    public Authority authority() {
        return Authority.SERVER;
    }

    @Override
    protected long nextLocalVersion() {
        return version + 1;
    }

    @Override
    protected boolean admitRemote(Operation op) {
        if (op.version() <= version) {
            LOG.warnf("Discarding stale operation %s: version %d is not ahead of %d",
                op.id(), op.version(), version);
            return false;
        }
        return true;
    }

    @Override
    protected void afterRemoteApplied(Operation received) {
        version = received.version();
    }

    @Override
    protected void afterAcknowledged(Operation ack) {
        version = Math.max(version, ack.version());
    }
}
