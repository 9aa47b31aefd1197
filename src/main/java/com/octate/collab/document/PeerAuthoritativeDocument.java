package com.octate.collab.document;

import com.octate.collab.ot.Operation;
import org.jboss.logging.Logger;

import java.util.HashSet;
import java.util.Set;
import java.util.function.LongSupplier;

/**
 * Document replica whose version is its own counter rather than the relay's.
 * The counter advances on every local and remote operation. Every applied
 * operation is remembered by author and timestamp until the next full reset, so a
 * re-delivered one is applied once whatever version it carries.
 * <p>
 * Ordering still comes from the relay: {@link #sequence()} follows the versions
 * the relay assigns, and a pending operation is rebased over remote ones until
 * the relay acknowledges it.
 */
public class PeerAuthoritativeDocument extends AbstractDocumentState {

    private static final Logger LOG = Logger.getLogger(PeerAuthoritativeDocument.class);

    private final Set<String> seen = new HashSet<>();

    public PeerAuthoritativeDocument(String ownerId) {
        this(ownerId, "", 0, System::currentTimeMillis);
    }

    public PeerAuthoritativeDocument(String ownerId, String content, long version, LongSupplier clock) {
        super(ownerId, content, version, clock);
    }

    @Override
    public Authority authority() {
        return Authority.PEER;
    }

    @Override
    protected long nextLocalVersion() {
        return ++version;
    }

    @Override
    protected void afterLocalApplied(Operation op) {
        seen.add(op.originKey());
    }

    @Override
    protected boolean admitRemote(Operation op) {
        if (!seen.add(op.originKey())) {
            LOG.debugf("Skipping already applied operation %s", op.originKey());
            return false;
        }
        return true;
    }

    @Override
    protected void afterRemoteApplied(Operation received) {
        version++;
    }

    @Override
    public synchronized void reset(String newContent, long newVersion) {
        seen.clear();
        super.reset(newContent, newVersion);
    }
}
