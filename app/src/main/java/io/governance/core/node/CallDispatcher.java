package io.governance.core.node;

import io.governance.core.metrics.GovernanceMetrics;
import io.governance.core.protocol.HandleResponse;
import io.governance.core.protocol.OutboundMessage;
import io.governance.core.token.InMemoryTokenLedger;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Carries out the messages of a committed invocation, in order. A failing message is logged
 * and counted; it does not stop the remaining messages and nothing already committed is undone.
 */
public final class CallDispatcher {
    private static final Logger LOG = Logger.getLogger(CallDispatcher.class.getName());

    private final Map<String, CallTarget> targets = new ConcurrentHashMap<>();

    public void register(String address, CallTarget target) {
        targets.put(address, target);
    }

    /** @return number of messages that failed */
    public int dispatch(String sender, HandleResponse response) {
        int failures = 0;
        for (OutboundMessage message : response.messages()) {
            try {
                CallTarget target = targets.get(message.contract());
                if (target == null) {
                    throw new IllegalStateException("No contract at " + message.contract());
                }
                target.call(sender, payloadOf(message));
            } catch (RuntimeException e) {
                failures++;
                GovernanceMetrics.incrementDispatchFailures();
                LOG.log(Level.WARNING, "Dispatch of " + message + " from " + sender + " failed", e);
            }
        }
        return failures;
    }

    private static byte[] payloadOf(OutboundMessage message) {
        if (message instanceof OutboundMessage.Transfer t) {
            return InMemoryTokenLedger.transferPayload(t.recipient(), t.amount());
        }
        return ((OutboundMessage.Execute) message).payload();
    }
}
