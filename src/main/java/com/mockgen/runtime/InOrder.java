package com.mockgen.runtime;

import java.util.List;

/**
 * Verifies that calls happened in a given order, across one or more mocks.
 *
 * <pre>
 * InOrder inOrder = new InOrder();
 * inOrder.verify(display.callsToShow(Matchers.eq("first"), Matchers.any()));
 * inOrder.verify(store.callsToSave(Matchers.any()));
 * </pre>
 */
public final class InOrder {

    private long lastSequence;

    /**
     * Consumes the earliest candidate call that happened after the previously verified one.
     *
     * @throws VerificationError if no candidate call happened after the previously verified one
     */
    public synchronized RecordedCall verify(List<RecordedCall> candidates) {
        for (RecordedCall call : candidates) {
            if (call.getSequence() > lastSequence) {
                lastSequence = call.getSequence();
                return call;
            }
        }
        throw new VerificationError(candidates.isEmpty()
                ? "Expected a call in order, but no matching call was recorded"
                : "Expected a call after sequence " + lastSequence + ", but matching calls were " + candidates);
    }
}
