package com.dataworks.orchestrator.decision;

import com.dataworks.orchestrator.capability.CapabilityDescriptor;
import com.dataworks.orchestrator.conversation.Turn;

import java.util.List;

/**
 * Chooses the next step of a run from the recent conversation.
 *
 * Implementations are opaque to the orchestrator: it only relies on the
 * returned {@link Decision} or on a {@link DecisionException}.
 */
public interface DecisionFunction {

    /**
     * @param window       the most recent turns, oldest first; always starts with
     *                     or contains the current run's HUMAN turn
     * @param capabilities every registered capability, sorted by name
     */
    Decision decide(List<Turn> window, List<CapabilityDescriptor> capabilities) throws DecisionException;
}
