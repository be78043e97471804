package org.netpreserve.webrequest;

import com.fasterxml.jackson.databind.JsonNode;
import org.netpreserve.webrequest.event.LifecycleStage;
import org.netpreserve.webrequest.event.Verdict;

/**
 * One-shot continuation of a held request. Only the first call to a {@code resolve} method takes effect.
 */
public interface DecisionCallback {
    LifecycleStage stage();

    /**
     * @return true if this call resolved the decision, false if it was already resolved or abandoned
     */
    boolean resolve(Verdict verdict);

    /**
     * Resolves with a host response object such as {@code {"cancel": true}}.
     *
     * @see org.netpreserve.webrequest.event.ListenerResponse
     */
    boolean resolve(JsonNode response);
}
