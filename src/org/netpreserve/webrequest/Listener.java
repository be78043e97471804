package org.netpreserve.webrequest;

/**
 * A listener attached to one lifecycle stage. The stage's family decides which kind is accepted.
 */
public sealed interface Listener permits SimpleListener, ResponseListener {
}
