package org.netpreserve.webrequest.event;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

import static org.netpreserve.webrequest.event.LifecycleStage.*;

/**
 * Static description of every {@link LifecycleStage}: whether listeners are notified or asked for a decision,
 * which contextual arguments the stage carries and which verdicts it accepts.
 */
public final class EventCatalog {
    private static final Map<LifecycleStage, Entry> entries = new EnumMap<>(LifecycleStage.class);

    static {
        decision(BEFORE_REQUEST, Set.of(),
                Set.of(Verdict.Proceed.class, Verdict.Cancel.class, Verdict.Redirect.class));
        decision(BEFORE_SEND_HEADERS, Set.of(Argument.REQUEST_HEADERS),
                Set.of(Verdict.Proceed.class, Verdict.Cancel.class, Verdict.ModifyHeaders.class));
        decision(HEADERS_RECEIVED, Set.of(Argument.RESPONSE_HEADERS, Argument.STATUS_CODE),
                Set.of(Verdict.Proceed.class, Verdict.Cancel.class, Verdict.OverrideResponseHeaders.class,
                        Verdict.RedirectUnsafe.class));
        simple(SEND_HEADERS, Set.of(Argument.REQUEST_HEADERS));
        simple(BEFORE_REDIRECT, Set.of(Argument.REDIRECT_URL));
        simple(RESPONSE_STARTED, Set.of());
        simple(COMPLETED, Set.of(Argument.NET_ERROR));
        simple(ERROR_OCCURRED, Set.of(Argument.NET_ERROR));
    }

    private EventCatalog() {
    }

    private static void decision(LifecycleStage stage, Set<Argument> arguments,
                                 Set<Class<? extends Verdict>> verdicts) {
        entries.put(stage, new Entry(stage, Family.DECISION, arguments, verdicts));
    }

    private static void simple(LifecycleStage stage, Set<Argument> arguments) {
        entries.put(stage, new Entry(stage, Family.SIMPLE, arguments, Set.of()));
    }

    public static Entry entry(LifecycleStage stage) {
        return entries.get(stage);
    }

    public static Set<LifecycleStage> stages(Family family) {
        var stages = EnumSet.noneOf(LifecycleStage.class);
        entries.forEach((stage, entry) -> {
            if (entry.family() == family) stages.add(stage);
        });
        return Collections.unmodifiableSet(stages);
    }

    public enum Family {
        /**
         * Fire-and-forget notification, the listener cannot alter the request.
         */
        SIMPLE,
        /**
         * The request is held until the listener returns a {@link Verdict}.
         */
        DECISION
    }

    /**
     * Contextual data a stage passes to its listener in addition to the request itself.
     */
    public enum Argument {
        REQUEST_HEADERS(details -> details.requestHeaders() != null),
        RESPONSE_HEADERS(details -> details.responseHeaders() != null),
        STATUS_CODE(details -> details.statusCode() != null),
        REDIRECT_URL(details -> details.redirectUrl() != null),
        NET_ERROR(details -> true);

        private final Predicate<RequestDetails> presence;

        Argument(Predicate<RequestDetails> presence) {
            this.presence = presence;
        }

        public boolean isPresentIn(RequestDetails details) {
            return presence.test(details);
        }
    }

    public record Entry(LifecycleStage stage, Family family, Set<Argument> arguments,
                        Set<Class<? extends Verdict>> verdicts) {
        public boolean allows(Verdict verdict) {
            return verdict != null && verdicts.contains(verdict.getClass());
        }

        /**
         * @throws IllegalArgumentException if details lack an argument this stage carries
         */
        public void checkArguments(RequestDetails details) {
            for (Argument argument : arguments) {
                if (!argument.isPresentIn(details)) {
                    throw new IllegalArgumentException(stage.eventName() + " requires " + argument);
                }
            }
        }
    }
}
