package cz.cas.jhinst.qsource3.api;

import java.util.Objects;
import java.util.Optional;

/**
 * RequestResult
 * -----------------------------------------------------------------------------
 * Synchronous outcome of an outbound request.
 *
 * <p>{@link Accepted} means the mirror was updated (for a set request) and the
 * message was handed to the transport. It does not mean the device applied
 * the value; confirmation, if any, arrives later as a device report.</p>
 *
 * <p>{@link Rejected} means nothing was mutated and nothing was sent.</p>
 */
public sealed interface RequestResult
        permits RequestResult.Accepted, RequestResult.Rejected
{
    boolean isAccepted();

    /**
     * @param topic   command address the message was published to
     * @param payload encoded payload as sent
     */
    record Accepted(String topic, String payload) implements RequestResult {
        public Accepted {
            Objects.requireNonNull(topic, "topic");
            Objects.requireNonNull(payload, "payload");
        }

        @Override
        public boolean isAccepted() {
            return true;
        }
    }

    /**
     * @param reason  rejection classification
     * @param message human-readable explanation
     * @param failure the validation failure, present only for
     *                {@link RejectionReason#VALIDATION_FAILURE}
     */
    record Rejected(RejectionReason reason, String message, Optional<ValidationFailure> failure)
            implements RequestResult {
        public Rejected {
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(message, "message");
            Objects.requireNonNull(failure, "failure");
        }

        public static Rejected notConnected(String operation) {
            return new Rejected(RejectionReason.NOT_CONNECTED,
                    operation + " refused: broker session not established",
                    Optional.empty());
        }

        public static Rejected invalid(ValidationFailure failure) {
            return new Rejected(RejectionReason.VALIDATION_FAILURE,
                    failure.message(),
                    Optional.of(failure));
        }

        @Override
        public boolean isAccepted() {
            return false;
        }
    }
}
