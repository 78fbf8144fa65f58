package com.yoursp.attendance.modules.verification;

import com.yoursp.attendance.model.SessionState;
import com.yoursp.attendance.modules.verification.exception.InvalidSessionStateException;

/**
 * Transition function of a verification session.
 *
 * <pre>
 * PENDING    --START-------------------&gt; CAPTURING
 * CAPTURING  --SUBMIT_SAMPLE-----------&gt; VERIFYING
 * VERIFYING  --VERIFICATION_SUCCEEDED--&gt; COMPLETED
 * VERIFYING  --VERIFICATION_FAILED-----&gt; CAPTURING | FAILED (attempts exhausted)
 * VERIFYING  --PROVIDER_UNAVAILABLE----&gt; CAPTURING (no attempt consumed)
 * non-terminal --CANCEL----------------&gt; CANCELLED
 * </pre>
 */
public final class VerificationStateMachine {

    private VerificationStateMachine() {
    }

    public static SessionSnapshot transition(SessionSnapshot current, VerificationEvent event) {
        SessionState state = current.state();

        if (event == VerificationEvent.CANCEL) {
            if (state.isTerminal()) {
                throw invalid(current, event);
            }
            return new SessionSnapshot(SessionState.CANCELLED, current.attemptsUsed(), current.maxAttempts());
        }

        return switch (state) {
            case PENDING -> {
                if (event != VerificationEvent.START)
                    throw invalid(current, event);
                yield new SessionSnapshot(SessionState.CAPTURING, 0, current.maxAttempts());
            }
            case CAPTURING -> {
                if (event != VerificationEvent.SUBMIT_SAMPLE)
                    throw invalid(current, event);
                yield new SessionSnapshot(SessionState.VERIFYING, current.attemptsUsed(), current.maxAttempts());
            }
            case VERIFYING -> switch (event) {
                case VERIFICATION_SUCCEEDED -> new SessionSnapshot(SessionState.COMPLETED,
                        current.attemptsUsed() + 1, current.maxAttempts());
                case VERIFICATION_FAILED -> {
                    int used = current.attemptsUsed() + 1;
                    SessionState next = used < current.maxAttempts() ? SessionState.CAPTURING : SessionState.FAILED;
                    yield new SessionSnapshot(next, used, current.maxAttempts());
                }
                case PROVIDER_UNAVAILABLE -> new SessionSnapshot(SessionState.CAPTURING,
                        current.attemptsUsed(), current.maxAttempts());
                default -> throw invalid(current, event);
            };
            case COMPLETED, FAILED, CANCELLED -> throw invalid(current, event);
        };
    }

    private static InvalidSessionStateException invalid(SessionSnapshot current, VerificationEvent event) {
        return new InvalidSessionStateException("Event " + event + " not allowed in state " + current.state());
    }
}
