package com.meltwater.rxinflight;

import rx.Single;
import rx.subjects.AsyncSubject;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A single shot completion signal for one {@link Delivery}.
 *
 * The handle settles at most once. Later attempts are ignored and reported by returning false.
 * Subscribers of {@link #outcome()} receive the outcome even if they subscribe after it was settled.
 */
public class CompletionHandle {

    private final AsyncSubject<ProcessingOutcome> subject = AsyncSubject.create();
    private final AtomicBoolean settled = new AtomicBoolean(false);
    private volatile ProcessingOutcome current = ProcessingOutcome.PENDING;
    private volatile Throwable cause;

    public boolean succeed() {
        return settle(ProcessingOutcome.SUCCESS, null);
    }

    public boolean fail() {
        return settle(ProcessingOutcome.FAILURE, null);
    }

    public boolean fail(Throwable cause) {
        return settle(ProcessingOutcome.FAILURE, cause);
    }

    /**
     * @param outcome {@link ProcessingOutcome#SUCCESS} or {@link ProcessingOutcome#FAILURE}
     * @param cause optional failure cause, kept for logging
     * @return true if this call settled the handle, false if it was already settled
     */
    public boolean settle(ProcessingOutcome outcome, Throwable cause) {
        if (outcome == null || outcome == ProcessingOutcome.PENDING) {
            throw new IllegalArgumentException("A completion handle can only settle with SUCCESS or FAILURE, got " + outcome);
        }
        if (!settled.compareAndSet(false, true)) {
            return false;
        }
        this.cause = cause;
        this.current = outcome;
        subject.onNext(outcome);
        subject.onCompleted();
        return true;
    }

    public boolean isSettled() {
        return settled.get();
    }

    /**
     * @return the settled outcome, or {@link ProcessingOutcome#PENDING} if nothing has been reported yet
     */
    public ProcessingOutcome current() {
        return current;
    }

    /**
     * @return the failure cause passed when settling, null if none was given
     */
    public Throwable cause() {
        return cause;
    }

    /**
     * @return a single emitting the outcome once the handle is settled
     */
    public Single<ProcessingOutcome> outcome() {
        return subject.toSingle();
    }

    @Override
    public String toString() {
        return "CompletionHandle{" + current + "}";
    }
}
