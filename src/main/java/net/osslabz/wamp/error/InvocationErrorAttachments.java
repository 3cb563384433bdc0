package net.osslabz.wamp.error;

import java.lang.ref.Reference;
import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;


/**
 * Associates arbitrary failures with the {@link InvocationException} that should be reported for them, without the
 * failure's own class knowing about it.
 * <p>
 * Keys are compared by identity, never by {@code equals}, and are only weakly referenced: an attachment disappears
 * once its failure has been garbage collected.
 * <p>
 * Values are held strongly. An attached error whose cause chain or fields reach its own failure (for example after
 * {@code error.initCause(failure)}) keeps that failure reachable, and the entry stays until it is removed with
 * {@link #detach(Throwable)}.
 */
final class InvocationErrorAttachments {

    private final Map<IdentityKey, InvocationException> attachments = new ConcurrentHashMap<>();

    private final ReferenceQueue<Throwable> collected = new ReferenceQueue<>();


    /**
     * @return the attachment that was replaced, or null
     */
    InvocationException attach(Throwable failure, InvocationException error) {

        Objects.requireNonNull(failure, "failure");
        Objects.requireNonNull(error, "error");

        expungeCollected();
        return this.attachments.put(new IdentityKey(failure, this.collected), error);
    }


    Optional<InvocationException> find(Throwable failure) {

        expungeCollected();
        return Optional.ofNullable(this.attachments.get(new IdentityKey(failure, null)));
    }


    /**
     * @return the attachment that was removed, or null
     */
    InvocationException detach(Throwable failure) {

        expungeCollected();
        return this.attachments.remove(new IdentityKey(failure, null));
    }


    int size() {

        expungeCollected();
        return this.attachments.size();
    }


    private void expungeCollected() {

        Reference<? extends Throwable> ref;
        while ((ref = this.collected.poll()) != null) {
            this.attachments.remove(ref);
        }
    }


    private static final class IdentityKey extends WeakReference<Throwable> {

        private final int hash;


        IdentityKey(Throwable referent, ReferenceQueue<Throwable> queue) {

            super(referent, queue);
            this.hash = System.identityHashCode(referent);
        }


        @Override
        public boolean equals(Object o) {

            if (this == o) {
                return true;
            }
            if (!(o instanceof IdentityKey other)) {
                return false;
            }
            Throwable referent = get();
            return referent != null && referent == other.get();
        }


        @Override
        public int hashCode() {

            return hash;
        }
    }
}
