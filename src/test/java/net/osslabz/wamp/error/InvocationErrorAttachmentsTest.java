package net.osslabz.wamp.error;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;


class InvocationErrorAttachmentsTest {

    /**
     * Two instances that are equal by {@code equals} must still get separate attachments.
     */
    static class EqualByMessageException extends RuntimeException {

        EqualByMessageException(String message) {

            super(message);
        }


        @Override
        public boolean equals(Object o) {

            return o instanceof EqualByMessageException other && other.getMessage().equals(getMessage());
        }


        @Override
        public int hashCode() {

            return getMessage().hashCode();
        }
    }


    private final InvocationErrorAttachments attachments = new InvocationErrorAttachments();


    @Test
    void keysByIdentity() {

        EqualByMessageException first = new EqualByMessageException("same");
        EqualByMessageException second = new EqualByMessageException("same");
        InvocationException error = new InvocationException("com.example.error");

        attachments.attach(first, error);

        assertThat(first).isEqualTo(second);
        assertThat(attachments.find(first)).containsSame(error);
        assertThat(attachments.find(second)).isEmpty();
    }


    @Test
    void reattachingReplacesAndReturnsPrevious() {

        IllegalStateException failure = new IllegalStateException();
        InvocationException first = new InvocationException("com.example.first");
        InvocationException second = new InvocationException("com.example.second");

        assertThat(attachments.attach(failure, first)).isNull();
        assertThat(attachments.attach(failure, second)).isSameAs(first);
        assertThat(attachments.find(failure)).containsSame(second);
        assertThat(attachments.size()).isEqualTo(1);
    }


    @Test
    @Timeout(10)
    void attachmentOfCollectedFailureIsDropped() throws InterruptedException {

        attachUnreachableFailure();

        assertThat(awaitEmpty()).isZero();
    }


    @Test
    void selfReferencingAttachmentIsRemovedByDetach() {

        IllegalStateException failure = new IllegalStateException("boom");
        InvocationException error = new InvocationException("com.example.error");
        error.initCause(failure);

        attachments.attach(failure, error);

        assertThat(attachments.detach(failure)).isSameAs(error);
        assertThat(attachments.find(failure)).isEmpty();
        assertThat(attachments.size()).isZero();
    }


    @Test
    void detachWithoutAttachmentReturnsNull() {

        assertThat(attachments.detach(new IllegalStateException())).isNull();
    }


    private void attachUnreachableFailure() {

        attachments.attach(new IllegalStateException("gone"), new InvocationException("com.example.error"));
    }


    private int awaitEmpty() throws InterruptedException {

        for (int i = 0; i < 50 && attachments.size() > 0; i++) {
            System.gc();
            Thread.sleep(20);
        }
        return attachments.size();
    }
}
