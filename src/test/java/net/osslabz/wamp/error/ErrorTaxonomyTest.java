package net.osslabz.wamp.error;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.osslabz.wamp.Uri;
import net.osslabz.wamp.message.AbortMessage;
import net.osslabz.wamp.message.ErrorMessage;
import net.osslabz.wamp.message.WampMessageTypes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;


class ErrorTaxonomyTest {

    @Nested
    @DisplayName("ErrorResponseException")
    class ErrorResponse {

        private ErrorMessage message(List<?> args, Map<String, ?> kwargs) {

            return new ErrorMessage(WampMessageTypes.CALL, 1L, Map.of(), Uri.of("com.example.error"), args, kwargs);
        }


        @Test
        void rendersArgumentsAndKeywords() {

            Map<String, Object> kwargs = new LinkedHashMap<>();
            kwargs.put("a", 1);
            kwargs.put("b", "two");

            ErrorResponseException exception = new ErrorResponseException(message(List.of(1, "x"), kwargs));

            assertThat(exception.getMessage()).isEqualTo("com.example.error 1, \"x\" (a=1, b=\"two\")");
        }


        @Test
        void omitsKeywordSectionWhenEmpty() {

            ErrorResponseException exception = new ErrorResponseException(message(List.of(1, "x"), Map.of()));

            assertThat(exception.getMessage()).isEqualTo("com.example.error 1, \"x\"");
        }


        @Test
        void omitsArgumentSectionWhenEmpty() {

            ErrorResponseException exception = new ErrorResponseException(message(null, Map.of("a", 1)));

            assertThat(exception.getMessage()).isEqualTo("com.example.error (a=1)");
        }


        @Test
        void quotesStringsInsideNestedValues() {

            ErrorResponseException exception = new ErrorResponseException(
                message(List.of(List.of("a", 1), Map.of("k", "v")), Map.of("tags", List.of("x"))));

            assertThat(exception.getMessage()).isEqualTo("com.example.error [\"a\", 1], {k=\"v\"} (tags=[\"x\"])");
        }


        @Test
        void rendersBareUri() {

            assertThat(new ErrorResponseException(message(null, null)).getMessage()).isEqualTo("com.example.error");
        }
    }


    @Nested
    @DisplayName("InterruptException")
    class Interrupt {

        @Test
        void readsCancelModeFromOptions() {

            InterruptException interrupt = new InterruptException(Map.of("mode", "kill"));

            assertThat(interrupt.getCancelMode()).isEqualTo(CancelMode.KILL);
            assertThat(interrupt.getCancelMode().getValue()).isEqualTo("kill");
        }


        @Test
        void knowsEveryCancelMode() {

            assertThat(new InterruptException(Map.of("mode", "skip")).getCancelMode()).isEqualTo(CancelMode.SKIP);
            assertThat(new InterruptException(Map.of("mode", "killnowait")).getCancelMode())
                .isEqualTo(CancelMode.KILL_NO_WAIT);
        }


        @Test
        void acceptsCancelModeValue() {

            InterruptException interrupt = new InterruptException(Map.of("mode", CancelMode.KILL_NO_WAIT));

            assertThat(interrupt.getCancelMode()).isEqualTo(CancelMode.KILL_NO_WAIT);
        }


        @Test
        void missingModeIsInvalid() {

            InterruptException interrupt = new InterruptException(Map.of());

            assertThatThrownBy(interrupt::getCancelMode).isInstanceOf(InvalidMessageException.class);
        }


        @Test
        void unknownModeIsInvalid() {

            InterruptException interrupt = new InterruptException(Map.of("mode", "explode"));

            assertThatThrownBy(interrupt::getCancelMode)
                .isInstanceOf(InvalidMessageException.class)
                .hasMessageContaining("explode");
        }


        @Test
        void debugFormShowsOptions() {

            assertThat(new InterruptException(Map.of("mode", "kill")).toString())
                .isEqualTo("InterruptException(options={mode=kill})");
        }
    }


    @Test
    void abortCarriesReasonAndDetails() {

        AbortMessage abort = new AbortMessage(Map.of("message", "no such realm"), Uri.of("wamp.error.no_such_realm"));

        AbortException exception = new AbortException(abort);

        assertThat(exception.getReason()).isEqualTo(Uri.of("wamp.error.no_such_realm"));
        assertThat(exception.getDetails()).containsEntry("message", "no such realm");
        assertThat(exception.getMessage()).isEqualTo("wamp.error.no_such_realm (details = {message=no such realm})");
    }


    @Test
    void unexpectedMessageNamesBothSides() {

        AbortMessage received = new AbortMessage(Map.of(), Uri.of("wamp.close.goodbye_and_out"));

        UnexpectedMessageException exception = new UnexpectedMessageException(received, ErrorMessage.class);

        assertThat(exception).isInstanceOf(InvalidMessageException.class);
        assertThat(exception.getReceived()).isSameAs(received);
        assertThat(exception.getExpected()).isEqualTo(ErrorMessage.class);
        assertThat(exception.getMessage()).isEqualTo(
            "received message AbortMessage[details={}, reason=wamp.close.goodbye_and_out] "
                + "but expected message of type ErrorMessage");
    }


    @Test
    void everyVariantIsAWampException() {

        assertThat(List.of(
            new TransportException("lost"),
            new AuthException("denied"),
            new ClientClosedException(),
            new InvalidMessageException("garbled")))
            .allMatch(WampException.class::isInstance);
    }
}
