/* (C)2026 */
package com.ammann.blockstats.websocket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.ammann.blockstats.enumeration.ClientMessageType;
import com.ammann.blockstats.enumeration.SubscriptionChannel;
import com.ammann.blockstats.exception.ValidationException;
import com.ammann.blockstats.exception.ValidationException.FieldError;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ClientMessageParserTest {

    private final ClientMessageParser parser = new ClientMessageParser(new ObjectMapper());

    private ValidationException reject(String text) {
        return catchThrowableOfType(() -> parser.parse(text), ValidationException.class);
    }

    @Nested
    @DisplayName("Valid messages")
    class ValidMessages {

        @Test
        void subscribeToChannels() {
            assertThat(parser.parse("{\"type\":\"subscribe\",\"channel\":\"blocks\"}"))
                    .isEqualTo(new ClientMessage.SubscribeBlocks());
            assertThat(parser.parse("{\"type\":\"subscribe\",\"channel\":\"stats\"}"))
                    .isEqualTo(new ClientMessage.SubscribeStats());
            assertThat(parser.parse("{\"type\":\"subscribe\",\"channel\":\"block\",\"slot\":42}"))
                    .isEqualTo(new ClientMessage.SubscribeBlock(42));
        }

        @Test
        void subscribeBlockAcceptsBlockNumberOrSlot() {
            assertThat(parser.parse("{\"type\":\"subscribeBlock\",\"blockNumber\":7}"))
                    .isEqualTo(new ClientMessage.SubscribeBlock(7));
            assertThat(parser.parse("{\"type\":\"subscribeBlock\",\"slot\":8}"))
                    .isEqualTo(new ClientMessage.SubscribeBlock(8));
        }

        @Test
        void unsubscribe() {
            assertThat(parser.parse("{\"type\":\"unsubscribe\",\"channel\":\"stats\"}"))
                    .isEqualTo(new ClientMessage.Unsubscribe(SubscriptionChannel.STATS, null));
            assertThat(parser.parse("{\"type\":\"unsubscribe\",\"channel\":\"block\",\"slot\":3}"))
                    .isEqualTo(new ClientMessage.Unsubscribe(SubscriptionChannel.BLOCK, 3L));
        }

        @Test
        void getLatestBlocksDefaultsLimit() {
            assertThat(parser.parse("{\"type\":\"getLatestBlocks\"}"))
                    .isEqualTo(new ClientMessage.GetLatestBlocks(10));
            assertThat(parser.parse("{\"type\":\"getLatestBlocks\",\"limit\":100}"))
                    .isEqualTo(new ClientMessage.GetLatestBlocks(100));
        }

        @Test
        void unknownFieldsAreIgnored() {
            ClientMessage message = parser.parse("{\"type\":\"getStats\",\"windowSize\":20}");

            assertThat(message.type()).isEqualTo(ClientMessageType.GET_STATS);
        }
    }

    @Nested
    @DisplayName("Rejected messages")
    class RejectedMessages {

        @Test
        void invalidJson() {
            assertThatThrownBy(() -> parser.parse("{not json"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Invalid JSON message");
        }

        @Test
        void notAnObject() {
            assertThat(reject("[1,2]").getErrors()).hasSize(1);
            assertThat(reject("null")).isNotNull();
        }

        @Test
        void unknownType() {
            ValidationException e = reject("{\"type\":\"explode\"}");

            assertThat(e.getMessage()).isEqualTo("Validation failed");
            assertThat(e.getErrors()).extracting(FieldError::path).containsExactly("type");
        }

        @Test
        void blockChannelNeedsSlot() {
            ValidationException e = reject("{\"type\":\"subscribe\",\"channel\":\"block\"}");

            assertThat(e.getErrors()).extracting(FieldError::path).containsExactly("slot");
        }

        @Test
        void unknownChannel() {
            ValidationException e = reject("{\"type\":\"subscribe\",\"channel\":\"mempool\"}");

            assertThat(e.getErrors()).extracting(FieldError::path).containsExactly("channel");
        }

        @Test
        void subscribeBlockNeedsANumber() {
            ValidationException e = reject("{\"type\":\"subscribeBlock\"}");

            assertThat(e.getErrors()).extracting(FieldError::path).containsExactly("blockNumber");
        }

        @Test
        void numbersMustBePositiveIntegers() {
            assertThat(reject("{\"type\":\"subscribeBlock\",\"blockNumber\":0}").getErrors())
                    .extracting(FieldError::path)
                    .containsExactly("blockNumber");
            assertThat(reject("{\"type\":\"subscribeBlock\",\"blockNumber\":\"12\"}").getErrors())
                    .extracting(FieldError::path)
                    .containsExactly("blockNumber");
            assertThat(reject("{\"type\":\"subscribeBlock\",\"blockNumber\":1.5}").getErrors())
                    .extracting(FieldError::path)
                    .containsExactly("blockNumber");
        }

        @Test
        void limitOutOfRange() {
            assertThat(reject("{\"type\":\"getLatestBlocks\",\"limit\":101}").getErrors())
                    .extracting(FieldError::path)
                    .containsExactly("limit");
            assertThat(reject("{\"type\":\"getLatestBlocks\",\"limit\":0}").getErrors())
                    .extracting(FieldError::path)
                    .containsExactly("limit");
        }
    }
}
