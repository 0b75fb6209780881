package com.threadfeedback.slackfeedback.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class SlackPayloadParserTest {

  private final SlackPayloadParser parser = new SlackPayloadParser(new ObjectMapper());

  @Test
  void urlVerificationBecomesChallenge() {
    SlackEvent event =
        parser.parseEvent("{\"type\":\"url_verification\",\"challenge\":\"3eZbrw1aBm2rZgRNFdxV\"}");

    assertThat(event).isEqualTo(new SlackEvent.Challenge("3eZbrw1aBm2rZgRNFdxV"));
  }

  @Test
  void topLevelMessageUsesOwnTsAsThread() {
    SlackEvent event =
        parser.parseEvent(
            "{\"type\":\"event_callback\",\"event\":{\"type\":\"message\",\"user\":\"U1\","
                + "\"channel\":\"C1\",\"text\":\"feedback please\",\"ts\":\"1700.0001\"}}");

    assertThat(event)
        .isEqualTo(
            new SlackEvent.Message("C1", "U1", "feedback please", "1700.0001", "1700.0001"));
  }

  @Test
  void threadedReplyKeepsParentThread() {
    SlackEvent event =
        parser.parseEvent(
            "{\"type\":\"event_callback\",\"event\":{\"type\":\"message\",\"user\":\"U1\","
                + "\"channel\":\"C1\",\"text\":\"hi\",\"ts\":\"1700.0009\","
                + "\"thread_ts\":\"1700.0001\"}}");

    assertThat(event).isInstanceOf(SlackEvent.Message.class);
    assertThat(((SlackEvent.Message) event).threadTs()).isEqualTo("1700.0001");
  }

  @Test
  void botEchoesAndSubtypesAreIgnored() {
    SlackEvent subtype =
        parser.parseEvent(
            "{\"type\":\"event_callback\",\"event\":{\"type\":\"message\","
                + "\"subtype\":\"bot_message\",\"text\":\"feedback\",\"ts\":\"1\"}}");
    SlackEvent botId =
        parser.parseEvent(
            "{\"type\":\"event_callback\",\"event\":{\"type\":\"message\",\"bot_id\":\"B1\","
                + "\"user\":\"U9\",\"channel\":\"C1\",\"text\":\"feedback\",\"ts\":\"1\"}}");

    assertThat(subtype).isInstanceOf(SlackEvent.Ignored.class);
    assertThat(botId).isInstanceOf(SlackEvent.Ignored.class);
  }

  @Test
  void otherEventTypesAreIgnored() {
    assertThat(
            parser.parseEvent(
                "{\"type\":\"event_callback\",\"event\":{\"type\":\"reaction_added\"}}"))
        .isInstanceOf(SlackEvent.Ignored.class);
    assertThat(parser.parseEvent("{\"type\":\"app_rate_limited\"}"))
        .isInstanceOf(SlackEvent.Ignored.class);
  }

  @Test
  void malformedJsonIsRejected() {
    assertThatThrownBy(() -> parser.parseEvent("{not json"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> parser.parseEvent(""))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void staticSelectActionCarriesSelectedOption() {
    ActionEvent action =
        parser
            .parseAction(
                form(
                    "{\"type\":\"block_actions\",\"user\":{\"id\":\"U1\",\"username\":\"ann\"},"
                        + "\"channel\":{\"id\":\"C1\"},"
                        + "\"container\":{\"type\":\"message\",\"message_ts\":\"1700.0005\","
                        + "\"channel_id\":\"C1\",\"thread_ts\":\"1700.0001\"},"
                        + "\"actions\":[{\"action_id\":\"rating_select\","
                        + "\"selected_option\":{\"value\":\"4\"}}]}"))
            .orElseThrow();

    assertThat(action)
        .isEqualTo(
            new ActionEvent(
                ActionKind.RATING_SELECTED,
                "rating_select",
                "U1",
                "ann",
                "C1",
                "1700.0005",
                "1700.0001",
                "4"));
  }

  @Test
  void textInputAndButtonValues() {
    ActionEvent text =
        parser
            .parseAction(
                form(
                    "{\"type\":\"block_actions\",\"user\":{\"id\":\"U1\"},"
                        + "\"channel\":{\"id\":\"C1\"},"
                        + "\"container\":{\"message_ts\":\"1700.0005\"},"
                        + "\"message\":{\"ts\":\"1700.0005\",\"thread_ts\":\"1700.0001\"},"
                        + "\"actions\":[{\"action_id\":\"feedback_text\","
                        + "\"value\":\"great support & more\"}]}"))
            .orElseThrow();
    ActionEvent button =
        parser
            .parseAction(
                form(
                    "{\"type\":\"block_actions\",\"user\":{\"id\":\"U1\"},"
                        + "\"container\":{\"message_ts\":\"1700.0002\",\"channel_id\":\"C1\"},"
                        + "\"actions\":[{\"action_id\":\"show_form\",\"value\":\"yes\"}]}"))
            .orElseThrow();

    assertThat(text.kind()).isEqualTo(ActionKind.COMMENT_ENTERED);
    assertThat(text.value()).isEqualTo("great support & more");
    assertThat(text.threadTs()).isEqualTo("1700.0001");

    assertThat(button.kind()).isEqualTo(ActionKind.SHOW_FORM);
    assertThat(button.channelId()).isEqualTo("C1");
    assertThat(button.threadTs()).isEqualTo("1700.0002");
  }

  @Test
  void submitCarriesCurrentFormInputs() {
    ActionEvent submit =
        parser
            .parseAction(
                form(
                    "{\"type\":\"block_actions\",\"user\":{\"id\":\"U1\"},"
                        + "\"container\":{\"message_ts\":\"1700.0005\",\"channel_id\":\"C1\","
                        + "\"thread_ts\":\"1700.0001\"},"
                        + "\"state\":{\"values\":{"
                        + "\"feedback_form\":{\"rating_select\":{\"type\":\"static_select\","
                        + "\"selected_option\":{\"value\":\"4\"}}},"
                        + "\"feedback_comment\":{\"feedback_text\":{"
                        + "\"type\":\"plain_text_input\","
                        + "\"value\":\"great support\"}}}},"
                        + "\"actions\":[{\"action_id\":\"submit_feedback\","
                        + "\"value\":\"submit\"}]}"))
            .orElseThrow();

    assertThat(submit.kind()).isEqualTo(ActionKind.SUBMIT);
    assertThat(submit.formState()).isEqualTo(new FormState("4", "great support"));
  }

  @Test
  void emptyInputsInStateAreReportedAsBlank() {
    ActionEvent submit =
        parser
            .parseAction(
                form(
                    "{\"type\":\"block_actions\",\"user\":{\"id\":\"U1\"},"
                        + "\"container\":{\"message_ts\":\"1700.0005\",\"channel_id\":\"C1\"},"
                        + "\"state\":{\"values\":{"
                        + "\"feedback_form\":{\"rating_select\":{\"type\":\"static_select\","
                        + "\"selected_option\":null}},"
                        + "\"feedback_comment\":{\"feedback_text\":{"
                        + "\"type\":\"plain_text_input\","
                        + "\"value\":null}}}},"
                        + "\"actions\":[{\"action_id\":\"submit_feedback\","
                        + "\"value\":\"submit\"}]}"))
            .orElseThrow();

    assertThat(submit.formState()).isEqualTo(new FormState(null, ""));
  }

  @Test
  void unknownActionIdMapsToUnknownKind() {
    ActionEvent action =
        parser
            .parseAction(
                form(
                    "{\"type\":\"block_actions\",\"user\":{\"id\":\"U1\"},"
                        + "\"container\":{\"message_ts\":\"1\",\"channel_id\":\"C1\"},"
                        + "\"actions\":[{\"action_id\":\"open_dashboard\"}]}"))
            .orElseThrow();

    assertThat(action.kind()).isEqualTo(ActionKind.UNKNOWN);
    assertThat(action.actionId()).isEqualTo("open_dashboard");
  }

  @Test
  void nonBlockActionPayloadsYieldNothing() {
    assertThat(parser.parseAction(form("{\"type\":\"view_submission\"}"))).isEmpty();
    assertThat(parser.parseAction(form("{\"type\":\"block_actions\",\"actions\":[]}"))).isEmpty();
  }

  @Test
  void missingPayloadFieldIsRejected() {
    assertThatThrownBy(() -> parser.parseAction("token=abc"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static String form(String payloadJson) {
    return "token=legacy&payload=" + URLEncoder.encode(payloadJson, StandardCharsets.UTF_8);
  }
}
