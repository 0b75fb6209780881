package com.threadfeedback.slackfeedback.event;

import com.threadfeedback.slackfeedback.workflow.ActionReply;
import com.threadfeedback.slackfeedback.workflow.FeedbackWorkflow;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Dispatches parsed deliveries to the feedback workflow and shapes the webhook response. */
@Component
@Slf4j
public class SlackEventRouter {

  private final FeedbackWorkflow workflow;

  public SlackEventRouter(FeedbackWorkflow workflow) {
    this.workflow = workflow;
  }

  public Map<String, Object> routeEvent(SlackEvent event) {
    if (event instanceof SlackEvent.Challenge challenge) {
      return Map.of("challenge", challenge.token());
    }
    if (event instanceof SlackEvent.Message message) {
      workflow.onTrigger(message);
      return Map.of("status", "ok");
    }
    if (event instanceof SlackEvent.Ignored ignored) {
      log.debug("Ignored Slack event ({})", ignored.reason());
    }
    return Map.of("status", "ok");
  }

  public Map<String, Object> routeAction(ActionEvent action) {
    ActionReply reply = workflow.onAction(action);
    return reply.hasText() ? Map.of("text", reply.text()) : Map.of();
  }
}
