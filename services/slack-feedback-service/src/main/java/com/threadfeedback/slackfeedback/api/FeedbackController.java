package com.threadfeedback.slackfeedback.api;

import com.threadfeedback.slackfeedback.api.dto.FeedbackRecordView;
import com.threadfeedback.slackfeedback.api.dto.FeedbackSubmissionRequest;
import com.threadfeedback.slackfeedback.persistence.FeedbackRecordService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class FeedbackController {

  private final FeedbackRecordService records;

  public FeedbackController(FeedbackRecordService records) {
    this.records = records;
  }

  @GetMapping("/feedback")
  public Map<String, List<FeedbackRecordView>> list() {
    return Map.of("feedback", records.listAll().stream().map(FeedbackRecordView::from).toList());
  }

  @PostMapping("/feedback")
  @ResponseStatus(HttpStatus.CREATED)
  public Map<String, Object> submit(@Valid @RequestBody FeedbackSubmissionRequest request) {
    FeedbackRecordView saved = FeedbackRecordView.from(records.record(request));
    return Map.of("status", "success", "received", saved);
  }
}
