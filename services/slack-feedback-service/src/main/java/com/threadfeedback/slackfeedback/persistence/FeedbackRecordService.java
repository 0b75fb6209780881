package com.threadfeedback.slackfeedback.persistence;

import com.threadfeedback.slackfeedback.api.dto.FeedbackSubmissionRequest;
import com.threadfeedback.slackfeedback.config.FeedbackProperties;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class FeedbackRecordService {

  private final FeedbackRecordRepository repository;
  private final FeedbackProperties properties;
  private final Clock clock;

  /** Most recent first. */
  @Transactional(readOnly = true)
  public List<FeedbackRecordEntity> listAll() {
    return repository.findAllByOrderBySubmittedAtDescIdDesc();
  }

  @Transactional
  public FeedbackRecordEntity record(FeedbackSubmissionRequest req) {
    if (!properties.isValidRating(req.rating())) {
      throw new IllegalArgumentException(
          "rating must be between "
              + properties.ratingMin()
              + " and "
              + properties.ratingMax());
    }
    FeedbackRecordEntity saved =
        repository.save(
            new FeedbackRecordEntity(
                req.channelId(),
                req.channelName(),
                req.threadTs(),
                req.userId(),
                req.userName(),
                req.rating(),
                req.comments() == null ? "" : req.comments(),
                req.ticketId(),
                req.correlationId(),
                clock.instant()));
    log.info("Direct feedback stored (record id={})", saved.getId());
    return saved;
  }
}
