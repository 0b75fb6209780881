package com.threadfeedback.slackfeedback.persistence;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface FeedbackRecordRepository extends JpaRepository<FeedbackRecordEntity, Long> {

  List<FeedbackRecordEntity> findAllByOrderBySubmittedAtDescIdDesc();
}
