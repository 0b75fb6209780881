package com.threadfeedback.slackfeedback.persistence;

import jakarta.persistence.*;
import java.time.Instant;
import org.hibernate.Hibernate;

/** A finished feedback response. Written once, never updated. */
@Entity
@Table(name = "feedback_records")
public class FeedbackRecordEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "channel_id", nullable = false, length = 32)
  private String channelId;

  @Column(name = "channel_name", length = 128)
  private String channelName;

  @Column(name = "thread_ts", nullable = false, length = 32)
  private String threadTs;

  @Column(name = "user_id", nullable = false, length = 32)
  private String userId;

  @Column(name = "user_name", length = 128)
  private String userName;

  @Column(name = "rating", nullable = false)
  private int rating;

  @Column(name = "comments", columnDefinition = "text")
  private String comments;

  @Column(name = "ticket_id", length = 64)
  private String ticketId;

  @Column(name = "correlation_id", length = 128)
  private String correlationId;

  @Column(name = "submitted_at", nullable = false)
  private Instant submittedAt;

  protected FeedbackRecordEntity() {}

  public FeedbackRecordEntity(
      String channelId,
      String channelName,
      String threadTs,
      String userId,
      String userName,
      int rating,
      String comments,
      String ticketId,
      String correlationId,
      Instant submittedAt) {
    this.channelId = channelId;
    this.channelName = channelName;
    this.threadTs = threadTs;
    this.userId = userId;
    this.userName = userName;
    this.rating = rating;
    this.comments = comments;
    this.ticketId = ticketId;
    this.correlationId = correlationId;
    this.submittedAt = submittedAt;
  }

  @PrePersist
  public void prePersist() {
    if (submittedAt == null) {
      submittedAt = Instant.now();
    }
  }

  public Long getId() {
    return id;
  }

  public String getChannelId() {
    return channelId;
  }

  public String getChannelName() {
    return channelName;
  }

  public String getThreadTs() {
    return threadTs;
  }

  public String getUserId() {
    return userId;
  }

  public String getUserName() {
    return userName;
  }

  public int getRating() {
    return rating;
  }

  public String getComments() {
    return comments;
  }

  public String getTicketId() {
    return ticketId;
  }

  public String getCorrelationId() {
    return correlationId;
  }

  public Instant getSubmittedAt() {
    return submittedAt;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || Hibernate.getClass(this) != Hibernate.getClass(o)) return false;
    FeedbackRecordEntity that = (FeedbackRecordEntity) o;
    return id != null && id.equals(that.id);
  }

  @Override
  public int hashCode() {
    return getClass().hashCode();
  }
}
