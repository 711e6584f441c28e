package com.scholary.livefeed.queue;

public enum JobStatus {
  WAITING,
  PROCESSING,
  COMPLETED,
  FAILED
}
