package com.social100.cipherrelay.audit;

/**
 * External audit collaborator. Not part of relay correctness: implementations must not throw, and
 * nothing the relay does depends on a record having been stored.
 */
public interface AuditSink extends AutoCloseable {

  AuditSink NONE = event -> {
  };

  void record(AuditEvent event);

  @Override
  default void close() {
  }
}
