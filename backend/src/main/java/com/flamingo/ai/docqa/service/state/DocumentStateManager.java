package com.flamingo.ai.docqa.service.state;

import com.flamingo.ai.docqa.domain.entity.Document;
import com.flamingo.ai.docqa.domain.enums.DocumentState;
import com.flamingo.ai.docqa.service.rag.index.DocumentIndex;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Owns the single active document/index pair.
 *
 * <p>Readers take one {@link #snapshot()} per request and work against it; a concurrent upload
 * replaces the pair with a single reference swap and never touches the old index. Builds are
 * ordered by {@link BuildTicket}: a build that finishes after a newer build has already been
 * published is abandoned instead of overwriting the newer document.
 */
@Component
@Slf4j
public class DocumentStateManager {

  private final AtomicReference<ActiveDocument> active = new AtomicReference<>();
  private final AtomicLong ticketSequence = new AtomicLong();

  private final Object publishLock = new Object();
  private long lastPublishedSequence; // guarded by publishLock

  /** Registers the start of an index build. */
  public BuildTicket beginBuild() {
    BuildTicket ticket = new BuildTicket(ticketSequence.incrementAndGet(), Instant.now());
    log.debug("Issued build ticket {}", ticket.sequence());
    return ticket;
  }

  /**
   * Makes a fully built index the active one.
   *
   * @param ticket ticket obtained from {@link #beginBuild()} before the build started
   * @param document the document the index was built from
   * @param index the complete index
   * @return {@code true} if the pair is now active, {@code false} if the build was abandoned
   *     because a newer build had already been published
   */
  public boolean publish(BuildTicket ticket, Document document, DocumentIndex index) {
    Instant now = Instant.now();
    ActiveDocument next = new ActiveDocument(document, index, now);
    synchronized (publishLock) {
      if (ticket.isOlderThan(lastPublishedSequence)) {
        log.warn(
            "Abandoning index build {} for document {} ({}) after {} ms: build {} was already"
                + " published",
            ticket.sequence(),
            document.getId(),
            document.getFileName(),
            ticket.elapsed(now).toMillis(),
            lastPublishedSequence);
        return false;
      }
      lastPublishedSequence = ticket.sequence();
      ActiveDocument previous = active.getAndSet(next);
      log.info(
          "Active document is now {} ({}, {} chunks){}",
          document.getId(),
          document.getFileName(),
          index.size(),
          previous == null ? "" : ", replacing " + previous.document().getId());
    }
    return true;
  }

  /** The active pair as one consistent snapshot. */
  public Optional<ActiveDocument> snapshot() {
    return Optional.ofNullable(active.get());
  }

  public Optional<Document> currentDocument() {
    return snapshot().map(ActiveDocument::document);
  }

  public Optional<DocumentIndex> currentIndex() {
    return snapshot().map(ActiveDocument::index);
  }

  public DocumentState state() {
    return active.get() == null ? DocumentState.EMPTY : DocumentState.READY;
  }
}
