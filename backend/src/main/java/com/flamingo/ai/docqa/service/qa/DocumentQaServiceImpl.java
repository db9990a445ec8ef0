package com.flamingo.ai.docqa.service.qa;

import com.flamingo.ai.docqa.config.RagConfig;
import com.flamingo.ai.docqa.domain.entity.Document;
import com.flamingo.ai.docqa.domain.entity.QueryRecord;
import com.flamingo.ai.docqa.domain.enums.FailureKind;
import com.flamingo.ai.docqa.exception.IndexBuildSupersededException;
import com.flamingo.ai.docqa.exception.NoActiveDocumentException;
import com.flamingo.ai.docqa.exception.PipelineException;
import com.flamingo.ai.docqa.service.rag.chunking.DocumentChunker;
import com.flamingo.ai.docqa.service.rag.index.DocumentIndex;
import com.flamingo.ai.docqa.service.rag.index.IndexBuilder;
import com.flamingo.ai.docqa.service.rag.model.ChunkSpan;
import com.flamingo.ai.docqa.service.rag.model.ScoredChunk;
import com.flamingo.ai.docqa.service.rag.model.SynthesizedAnswer;
import com.flamingo.ai.docqa.service.rag.retrieval.Retriever;
import com.flamingo.ai.docqa.service.rag.synthesis.AnswerSynthesizer;
import com.flamingo.ai.docqa.service.state.ActiveDocument;
import com.flamingo.ai.docqa.service.state.BuildTicket;
import com.flamingo.ai.docqa.service.state.DocumentStateManager;
import com.flamingo.ai.docqa.service.storage.DocumentStorageService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of the DocumentQaService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentQaServiceImpl implements DocumentQaService {

  private final DocumentChunker documentChunker;
  private final IndexBuilder indexBuilder;
  private final Retriever retriever;
  private final AnswerSynthesizer answerSynthesizer;
  private final DocumentStateManager stateManager;
  private final DocumentStorageService storageService;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "qa.upload", description = "Time to index an uploaded document")
  public UploadResult upload(String fileName, String text) {
    long startNanos = System.nanoTime();
    BuildTicket ticket = stateManager.beginBuild();

    RagConfig.Chunking chunking = ragConfig.getChunking();
    List<ChunkSpan> spans =
        documentChunker.chunk(text, chunking.getSize(), chunking.getOverlap());
    log.info(
        "Indexing {} ({} chars, {} chunks), build {}",
        fileName,
        text.length(),
        spans.size(),
        ticket.sequence());

    Document document = storageService.saveDocument(fileName, text);
    DocumentIndex index = indexBuilder.build(document, spans);

    if (!stateManager.publish(ticket, document, index)) {
      meterRegistry.counter("document.superseded").increment();
      throw new IndexBuildSupersededException(document.getId(), fileName);
    }

    Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
    meterRegistry.counter("document.indexed").increment();
    log.info(
        "Document {} ({}) is active: {} chunks indexed in {} ms",
        document.getId(),
        fileName,
        index.size(),
        elapsed.toMillis());
    return new UploadResult(document.getId(), fileName, index.size(), elapsed);
  }

  @Override
  @Timed(value = "qa.ask", description = "Time to answer a question")
  public AnswerResult ask(String question) {
    Optional<ActiveDocument> snapshot = stateManager.snapshot();
    if (snapshot.isEmpty()) {
      recordFailure(question, null, FailureKind.NO_ACTIVE_DOCUMENT);
      throw new NoActiveDocumentException();
    }
    ActiveDocument active = snapshot.get();
    Document document = active.document();

    try {
      List<ScoredChunk> chunks =
          retriever.retrieve(active.index(), question, ragConfig.getRetrieval().getTopK());
      SynthesizedAnswer synthesized = answerSynthesizer.synthesize(question, chunks);

      storageService.appendQueryRecord(
          QueryRecord.answered(
              question, synthesized.answer(), synthesized.confidence(), document.getId()));
      meterRegistry.counter("qa.ask.success").increment();
      log.info(
          "Answered question against {} with confidence {} ({})",
          document.getFileName(),
          String.format("%.2f", synthesized.confidence()),
          synthesized.level());

      return new AnswerResult(
          synthesized.answer(),
          synthesized.confidence(),
          synthesized.level(),
          document.getId(),
          document.getFileName(),
          synthesized.sources());
    } catch (PipelineException e) {
      recordFailure(question, document.getId(), e.getFailureKind());
      throw e;
    }
  }

  @Override
  public Optional<ActiveDocument> activeDocument() {
    return stateManager.snapshot();
  }

  @Override
  public List<QueryRecord> recentQueries(int limit) {
    return storageService.recentQueryRecords(limit);
  }

  private void recordFailure(String question, UUID documentId, FailureKind failureKind) {
    meterRegistry
        .counter("qa.ask.failure", "kind", failureKind.name().toLowerCase(Locale.ROOT))
        .increment();
    log.warn("Question could not be answered ({}), document {}", failureKind, documentId);
    try {
      storageService.appendQueryRecord(QueryRecord.failed(question, documentId, failureKind));
    } catch (RuntimeException e) {
      // The pipeline failure is what the caller must see
      log.warn("Failed to record unanswered question ({}): {}", failureKind, e.getMessage(), e);
    }
  }
}
