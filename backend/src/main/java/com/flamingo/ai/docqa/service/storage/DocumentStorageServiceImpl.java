package com.flamingo.ai.docqa.service.storage;

import com.flamingo.ai.docqa.domain.entity.Document;
import com.flamingo.ai.docqa.domain.entity.QueryRecord;
import com.flamingo.ai.docqa.domain.repository.DocumentRepository;
import com.flamingo.ai.docqa.domain.repository.QueryRecordRepository;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDateTime;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** JPA-backed implementation of {@link DocumentStorageService}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentStorageServiceImpl implements DocumentStorageService {

  private static final int MAX_PAGE_SIZE = 200;

  private final DocumentRepository documentRepository;
  private final QueryRecordRepository queryRecordRepository;

  @Override
  @Transactional
  @Timed(value = "storage.saveDocument", description = "Time to persist a document")
  public Document saveDocument(String fileName, String text) {
    Document saved =
        documentRepository.save(
            Document.builder()
                .fileName(fileName)
                .content(text)
                .uploadedAt(LocalDateTime.now())
                .build());
    log.debug("Stored document {} ({} chars) with ID: {}", fileName, text.length(), saved.getId());
    return saved;
  }

  @Override
  @Transactional
  public void appendQueryRecord(QueryRecord record) {
    QueryRecord saved = queryRecordRepository.save(record);
    log.debug(
        "Appended query record {} (document={}, failure={})",
        saved.getId(),
        saved.getDocumentId(),
        saved.getFailureKind());
  }

  @Override
  @Transactional(readOnly = true)
  public List<QueryRecord> recentQueryRecords(int limit) {
    int size = Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
    return queryRecordRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, size));
  }
}
