package com.flamingo.ai.docqa.service.storage;

import com.flamingo.ai.docqa.domain.entity.Document;
import com.flamingo.ai.docqa.domain.entity.QueryRecord;
import java.util.List;

/**
 * Persists document metadata and the question log.
 *
 * <p>Independent of the in-memory index lifecycle: a saved document is not necessarily the active
 * one.
 */
public interface DocumentStorageService {

  /**
   * Stores a newly uploaded document.
   *
   * @param fileName original filename; duplicates are allowed
   * @param text extracted plain text
   * @return the persisted document with its generated identifier
   */
  Document saveDocument(String fileName, String text);

  /**
   * Appends an entry to the question log.
   *
   * @param record the record to append
   */
  void appendQueryRecord(QueryRecord record);

  /**
   * Returns the newest log entries first.
   *
   * @param limit maximum number of records
   * @return recent records
   */
  List<QueryRecord> recentQueryRecords(int limit);
}
