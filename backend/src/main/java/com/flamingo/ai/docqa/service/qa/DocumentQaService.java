package com.flamingo.ai.docqa.service.qa;

import com.flamingo.ai.docqa.domain.entity.QueryRecord;
import com.flamingo.ai.docqa.service.state.ActiveDocument;
import java.util.List;
import java.util.Optional;

/** Service interface for uploading a document and asking questions about it. */
public interface DocumentQaService {

  /**
   * Indexes extracted text and makes it the active document.
   *
   * @param fileName original filename; duplicates are allowed
   * @param text extracted plain text
   * @return identifier, chunk count and build time of the new document
   * @throws com.flamingo.ai.docqa.exception.EmptyInputException if the text is blank
   * @throws com.flamingo.ai.docqa.exception.EmbeddingUnavailableException if indexing fails
   * @throws com.flamingo.ai.docqa.exception.IndexBuildSupersededException if a newer upload was
   *     published first
   */
  UploadResult upload(String fileName, String text);

  /**
   * Answers a question from the active document.
   *
   * @param question the question
   * @return the answer with confidence and sources
   * @throws com.flamingo.ai.docqa.exception.NoActiveDocumentException if nothing was uploaded
   * @throws com.flamingo.ai.docqa.exception.NoContextException if nothing relevant was retrieved
   */
  AnswerResult ask(String question);

  /**
   * Gets the document questions are currently answered from.
   *
   * @return the active document, if any
   */
  Optional<ActiveDocument> activeDocument();

  /**
   * Gets the most recent question log entries, newest first.
   *
   * @param limit maximum number of entries
   * @return recent entries
   */
  List<QueryRecord> recentQueries(int limit);
}
