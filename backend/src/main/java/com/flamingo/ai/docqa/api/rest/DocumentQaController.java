package com.flamingo.ai.docqa.api.rest;

import com.flamingo.ai.docqa.api.dto.request.AskRequest;
import com.flamingo.ai.docqa.api.dto.response.AnswerResponse;
import com.flamingo.ai.docqa.api.dto.response.DocumentResponse;
import com.flamingo.ai.docqa.api.dto.response.QueryRecordResponse;
import com.flamingo.ai.docqa.api.dto.response.UploadResponse;
import com.flamingo.ai.docqa.exception.NoActiveDocumentException;
import com.flamingo.ai.docqa.service.ingestion.DocumentIngestionService;
import com.flamingo.ai.docqa.service.ingestion.ExtractedUpload;
import com.flamingo.ai.docqa.service.qa.AnswerResult;
import com.flamingo.ai.docqa.service.qa.DocumentQaService;
import com.flamingo.ai.docqa.service.qa.UploadResult;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for uploading a document and asking questions about it. */
@RestController
@RequiredArgsConstructor
public class DocumentQaController {

  private final DocumentIngestionService ingestionService;
  private final DocumentQaService documentQaService;

  /** Uploads a PDF and makes it the active document. */
  @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<UploadResponse> upload(@RequestParam("file") MultipartFile file) {
    ExtractedUpload upload = ingestionService.ingest(file);
    UploadResult result = documentQaService.upload(upload.fileName(), upload.text());
    return ResponseEntity.status(HttpStatus.CREATED).body(UploadResponse.from(upload, result));
  }

  /** Answers a question from the active document. */
  @PostMapping("/ask")
  public ResponseEntity<AnswerResponse> ask(@Valid @RequestBody AskRequest request) {
    AnswerResult result = documentQaService.ask(request.getQuestion());
    return ResponseEntity.ok(AnswerResponse.from(result));
  }

  /** Gets the active document. */
  @GetMapping("/document")
  public ResponseEntity<DocumentResponse> activeDocument() {
    return documentQaService
        .activeDocument()
        .map(DocumentResponse::fromActive)
        .map(ResponseEntity::ok)
        .orElseThrow(NoActiveDocumentException::new);
  }

  /** Gets the most recent questions, newest first. */
  @GetMapping("/queries")
  public ResponseEntity<List<QueryRecordResponse>> recentQueries(
      @RequestParam(defaultValue = "20") int limit) {
    List<QueryRecordResponse> responses =
        documentQaService.recentQueries(limit).stream()
            .map(QueryRecordResponse::fromEntity)
            .toList();
    return ResponseEntity.ok(responses);
  }
}
