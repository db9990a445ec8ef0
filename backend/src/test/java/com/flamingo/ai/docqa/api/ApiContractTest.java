package com.flamingo.ai.docqa.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.docqa.api.dto.request.AskRequest;
import com.flamingo.ai.docqa.api.rest.DocumentQaController;
import com.flamingo.ai.docqa.api.rest.HealthController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.multipart.MultipartFile;

/**
 * Contract tests pinning the public endpoints the frontend calls.
 *
 * <ul>
 *   <li>GET / - Liveness
 *   <li>POST /upload - Upload a PDF (multipart field {@code file})
 *   <li>POST /ask - Ask a question about the active document
 *   <li>GET /document - Describe the active document
 *   <li>GET /queries - Recent questions
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("DocumentQaController API contract")
  class DocumentQaControllerContract {

    @Test
    @DisplayName("should be mapped at the root without a prefix")
    void shouldHaveNoClassLevelPrefix() {
      assertThat(DocumentQaController.class.getAnnotation(RequestMapping.class)).isNull();
    }

    @Test
    @DisplayName("should accept multipart uploads on POST /upload")
    void shouldMapUpload() throws NoSuchMethodException {
      PostMapping mapping =
          DocumentQaController.class
              .getMethod("upload", MultipartFile.class)
              .getAnnotation(PostMapping.class);
      assertThat(mapping.value()).containsExactly("/upload");
      assertThat(mapping.consumes()).containsExactly("multipart/form-data");
    }

    @Test
    @DisplayName("should answer on POST /ask")
    void shouldMapAsk() throws NoSuchMethodException {
      PostMapping mapping =
          DocumentQaController.class
              .getMethod("ask", AskRequest.class)
              .getAnnotation(PostMapping.class);
      assertThat(mapping.value()).containsExactly("/ask");
    }

    @Test
    @DisplayName("should expose GET /document and GET /queries")
    void shouldMapReadEndpoints() throws NoSuchMethodException {
      assertThat(
              DocumentQaController.class
                  .getMethod("activeDocument")
                  .getAnnotation(GetMapping.class)
                  .value())
          .containsExactly("/document");
      assertThat(
              DocumentQaController.class
                  .getMethod("recentQueries", int.class)
                  .getAnnotation(GetMapping.class)
                  .value())
          .containsExactly("/queries");
    }
  }

  @Nested
  @DisplayName("HealthController API contract")
  class HealthControllerContract {

    @Test
    @DisplayName("should answer on GET /")
    void shouldMapRoot() throws NoSuchMethodException {
      GetMapping mapping = HealthController.class.getMethod("root").getAnnotation(GetMapping.class);
      assertThat(mapping.value()).containsExactly("/");
    }
  }
}
