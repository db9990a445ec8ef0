package com.flamingo.ai.docqa.service.rag.chunking;

import com.flamingo.ai.docqa.exception.EmptyInputException;
import com.flamingo.ai.docqa.service.rag.model.ChunkSpan;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentChunker} that cuts at the most meaningful boundary that fits the window.
 *
 * <p>Every chunk is an exact span of the source text. For each window of {@code targetSize}
 * characters the cut is placed at the last paragraph break ({@code \n\n}) in the second half of the
 * window, else at the last sentence end there, else at the last word boundary, else mid-word at the
 * window edge. The next chunk starts {@code overlap} characters before the cut, moved forward to
 * the next word start so that words are not split in the shared region.
 */
@Service
@Slf4j
public class ParagraphAwareChunker implements DocumentChunker {

  @Override
  public List<ChunkSpan> chunk(String text, int targetSize, int overlap) {
    if (text == null || text.isBlank()) {
      throw new EmptyInputException("Cannot chunk empty or whitespace-only text");
    }
    if (targetSize <= 0) {
      throw new IllegalArgumentException("targetSize must be positive: " + targetSize);
    }
    if (overlap < 0 || overlap >= targetSize) {
      throw new IllegalArgumentException(
          String.format("overlap must be in [0, %d): %d", targetSize, overlap));
    }

    int textEnd = trimEnd(text, 0, text.length());
    int start = skipWhitespace(text, 0, textEnd);
    int previousEnd = -1;
    List<ChunkSpan> chunks = new ArrayList<>();

    while (start < textEnd) {
      int end;
      if (textEnd - start <= targetSize) {
        end = textEnd;
      } else {
        end = trimEnd(text, start, findCut(text, start, targetSize, overlap));
      }

      int overlapChars = previousEnd > start ? previousEnd - start : 0;
      chunks.add(new ChunkSpan(chunks.size(), text.substring(start, end), start, overlapChars));

      if (end >= textEnd) {
        break;
      }
      previousEnd = end;
      start = nextStart(text, start, end, overlap);
    }

    log.debug(
        "Chunked {} chars into {} chunks (targetSize={}, overlap={})",
        text.length(),
        chunks.size(),
        targetSize,
        overlap);
    return chunks;
  }

  // ---- cut selection ----

  /** Returns the exclusive end of the chunk starting at {@code start}. */
  private int findCut(String text, int start, int targetSize, int overlap) {
    int limit = start + targetSize;
    // A cut must leave room for progress once the overlap is stepped back
    int earliest = start + overlap + 1;
    int preferred = Math.max(earliest, start + targetSize / 2);

    int cut = lastBoundary(text, preferred, limit, BoundaryType.PARAGRAPH);
    if (cut < 0) {
      cut = lastBoundary(text, preferred, limit, BoundaryType.SENTENCE);
    }
    if (cut < 0) {
      cut = lastBoundary(text, earliest, limit, BoundaryType.WORD);
    }
    return cut < 0 ? limit : cut;
  }

  private int lastBoundary(String text, int from, int to, BoundaryType type) {
    for (int pos = to; pos >= from; pos--) {
      if (type.matches(text, pos)) {
        return pos;
      }
    }
    return -1;
  }

  private int nextStart(String text, int start, int end, int overlap) {
    if (overlap == 0) {
      return skipWhitespace(text, end, text.length());
    }
    int candidate = Math.max(start + 1, end - overlap);
    // Do not begin the overlap mid-word
    if (candidate > 0
        && !Character.isWhitespace(text.charAt(candidate - 1))
        && !Character.isWhitespace(text.charAt(candidate))) {
      while (candidate < end && !Character.isWhitespace(text.charAt(candidate))) {
        candidate++;
      }
    }
    candidate = skipWhitespace(text, candidate, end);
    if (candidate >= end) {
      return skipWhitespace(text, end, text.length());
    }
    return candidate;
  }

  // ---- helpers ----

  private static int skipWhitespace(String text, int from, int to) {
    int pos = from;
    while (pos < to && Character.isWhitespace(text.charAt(pos))) {
      pos++;
    }
    return pos;
  }

  private static int trimEnd(String text, int start, int end) {
    int pos = end;
    while (pos > start && Character.isWhitespace(text.charAt(pos - 1))) {
      pos--;
    }
    return pos;
  }

  /** Kinds of cut positions, strongest first. A position is the exclusive end of a chunk. */
  private enum BoundaryType {
    PARAGRAPH {
      @Override
      boolean matches(String text, int pos) {
        if (pos <= 0 || pos >= text.length() || text.charAt(pos) != '\n') {
          return false;
        }
        int next = pos + 1;
        while (next < text.length() && (text.charAt(next) == ' ' || text.charAt(next) == '\t')) {
          next++;
        }
        return next < text.length() && text.charAt(next) == '\n';
      }
    },
    SENTENCE {
      @Override
      boolean matches(String text, int pos) {
        if (pos <= 0 || pos > text.length()) {
          return false;
        }
        char previous = text.charAt(pos - 1);
        boolean terminator = previous == '.' || previous == '!' || previous == '?';
        return terminator && (pos == text.length() || Character.isWhitespace(text.charAt(pos)));
      }
    },
    WORD {
      @Override
      boolean matches(String text, int pos) {
        return pos > 0
            && pos < text.length()
            && Character.isWhitespace(text.charAt(pos))
            && !Character.isWhitespace(text.charAt(pos - 1));
      }
    };

    abstract boolean matches(String text, int pos);
  }
}
