package com.scholary.chaptify.emit;

import com.scholary.chaptify.timecode.ChapterMarker;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Writes chapter markers in ffmpeg's metadata file format.
 *
 * <p>Format:
 *
 * <pre>
 * ;FFMETADATA1
 *
 * [CHAPTER]
 * TIMEBASE=1/1000
 * START=0
 * END=754210
 * title=Chapter 1
 * </pre>
 *
 * <p>In values, {@code =}, {@code ;}, {@code #}, {@code \} and newlines are escaped with a
 * backslash. Output uses {@code \n} line endings regardless of platform.
 */
@Component
public class ChapterMarkerEmitter {

  static final String HEADER = ";FFMETADATA1";

  /** Serialize markers to ffmetadata text. */
  public String emit(List<ChapterMarker> markers) {
    StringWriter writer = new StringWriter();
    try {
      write(markers, writer);
    } catch (IOException e) {
      // StringWriter does not throw
      throw new UncheckedIOException(e);
    }
    return writer.toString();
  }

  /**
   * Serialize markers to a caller-supplied destination.
   *
   * @param markers the chapters in order
   * @param writer the destination; not closed
   * @throws IOException if writing fails
   */
  public void write(List<ChapterMarker> markers, Writer writer) throws IOException {
    writer.write(HEADER);
    writer.write('\n');

    for (ChapterMarker marker : markers) {
      writer.write("\n[CHAPTER]\n");
      writer.write("TIMEBASE=1/1000\n");
      writer.write("START=" + marker.startMs() + "\n");
      writer.write("END=" + marker.endMs() + "\n");
      writer.write("title=" + escape(marker.title()) + "\n");
    }
    writer.flush();
  }

  static String escape(String value) {
    String text = value.replace("\r\n", "\n").replace('\r', '\n');
    StringBuilder escaped = new StringBuilder(text.length() + 8);
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '=' || c == ';' || c == '#' || c == '\\' || c == '\n') {
        escaped.append('\\');
      }
      escaped.append(c);
    }
    return escaped.toString();
  }
}
