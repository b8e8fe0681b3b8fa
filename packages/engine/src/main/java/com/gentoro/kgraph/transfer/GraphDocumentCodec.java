package com.gentoro.kgraph.transfer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.kgraph.exception.SerializationException;
import com.gentoro.kgraph.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Locale;

/** Reads and writes {@link GraphDocument}s as JSON (the interchange format) or YAML. */
public final class GraphDocumentCodec {

  public enum Format {
    JSON,
    YAML;

    /** Format implied by a file name; anything but {@code .yaml}/{@code .yml} is JSON. */
    public static Format forFileName(String fileName) {
      String name = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
      return name.endsWith(".yaml") || name.endsWith(".yml") ? YAML : JSON;
    }
  }

  private GraphDocumentCodec() {}

  public static String write(GraphDocument document) {
    return write(document, Format.JSON);
  }

  public static String write(GraphDocument document, Format format) {
    try {
      return mapper(format).writeValueAsString(document);
    } catch (JsonProcessingException e) {
      throw new SerializationException("Failed to write graph document as " + format, e);
    }
  }

  public static void write(GraphDocument document, OutputStream out, Format format) {
    try {
      mapper(format).writeValue(out, document);
    } catch (IOException e) {
      throw new SerializationException("Failed to write graph document as " + format, e);
    }
  }

  public static GraphDocument read(String text) {
    return read(text, Format.JSON);
  }

  public static GraphDocument read(String text, Format format) {
    try {
      return mapper(format).readValue(text, GraphDocument.class);
    } catch (JsonProcessingException e) {
      throw new SerializationException("Malformed graph document (" + format + ")", e);
    }
  }

  public static GraphDocument read(InputStream in, Format format) {
    try {
      return mapper(format).readValue(in, GraphDocument.class);
    } catch (IOException e) {
      throw new SerializationException("Malformed graph document (" + format + ")", e);
    }
  }

  private static ObjectMapper mapper(Format format) {
    return format == Format.YAML ? JacksonUtility.getYamlMapper() : JacksonUtility.getJsonMapper();
  }
}
