package com.gentoro.jsonflow.tree;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.jsonflow.exception.StreamDecodeException;
import com.gentoro.jsonflow.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringWriter;
import org.apache.commons.lang3.StringUtils;

/**
 * Reads a whole byte or character stream and decodes it into a single JSON tree. Bytes must be
 * valid UTF-8. The stream is read to completion but not closed.
 */
public final class JsonTreeDecoder {
  private static final String EMPTY_INPUT = "Input stream is empty";

  private final ObjectMapper mapper;

  public JsonTreeDecoder() {
    this(JacksonUtility.getJsonMapper());
  }

  public JsonTreeDecoder(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public JsonNode decode(InputStream in) {
    byte[] bytes;
    try {
      bytes = in.readAllBytes();
    } catch (IOException e) {
      throw new StreamDecodeException("Failed to read input stream: " + e.getMessage(), e);
    }
    if (isBlank(bytes)) {
      throw new StreamDecodeException(EMPTY_INPUT);
    }
    try {
      // the byte parser rejects invalid UTF-8 sequences
      return mapper.readTree(bytes);
    } catch (JsonProcessingException e) {
      throw new StreamDecodeException("Malformed JSON input: " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new StreamDecodeException("Failed to decode input stream: " + e.getMessage(), e);
    }
  }

  public JsonNode decode(Reader reader) {
    StringWriter text = new StringWriter();
    try {
      reader.transferTo(text);
    } catch (IOException e) {
      throw new StreamDecodeException("Failed to read input stream: " + e.getMessage(), e);
    }
    return decode(text.toString());
  }

  public JsonNode decode(String text) {
    if (StringUtils.isBlank(text)) {
      throw new StreamDecodeException(EMPTY_INPUT);
    }
    try {
      return mapper.readTree(text);
    } catch (JsonProcessingException e) {
      throw new StreamDecodeException("Malformed JSON input: " + e.getOriginalMessage(), e);
    }
  }

  private static boolean isBlank(byte[] bytes) {
    for (byte b : bytes) {
      if (b != ' ' && b != '\t' && b != '\n' && b != '\r') {
        return false;
      }
    }
    return true;
  }
}
