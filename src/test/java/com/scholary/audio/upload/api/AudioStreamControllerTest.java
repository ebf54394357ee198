package com.scholary.audio.upload.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.audio.upload.objectstore.ObjectStoreException;
import com.scholary.audio.upload.streaming.StreamedObject;
import com.scholary.audio.upload.streaming.StreamingProxy;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@WebMvcTest(AudioStreamController.class)
class AudioStreamControllerTest {

  private static final String KEY = "audio/lesson-1/0_1700000000000.mp3";

  @Autowired private MockMvc mockMvc;

  @MockBean private StreamingProxy streamingProxy;

  @Test
  void stream_shouldRelayPartialContent() throws Exception {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Accept-Ranges", "bytes");
    headers.put("Content-Range", "bytes 0-4/10");
    headers.put("Content-Type", "audio/mpeg");
    headers.put("Content-Length", "5");
    when(streamingProxy.open(KEY, "bytes=0-4"))
        .thenReturn(new StreamedObject(206, headers, body("hello")));

    MvcResult result =
        mockMvc
            .perform(get("/api/audio/stream/" + KEY).header("Range", "bytes=0-4"))
            .andExpect(request().asyncStarted())
            .andReturn();

    mockMvc
        .perform(asyncDispatch(result))
        .andExpect(status().isPartialContent())
        .andExpect(header().string("Content-Range", "bytes 0-4/10"))
        .andExpect(header().string("Accept-Ranges", "bytes"))
        .andExpect(content().bytes("hello".getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void stream_shouldPassWholeRemainingPathAsKey() throws Exception {
    when(streamingProxy.open(eq(KEY), isNull()))
        .thenReturn(new StreamedObject(200, Map.of("Content-Type", "audio/mpeg"), body("abc")));

    MvcResult result =
        mockMvc.perform(get("/api/audio/stream/" + KEY)).andExpect(request().asyncStarted()).andReturn();

    mockMvc
        .perform(asyncDispatch(result))
        .andExpect(status().isOk())
        .andExpect(content().bytes("abc".getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void stream_shouldAnswerUnsatisfiableRangeWithoutBody() throws Exception {
    when(streamingProxy.open(KEY, "bytes=100-200"))
        .thenReturn(
            new StreamedObject(
                416, Map.of("Content-Range", "bytes */10", "Accept-Ranges", "bytes"), body("")));

    mockMvc
        .perform(get("/api/audio/stream/" + KEY).header("Range", "bytes=100-200"))
        .andExpect(status().isRequestedRangeNotSatisfiable())
        .andExpect(header().string("Content-Range", "bytes */10"));
  }

  @Test
  void stream_shouldMapMissingObjectToNotFound() throws Exception {
    when(streamingProxy.open(any(), any()))
        .thenThrow(ObjectStoreException.notFound("Object not found: key=" + KEY, null));

    mockMvc
        .perform(get("/api/audio/stream/" + KEY))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("NotFound"));
  }

  private static ByteArrayInputStream body(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }
}
